package com.typelens.cli;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 读取单个源码文件的子命令基类
 */
abstract class SourceCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(SourceCommand.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "源码文件路径")
    String file;

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /** 读取源码；失败时打印错误并返回 null */
    String readSource() {
        return readText(file);
    }

    String readText(String filePath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            err().println("错误: 文件不存在 - " + filePath);
            return null;
        }
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "读取失败: " + filePath, e);
            err().println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return null;
        }
    }

    String fileName() {
        Path name = Paths.get(file).getFileName();
        return name != null ? name.toString() : file;
    }
}
