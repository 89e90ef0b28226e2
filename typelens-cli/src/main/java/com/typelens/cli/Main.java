package com.typelens.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * TypeLens CLI 入口点（picocli）
 *
 * <p>退出码：0 成功，1 分析或 I/O 失败，2 参数错误。</p>
 */
@Command(name = "typelens", version = "TypeLens v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {AnalyzeCommand.class, AnnotateCommand.class, AstCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 未指定子命令
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        String charsetName = getConsoleCharsetName();
        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = commandLine();
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(commandLine().execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名（native.encoding，缺失时取默认编码）
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
