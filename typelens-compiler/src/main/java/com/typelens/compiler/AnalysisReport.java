package com.typelens.compiler;

import com.typelens.compiler.analysis.SymbolTable;
import com.typelens.compiler.analysis.UndeclaredReference;
import com.typelens.compiler.ast.decl.Module;

import java.util.Collections;
import java.util.List;

/**
 * 分析报告。失败时 tree / symbolTable 为 null，error 为 "类别: 消息"。
 */
public final class AnalysisReport {

    private final boolean success;
    private final Module tree;
    private final SymbolTable symbolTable;
    private final List<UndeclaredReference> undeclaredReferences;
    private final String error;
    private final String codeHash;
    private final List<String> codePatterns;

    private AnalysisReport(boolean success, Module tree, SymbolTable symbolTable,
                           List<UndeclaredReference> undeclaredReferences, String error, String codeHash,
                           List<String> codePatterns) {
        this.success = success;
        this.tree = tree;
        this.symbolTable = symbolTable;
        this.undeclaredReferences = Collections.unmodifiableList(undeclaredReferences);
        this.error = error;
        this.codeHash = codeHash;
        this.codePatterns = Collections.unmodifiableList(codePatterns);
    }

    static AnalysisReport success(Module tree, SymbolTable table, List<UndeclaredReference> undeclared,
                                  String codeHash, List<String> codePatterns) {
        return new AnalysisReport(true, tree, table, undeclared, null, codeHash, codePatterns);
    }

    static AnalysisReport failure(String error, String codeHash, List<String> codePatterns) {
        return new AnalysisReport(false, null, null, Collections.<UndeclaredReference>emptyList(), error, codeHash,
                codePatterns);
    }

    public boolean isSuccess() { return success; }
    public Module getTree() { return tree; }
    public SymbolTable getSymbolTable() { return symbolTable; }
    public List<UndeclaredReference> getUndeclaredReferences() { return undeclaredReferences; }
    public String getError() { return error; }
    public String getCodeHash() { return codeHash; }
    /** 源码中的赋值、调用与控制流模式，见 {@link CodeFingerprint#extractPatterns} */
    public List<String> getCodePatterns() { return codePatterns; }
}
