package com.typelens.compiler.analysis;

/**
 * 导入符号
 */
public final class ImportSymbol extends Symbol {

    public enum ImportKind {
        IMPORT("import"),
        FROM_IMPORT("from_import");

        private final String displayName;

        ImportKind(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final String module;          // 纯相对导入时为 null
    private final String originalName;    // 仅 from-import
    private final String alias;           // 可选
    private final ImportKind importKind;
    private final int level;

    public ImportSymbol(String boundName, String module, String originalName, String alias,
                        int line, ImportKind importKind, int level) {
        super(boundName, line);
        this.module = module;
        this.originalName = originalName;
        this.alias = alias;
        this.importKind = importKind;
        this.level = level;
    }

    @Override
    public SymbolKind getKind() { return SymbolKind.IMPORT; }

    public String getModule() { return module; }
    public String getOriginalName() { return originalName; }
    public String getAlias() { return alias; }
    public ImportKind getImportKind() { return importKind; }

    /** 相对导入的前导点个数 */
    public int getLevel() { return level; }
}
