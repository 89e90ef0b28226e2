package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.ClassPyType;
import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.analysis.types.PyTypes;
import com.typelens.compiler.ast.AstScanner;
import com.typelens.compiler.ast.SourcePrinter;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 符号表构建器：单次深度优先遍历，用显式作用域链登记声明。
 *
 * <p>函数体 / 类体进入时压入作用域，退出时弹出。赋值右侧的类型
 * 由 {@link TypeInferenceEngine} 在遍历时按当前符号表计算。</p>
 *
 * <p>实例保存单次构建的状态，不可并发使用。</p>
 */
public final class SymbolTableBuilder extends AstScanner<Void> {

    private static final Logger LOG = Logger.getLogger(SymbolTableBuilder.class.getName());

    private final TypeInferenceEngine engine;
    private SymbolTable table;
    private Scope currentScope;

    public SymbolTableBuilder() {
        this(new TypeInferenceEngine());
    }

    public SymbolTableBuilder(TypeInferenceEngine engine) {
        this.engine = engine;
    }

    /** 构建入口 */
    public SymbolTable build(Module module) {
        table = new SymbolTable();
        currentScope = table.getGlobalScope();
        try {
            scan(module, null);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("符号表: " + table.getFunctions().size() + " 个函数, "
                        + table.getClasses().size() + " 个类, "
                        + table.getVariables().size() + " 个变量, "
                        + table.getImports().size() + " 个导入");
            }
            return table;
        } finally {
            table = null;
            currentScope = null;
        }
    }

    // ============ 辅助 ============

    private int depth() {
        return currentScope.getDepth();
    }

    /** 当前位置的推断上下文：符号表 + 外围函数的参数 / 接收者类型 */
    private InferenceContext context() {
        return new InferenceContext(table).withBindings(currentScope.collectLocalTypes());
    }

    private PyType infer(Expression expr) {
        return engine.infer(expr, context());
    }

    /** 注解文本；字符串形式的前向引用取其内容 */
    static String annotationText(Expression annotation) {
        if (annotation == null) return null;
        if (annotation instanceof Literal
                && ((Literal) annotation).getLiteralKind() == Literal.LiteralKind.STRING) {
            return String.valueOf(((Literal) annotation).getValue());
        }
        return SourcePrinter.print(annotation);
    }

    private static List<String> decoratorNames(List<Expression> decorators) {
        List<String> names = new ArrayList<String>(decorators.size());
        for (Expression d : decorators) {
            names.add(SourcePrinter.dottedName(d));
        }
        return names;
    }

    /** 把目标中出现的名称登记为当前作用域的绑定 */
    private void bindNames(Expression target) {
        if (target instanceof Identifier) {
            Identifier id = (Identifier) target;
            currentScope.defineIfAbsent(new ScopeEntry(id.getName(), SymbolKind.BINDING, id.getLine(), null));
        } else if (target instanceof CollectionLiteral) {
            for (Expression e : ((CollectionLiteral) target).getElements()) {
                bindNames(e);
            }
        } else if (target instanceof StarredExpr) {
            bindNames(((StarredExpr) target).getValue());
        }
    }

    private void defineVariable(VariableSymbol variable) {
        table.defineVariable(variable);
        currentScope.define(new ScopeEntry(variable.getName(), SymbolKind.VARIABLE, variable.getLine(), variable));
    }

    /** self.attr 形式的实例属性目标所属的类，不是时返回 null */
    private ClassSymbol attributeOwner(Expression target) {
        if (!(target instanceof MemberExpr)) return null;
        Expression receiver = ((MemberExpr) target).getTarget();
        String receiverName = currentScope.getReceiverName();
        if (receiverName == null || !(receiver instanceof Identifier)
                || !receiverName.equals(((Identifier) receiver).getName())) {
            return null;
        }
        return table.getClass(currentScope.getOwnerTypeName());
    }

    // ============ 声明 ============

    @Override
    public Void visitFunctionDef(FunctionDef node, Void ctx) {
        scanAll(node.getDecorators(), ctx);
        for (Parameter p : node.getParams()) {
            scan(p.getDefaultValue(), ctx);
        }

        List<FunctionSymbol.ParameterInfo> params = new ArrayList<FunctionSymbol.ParameterInfo>();
        for (Parameter p : node.getParams()) {
            PyType defaultType = p.hasDefaultValue() ? infer(p.getDefaultValue()) : null;
            params.add(new FunctionSymbol.ParameterInfo(p.getName(), p.getParamKind(),
                    annotationText(p.getAnnotation()), defaultType));
        }
        String owner = currentScope.getType() == Scope.ScopeType.CLASS ? currentScope.getOwnerTypeName() : null;
        FunctionSymbol fn = new FunctionSymbol(node.getName(), node.getLine(), params,
                annotationText(node.getReturns()), decoratorNames(node.getDecorators()),
                depth(), node.isAsync(), owner);
        table.defineFunction(fn);
        currentScope.define(new ScopeEntry(node.getName(), SymbolKind.FUNCTION, node.getLine(), fn));
        if (owner != null) {
            ClassSymbol cls = table.getClass(owner);
            if (cls != null) cls.addMethod(node.getName());
        }

        Scope fnScope = new Scope(Scope.ScopeType.FUNCTION, currentScope, node);
        currentScope.addChild(fnScope);
        declareParameters(fnScope, node.getParams(), params, owner, fn.isStaticMethod());

        Scope saved = currentScope;
        currentScope = fnScope;
        try {
            scanAll(node.getBody(), ctx);
            recordReturns(node, fn);
        } finally {
            currentScope = saved;
        }

        List<String> locals = new ArrayList<String>();
        for (ScopeEntry entry : fnScope.getEntries().values()) {
            if (entry.getKind() != SymbolKind.PARAMETER) locals.add(entry.getName());
        }
        fn.addLocalNames(locals);
        return null;
    }

    /**
     * 参数登记到函数作用域；注解 > 默认值类型 > 命名启发式 > Any 作为函数体内的局部类型。
     * 方法的第一个参数（staticmethod 除外）视为接收者，类型为所在类。
     */
    private void declareParameters(Scope fnScope, List<Parameter> nodes,
                                   List<FunctionSymbol.ParameterInfo> params, String owner, boolean isStatic) {
        for (int i = 0; i < nodes.size(); i++) {
            Parameter p = nodes.get(i);
            FunctionSymbol.ParameterInfo info = params.get(i);
            fnScope.define(new ScopeEntry(p.getName(), SymbolKind.PARAMETER, p.getLine(), null));
            PyType type;
            if (info.getAnnotation() != null) {
                type = PyTypes.parse(info.getAnnotation());
            } else if (info.hasDefault() && TypeUnifier.isConcrete(info.getDefaultType())) {
                type = info.getDefaultType();
            } else {
                PyType guess = BuiltinRegistry.guessTypeFromName(p.getName());
                type = guess != null ? guess : PyTypes.ANY;
            }
            switch (p.getParamKind()) {
                case VAR_POSITIONAL: type = PyTypes.TUPLE; break;
                case VAR_KEYWORD: type = PyTypes.DICT; break;
                default: break;
            }
            fnScope.setLocalType(p.getName(), type);
        }
        if (owner != null) {
            fnScope.setOwnerTypeName(owner);
            if (!isStatic && !nodes.isEmpty() && !nodes.get(0).isVariadic()) {
                String receiver = nodes.get(0).getName();
                fnScope.setReceiverName(receiver);
                if (nodes.get(0).getAnnotation() == null) {
                    fnScope.setLocalType(receiver, new ClassPyType(owner));
                }
            }
        }
    }

    /** 统一函数体内全部 return 值的类型；没有 return 值的生成器得到 Generator[...] */
    private void recordReturns(FunctionDef node, FunctionSymbol fn) {
        ReturnCollector collector = new ReturnCollector();
        collector.collect(node);
        InferenceContext ctx = context();

        List<PyType> returnTypes = new ArrayList<PyType>();
        for (Expression value : collector.returnValues) {
            returnTypes.add(engine.infer(value, ctx));
        }
        fn.setHasValueReturn(!returnTypes.isEmpty());
        fn.setGenerator(!collector.yields.isEmpty());

        if (!returnTypes.isEmpty()) {
            fn.setInferredReturnType(PyTypes.union(returnTypes));
        } else if (!collector.yields.isEmpty()) {
            List<PyType> yieldTypes = new ArrayList<PyType>();
            for (YieldExpr y : collector.yields) {
                if (y.getValue() == null) {
                    yieldTypes.add(PyTypes.NONE);
                } else if (y.isDelegate()) {
                    yieldTypes.add(engine.elementTypeOf(engine.infer(y.getValue(), ctx)));
                } else {
                    yieldTypes.add(engine.infer(y.getValue(), ctx));
                }
            }
            PyType elem = engine.getUnifier().unify(yieldTypes);
            fn.setInferredReturnType(PyTypes.generatorOf(TypeUnifier.isConcrete(elem) ? elem : PyTypes.ANY));
        }
    }

    @Override
    public Void visitClassDef(ClassDef node, Void ctx) {
        scanAll(node.getDecorators(), ctx);
        scanAll(node.getBases(), ctx);
        scanAll(node.getKeywords(), ctx);

        List<String> bases = new ArrayList<String>();
        for (Expression base : node.getBases()) {
            bases.add(SourcePrinter.print(base));
        }
        ClassSymbol cls = new ClassSymbol(node.getName(), node.getLine(), bases,
                decoratorNames(node.getDecorators()), depth());
        table.defineClass(cls);
        currentScope.define(new ScopeEntry(node.getName(), SymbolKind.CLASS, node.getLine(), cls));

        Scope classScope = new Scope(Scope.ScopeType.CLASS, currentScope, node);
        classScope.setOwnerTypeName(node.getName());
        currentScope.addChild(classScope);

        Scope saved = currentScope;
        currentScope = classScope;
        try {
            scanAll(node.getBody(), ctx);
        } finally {
            currentScope = saved;
        }
        return null;
    }

    @Override
    public Void visitImportDecl(ImportDecl node, Void ctx) {
        for (ImportAlias alias : node.getNames()) {
            ImportSymbol symbol = new ImportSymbol(alias.getBoundName(), alias.getName(), null,
                    alias.getAsName(), node.getLine(), ImportSymbol.ImportKind.IMPORT, 0);
            table.defineImport(symbol);
            currentScope.define(new ScopeEntry(symbol.getName(), SymbolKind.IMPORT, node.getLine(), symbol));
        }
        return null;
    }

    @Override
    public Void visitImportFromDecl(ImportFromDecl node, Void ctx) {
        if (node.isWildcard()) {
            return null;
        }
        for (ImportAlias alias : node.getNames()) {
            String bound = alias.getAsName() != null ? alias.getAsName() : alias.getName();
            ImportSymbol symbol = new ImportSymbol(bound, node.getModule(), alias.getName(),
                    alias.getAsName(), node.getLine(), ImportSymbol.ImportKind.FROM_IMPORT, node.getLevel());
            table.defineImport(symbol);
            currentScope.define(new ScopeEntry(bound, SymbolKind.IMPORT, node.getLine(), symbol));
        }
        return null;
    }

    // ============ 赋值 ============

    @Override
    public Void visitAssignStmt(AssignStmt node, Void ctx) {
        super.visitAssignStmt(node, ctx);
        boolean single = node.getTargets().size() == 1;
        for (Expression target : node.getTargets()) {
            if (target instanceof Identifier) {
                Identifier id = (Identifier) target;
                defineVariable(new VariableSymbol(id.getName(), node.getLine(), id.getColumn(), null,
                        infer(node.getValue()), depth(), single));
            } else {
                ClassSymbol owner = attributeOwner(target);
                if (owner != null) {
                    owner.addAttribute(((MemberExpr) target).getMember(), infer(node.getValue()));
                } else {
                    bindNames(target);
                }
            }
        }
        return null;
    }

    @Override
    public Void visitAnnAssignStmt(AnnAssignStmt node, Void ctx) {
        super.visitAnnAssignStmt(node, ctx);
        Expression target = node.getTarget();
        String annotation = annotationText(node.getAnnotation());
        if (target instanceof Identifier) {
            Identifier id = (Identifier) target;
            PyType inferred = node.hasValue() ? infer(node.getValue()) : null;
            defineVariable(new VariableSymbol(id.getName(), node.getLine(), id.getColumn(), annotation,
                    inferred, depth(), node.isSimple()));
        } else {
            ClassSymbol owner = attributeOwner(target);
            if (owner != null) {
                owner.addAttribute(((MemberExpr) target).getMember(), PyTypes.parse(annotation));
            }
        }
        return null;
    }

    @Override
    public Void visitAugAssignStmt(AugAssignStmt node, Void ctx) {
        super.visitAugAssignStmt(node, ctx);
        bindNames(node.getTarget());
        return null;
    }

    @Override
    public Void visitNamedExpr(NamedExpr node, Void ctx) {
        super.visitNamedExpr(node, ctx);
        Identifier id = node.getTarget();
        defineVariable(new VariableSymbol(id.getName(), id.getLine(), id.getColumn(), null,
                infer(node.getValue()), depth(), false));
        return null;
    }

    // ============ 其他绑定 ============

    @Override
    public Void visitForStmt(ForStmt node, Void ctx) {
        bindNames(node.getTarget());
        return super.visitForStmt(node, ctx);
    }

    @Override
    public Void visitWithItem(WithItem node, Void ctx) {
        if (node.getTarget() != null) {
            bindNames(node.getTarget());
        }
        return super.visitWithItem(node, ctx);
    }

    @Override
    public Void visitExceptHandler(ExceptHandler node, Void ctx) {
        if (node.getName() != null) {
            currentScope.defineIfAbsent(new ScopeEntry(node.getName(), SymbolKind.BINDING, node.getLine(), null));
        }
        return super.visitExceptHandler(node, ctx);
    }

    @Override
    public Void visitGlobalStmt(GlobalStmt node, Void ctx) {
        for (String name : node.getNames()) {
            currentScope.defineIfAbsent(new ScopeEntry(name, SymbolKind.BINDING, node.getLine(), null));
        }
        return null;
    }

    /**
     * 收集函数体内的 return 值（完整子树）与本函数自身的 yield（不进入嵌套函数、lambda、类）
     */
    private static final class ReturnCollector extends AstScanner<Void> {
        final List<Expression> returnValues = new ArrayList<Expression>();
        final List<YieldExpr> yields = new ArrayList<YieldExpr>();
        private int nesting;

        void collect(FunctionDef fn) {
            scanAll(fn.getBody(), null);
        }

        @Override
        public Void visitReturnStmt(ReturnStmt node, Void ctx) {
            if (node.hasValue()) returnValues.add(node.getValue());
            return super.visitReturnStmt(node, ctx);
        }

        @Override
        public Void visitYieldExpr(YieldExpr node, Void ctx) {
            if (nesting == 0) yields.add(node);
            return super.visitYieldExpr(node, ctx);
        }

        @Override
        public Void visitFunctionDef(FunctionDef node, Void ctx) {
            nesting++;
            try {
                return super.visitFunctionDef(node, ctx);
            } finally {
                nesting--;
            }
        }

        @Override
        public Void visitLambdaExpr(LambdaExpr node, Void ctx) {
            nesting++;
            try {
                return super.visitLambdaExpr(node, ctx);
            } finally {
                nesting--;
            }
        }

        @Override
        public Void visitClassDef(ClassDef node, Void ctx) {
            nesting++;
            try {
                return super.visitClassDef(node, ctx);
            } finally {
                nesting--;
            }
        }
    }
}
