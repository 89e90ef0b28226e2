package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.*;
import com.typelens.compiler.ast.AstVisitor;
import com.typelens.compiler.ast.decl.*;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.expr.*;
import com.typelens.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表达式类型推断引擎：对任意表达式子树计算类型描述符。
 *
 * <p>流不敏感、过程内；不修改符号表。调用目标的返回类型尚不可知时
 * 产生 {@link DeferredPyType}，由 {@link DeferredResolver} 在符号表完整后解析。</p>
 *
 * <p>语句节点不是推断对象，访问时返回 unknown。</p>
 */
public final class TypeInferenceEngine implements AstVisitor<PyType, InferenceContext> {

    public static final int DEFAULT_MAX_TUPLE_ARITY = 8;

    private final TypeUnifier unifier;
    private final int maxTupleArity;

    public TypeInferenceEngine() {
        this(new TypeUnifier(), DEFAULT_MAX_TUPLE_ARITY);
    }

    public TypeInferenceEngine(TypeUnifier unifier, int maxTupleArity) {
        this.unifier = unifier;
        this.maxTupleArity = maxTupleArity;
    }

    public TypeUnifier getUnifier() {
        return unifier;
    }

    /** 推断入口 */
    public PyType infer(Expression expr, SymbolTable table) {
        return infer(expr, new InferenceContext(table));
    }

    public PyType infer(Expression expr, InferenceContext ctx) {
        if (expr == null) return PyTypes.NONE;
        PyType type = expr.accept(this, ctx);
        return type != null ? type : PyTypes.UNKNOWN;
    }

    // ============ 类型投影 ============

    /**
     * 迭代容器得到的元素类型，无法确定时返回 Any
     */
    public PyType elementTypeOf(PyType container) {
        if (container instanceof TuplePyType) {
            TuplePyType tuple = (TuplePyType) container;
            if (tuple.isVariadic()) return tuple.getElements().get(0);
            PyType unified = unifier.unify(tuple.getElements());
            return unified == PyTypes.UNKNOWN ? PyTypes.ANY : unified;
        }
        if (PyTypes.STR.equals(container)) return PyTypes.STR;
        if (PyTypes.BYTES.equals(container)) return PyTypes.INT;
        if (container instanceof ClassPyType) {
            ClassPyType ct = (ClassPyType) container;
            PyType first = ct.getTypeArg(0);
            switch (ct.getName()) {
                case "list":
                case "set":
                case "frozenset":
                case "dict":
                case "dict_keys":
                case "dict_values":
                case "Generator":
                case "Iterator":
                case "Iterable":
                case "Sequence":
                case "Mapping":
                case "reversed":
                case "deque":
                    return first != null ? first : PyTypes.ANY;
                case "dict_items":
                    return ct.getTypeArgs().size() == 2 ? TuplePyType.of(ct.getTypeArgs()) : PyTypes.TUPLE;
                case "range":
                    return PyTypes.INT;
                case "enumerate":
                    return TuplePyType.of(Arrays.<PyType>asList(PyTypes.INT, PyTypes.ANY));
                default:
                    break;
            }
        }
        return PyTypes.ANY;
    }

    /**
     * 函数调用结果：返回注解 > 已知的确定返回类型 > 延迟占位
     */
    PyType returnTypeOf(FunctionSymbol fn) {
        if (fn.getReturnAnnotation() != null) {
            return PyTypes.parse(fn.getReturnAnnotation());
        }
        PyType inferred = fn.getInferredReturnType();
        if (TypeUnifier.isConcrete(inferred)) {
            return inferred;
        }
        return PyTypes.deferred(fn.getName());
    }

    /** 名称在符号表中的类型：注解 > 推断类型，都没有时返回 null */
    static PyType variableType(VariableSymbol v) {
        if (v.hasAnnotation()) return PyTypes.parse(v.getAnnotation());
        return v.getInferredType();
    }

    // ============ 声明与语句（非表达式） ============

    @Override
    public PyType visitModule(Module node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitFunctionDef(FunctionDef node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitClassDef(ClassDef node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitParameter(Parameter node, InferenceContext ctx) {
        return node.hasDefaultValue() ? infer(node.getDefaultValue(), ctx) : PyTypes.UNKNOWN;
    }

    @Override
    public PyType visitImportDecl(ImportDecl node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitImportFromDecl(ImportFromDecl node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitExpressionStmt(ExpressionStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitAssignStmt(AssignStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitAugAssignStmt(AugAssignStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitAnnAssignStmt(AnnAssignStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitReturnStmt(ReturnStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitDeleteStmt(DeleteStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitPassStmt(PassStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitBreakStmt(BreakStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitContinueStmt(ContinueStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitRaiseStmt(RaiseStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitGlobalStmt(GlobalStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitAssertStmt(AssertStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitIfStmt(IfStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitWhileStmt(WhileStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitForStmt(ForStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitTryStmt(TryStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitExceptHandler(ExceptHandler node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitWithStmt(WithStmt node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    @Override
    public PyType visitWithItem(WithItem node, InferenceContext ctx) { return PyTypes.UNKNOWN; }

    // ============ 常量 ============

    @Override
    public PyType visitLiteral(Literal node, InferenceContext ctx) {
        switch (node.getLiteralKind()) {
            case BOOLEAN: return PyTypes.BOOL;
            case INT: return PyTypes.INT;
            case FLOAT: return PyTypes.FLOAT;
            case COMPLEX: return PyTypes.COMPLEX;
            case STRING: return PyTypes.STR;
            case BYTES: return PyTypes.BYTES;
            case NONE: return PyTypes.NONE;
            case ELLIPSIS: return PyTypes.ELLIPSIS;
            default: return PyTypes.UNKNOWN;
        }
    }

    @Override
    public PyType visitFormattedString(FormattedString node, InferenceContext ctx) {
        return PyTypes.STR;
    }

    // ============ 名称 ============

    @Override
    public PyType visitIdentifier(Identifier node, InferenceContext ctx) {
        String name = node.getName();
        PyType local = ctx.lookupBinding(name);
        if (local != null) return local;
        VariableSymbol v = ctx.getSymbolTable().getVariable(name);
        if (v != null) {
            PyType declared = variableType(v);
            if (declared != null) return declared;
        }
        PyType guess = BuiltinRegistry.guessTypeFromName(name);
        return guess != null ? guess : PyTypes.ANY;
    }

    // ============ 容器 ============

    @Override
    public PyType visitCollectionLiteral(CollectionLiteral node, InferenceContext ctx) {
        List<Expression> elements = node.getElements();
        switch (node.getCollectionKind()) {
            case TUPLE: {
                if (elements.isEmpty()) return PyTypes.TUPLE;
                if (elements.size() <= maxTupleArity && !containsStarred(elements)) {
                    List<PyType> types = new ArrayList<PyType>(elements.size());
                    for (Expression e : elements) {
                        types.add(infer(e, ctx));
                    }
                    return TuplePyType.of(types);
                }
                PyType elem = unifySampled(elements, ctx);
                return TypeUnifier.isConcrete(elem) ? TuplePyType.homogeneous(elem) : PyTypes.TUPLE;
            }
            case SET: {
                if (elements.isEmpty()) return PyTypes.SET;
                PyType elem = unifySampled(elements, ctx);
                return TypeUnifier.isConcrete(elem) ? PyTypes.setOf(elem) : PyTypes.SET;
            }
            case LIST:
            default: {
                if (elements.isEmpty()) return PyTypes.LIST;
                PyType elem = unifySampled(elements, ctx);
                return TypeUnifier.isConcrete(elem) ? PyTypes.listOf(elem) : PyTypes.LIST;
            }
        }
    }

    @Override
    public PyType visitDictLiteral(DictLiteral node, InferenceContext ctx) {
        List<Expression> keys = new ArrayList<Expression>();
        List<Expression> values = new ArrayList<Expression>();
        for (int i = 0; i < node.getKeys().size(); i++) {
            if (node.getKeys().get(i) == null) continue;  // **spread
            keys.add(node.getKeys().get(i));
            values.add(node.getValues().get(i));
        }
        if (keys.isEmpty()) return PyTypes.DICT;
        List<PyType> keyTypes = new ArrayList<PyType>();
        List<PyType> valueTypes = new ArrayList<PyType>();
        for (int index : unifier.sampleIndices(keys.size())) {
            keyTypes.add(infer(keys.get(index), ctx));
            valueTypes.add(infer(values.get(index), ctx));
        }
        return mappingOf(unifier.unify(keyTypes), unifier.unify(valueTypes));
    }

    private static PyType mappingOf(PyType key, PyType value) {
        if (isSingle(key) && isSingle(value)) {
            return PyTypes.dictOf(key, value);
        }
        return PyTypes.DICT;
    }

    private static boolean isSingle(PyType type) {
        return TypeUnifier.isConcrete(type) && !type.isUnion();
    }

    private PyType unifySampled(List<Expression> elements, InferenceContext ctx) {
        List<PyType> types = new ArrayList<PyType>();
        for (Expression e : unifier.sample(elements)) {
            if (e instanceof StarredExpr) {
                types.add(elementTypeOf(infer(((StarredExpr) e).getValue(), ctx)));
            } else {
                types.add(infer(e, ctx));
            }
        }
        return unifier.unify(types);
    }

    private static boolean containsStarred(List<Expression> elements) {
        for (Expression e : elements) {
            if (e instanceof StarredExpr) return true;
        }
        return false;
    }

    // ============ 调用 ============

    @Override
    public PyType visitCallExpr(CallExpr node, InferenceContext ctx) {
        Expression callee = node.getCallee();
        if (callee instanceof Identifier) {
            return inferNamedCall(((Identifier) callee).getName(), node, ctx);
        }
        if (callee instanceof MemberExpr) {
            return inferMethodCall((MemberExpr) callee, node, ctx);
        }
        PyType calleeType = infer(callee, ctx);
        if (calleeType instanceof CallablePyType) {
            return ((CallablePyType) calleeType).getReturnType();
        }
        return PyTypes.ANY;
    }

    private PyType inferNamedCall(String name, CallExpr node, InferenceContext ctx) {
        PyType local = ctx.lookupBinding(name);
        if (local instanceof CallablePyType) {
            return ((CallablePyType) local).getReturnType();
        }
        PyType builtin = BuiltinRegistry.builtinReturnType(name);
        if (builtin != null) {
            return refineBuiltin(name, builtin, node, ctx);
        }
        SymbolTable table = ctx.getSymbolTable();
        if (table.hasClass(name)) {
            return new ClassPyType(name);
        }
        FunctionSymbol fn = table.getFunction(name);
        if (fn != null) {
            return returnTypeOf(fn);
        }
        if (Character.isUpperCase(name.charAt(0))) {
            return new ClassPyType(name);
        }
        VariableSymbol v = table.getVariable(name);
        if (v != null) {
            PyType vt = variableType(v);
            if (vt instanceof CallablePyType) {
                return ((CallablePyType) vt).getReturnType();
            }
        }
        return PyTypes.deferred(name);
    }

    private PyType refineBuiltin(String name, PyType fallback, CallExpr node, InferenceContext ctx) {
        List<Expression> args = node.getArgs();
        switch (name) {
            case "min":
            case "max": {
                if (args.size() == 1 && !(args.get(0) instanceof StarredExpr)) {
                    PyType elem = elementTypeOf(infer(args.get(0), ctx));
                    return TypeUnifier.isConcrete(elem) ? elem : fallback;
                }
                if (args.size() >= 2) {
                    PyType t = unifier.unify(infer(args.get(0), ctx), infer(args.get(1), ctx));
                    return TypeUnifier.isConcrete(t) ? t : fallback;
                }
                return fallback;
            }
            case "sum": {
                if (args.isEmpty()) return PyTypes.INT;
                PyType elem = elementTypeOf(infer(args.get(0), ctx));
                return PyTypes.FLOAT.equals(elem) ? PyTypes.FLOAT : PyTypes.INT;
            }
            case "abs": {
                if (args.size() != 1) return fallback;
                PyType arg = infer(args.get(0), ctx);
                if (PyTypes.FLOAT.equals(arg) || PyTypes.COMPLEX.equals(arg)) return PyTypes.FLOAT;
                if (PyTypes.INT.equals(arg) || PyTypes.BOOL.equals(arg)) return PyTypes.INT;
                return fallback;
            }
            case "round":
                if (args.size() == 1) return PyTypes.INT;
                if (args.size() >= 2) return PyTypes.FLOAT;
                return fallback;
            default:
                return fallback;
        }
    }

    private PyType inferMethodCall(MemberExpr callee, CallExpr node, InferenceContext ctx) {
        String method = callee.getMember();
        PyType receiver = infer(callee.getTarget(), ctx);
        PyType refined = refineMethod(receiver, method, node, ctx);
        if (refined != null) return refined;
        PyType fromTable = BuiltinRegistry.methodReturnType(method);
        if (fromTable != null) return fromTable;
        return PyTypes.deferred(method);
    }

    /**
     * 依赖接收者类型的方法返回类型，无法细化时返回 null
     */
    private PyType refineMethod(PyType receiver, String method, CallExpr node, InferenceContext ctx) {
        if (PyTypes.STR.equals(receiver)) {
            return strMethod(method);
        }
        if (PyTypes.BYTES.equals(receiver)) {
            return "decode".equals(method) ? PyTypes.STR : null;
        }
        if (!(receiver instanceof ClassPyType)) {
            return null;
        }
        ClassPyType ct = (ClassPyType) receiver;
        switch (ct.getName()) {
            case "dict":
                return dictMethod(ct, method, node, ctx);
            case "list":
                if ("copy".equals(method)) return ct;
                if ("pop".equals(method) && ct.hasTypeArgs()) return ct.getTypeArg(0);
                return null;
            case "set":
            case "frozenset":
                switch (method) {
                    case "copy":
                    case "union":
                    case "intersection":
                    case "difference":
                    case "symmetric_difference":
                        return ct;
                    case "pop":
                        return ct.hasTypeArgs() ? ct.getTypeArg(0) : null;
                    default:
                        return null;
                }
            default:
                return userMethod(ct.getName(), method, ctx.getSymbolTable());
        }
    }

    private PyType dictMethod(ClassPyType dict, String method, CallExpr node, InferenceContext ctx) {
        if ("copy".equals(method)) return dict;
        if (dict.getTypeArgs().size() != 2) return null;
        PyType key = dict.getTypeArg(0);
        PyType value = dict.getTypeArg(1);
        switch (method) {
            case "get":
                if (node.getArgs().size() >= 2) {
                    return unifier.unify(value, infer(node.getArgs().get(1), ctx));
                }
                return PyTypes.union(value, PyTypes.NONE);
            case "keys":
                return new ClassPyType("dict_keys", Collections.singletonList(key));
            case "values":
                return new ClassPyType("dict_values", Collections.singletonList(value));
            case "items":
                return new ClassPyType("dict_items", Arrays.asList(key, value));
            case "pop":
            case "setdefault":
                return value;
            default:
                return null;
        }
    }

    private static PyType strMethod(String method) {
        switch (method) {
            case "startswith":
            case "endswith":
            case "isdigit":
            case "isalpha":
            case "isalnum":
            case "isspace":
            case "isupper":
            case "islower":
            case "istitle":
            case "isnumeric":
            case "isdecimal":
            case "isidentifier":
                return PyTypes.BOOL;
            case "find":
            case "rfind":
            case "index":
            case "rindex":
            case "count":
                return PyTypes.INT;
            case "encode":
                return PyTypes.BYTES;
            case "split":
            case "rsplit":
            case "splitlines":
                return PyTypes.listOf(PyTypes.STR);
            case "partition":
            case "rpartition":
                return TuplePyType.of(Arrays.<PyType>asList(PyTypes.STR, PyTypes.STR, PyTypes.STR));
            case "title":
            case "capitalize":
            case "casefold":
            case "lstrip":
            case "rstrip":
            case "center":
            case "ljust":
            case "rjust":
            case "zfill":
            case "swapcase":
            case "removeprefix":
            case "removesuffix":
                return PyTypes.STR;
            default:
                return null;
        }
    }

    /** 已知用户类上声明的方法 */
    private PyType userMethod(String className, String method, SymbolTable table) {
        ClassSymbol cls = table.getClass(className);
        if (cls == null || !cls.hasMethod(method)) return null;
        FunctionSymbol fn = table.getFunction(method);
        if (fn != null && className.equals(fn.getOwnerClass())) {
            return returnTypeOf(fn);
        }
        return null;
    }

    @Override
    public PyType visitKeywordArgument(KeywordArgument node, InferenceContext ctx) {
        return infer(node.getValue(), ctx);
    }

    // ============ 运算符 ============

    @Override
    public PyType visitBinaryExpr(BinaryExpr node, InferenceContext ctx) {
        PyType left = infer(node.getLeft(), ctx);
        PyType right = infer(node.getRight(), ctx);
        switch (node.getOperator()) {
            case ADD:
                if (PyTypes.STR.equals(left) || PyTypes.STR.equals(right)) return PyTypes.STR;
                if (left.equals(right) && isConcatenable(left)) return left;
                if (left instanceof TuplePyType && right instanceof TuplePyType) {
                    PyType joined = concatTuples((TuplePyType) left, (TuplePyType) right);
                    if (joined != null) return joined;
                }
                return arithmetic(left, right);
            case MUL:
                if (PyTypes.STR.equals(left) || PyTypes.STR.equals(right)) return PyTypes.STR;
                if (isRepeatable(left) && isIntegral(right)) return left;
                if (isRepeatable(right) && isIntegral(left)) return right;
                return arithmetic(left, right);
            case MOD:
                if (PyTypes.STR.equals(left)) return PyTypes.STR;
                return arithmetic(left, right);
            case DIV:
                return PyTypes.FLOAT;
            case FLOOR_DIV:
                return PyTypes.FLOAT.equals(left) || PyTypes.FLOAT.equals(right) ? PyTypes.FLOAT : PyTypes.INT;
            case SUB:
                if (left.equals(right) && isSetType(left)) return left;
                return arithmetic(left, right);
            case POW:
                return arithmetic(left, right);
            case MAT_MUL:
                return PyTypes.ANY;
            case BIT_OR:
            case BIT_XOR:
            case BIT_AND:
                if (left.equals(right) && isSetType(left)) return left;
                return PyTypes.INT;
            case LSHIFT:
            case RSHIFT:
            default:
                return PyTypes.INT;
        }
    }

    /** float 优先，其次 int，否则 int | float */
    private static PyType arithmetic(PyType left, PyType right) {
        if (PyTypes.COMPLEX.equals(left) || PyTypes.COMPLEX.equals(right)) return PyTypes.COMPLEX;
        if (PyTypes.FLOAT.equals(left) || PyTypes.FLOAT.equals(right)) return PyTypes.FLOAT;
        if (isIntegral(left) || isIntegral(right)) return PyTypes.INT;
        return PyTypes.NUMBER;
    }

    private static boolean isIntegral(PyType type) {
        return PyTypes.INT.equals(type) || PyTypes.BOOL.equals(type);
    }

    private static boolean isConcatenable(PyType type) {
        return PyTypes.BYTES.equals(type) || PyTypes.isClass(type, "list") || PyTypes.isClass(type, "tuple")
                || (type instanceof TuplePyType && ((TuplePyType) type).isVariadic());
    }

    private static boolean isRepeatable(PyType type) {
        return PyTypes.BYTES.equals(type) || PyTypes.isClass(type, "list") || PyTypes.isClass(type, "tuple")
                || type instanceof TuplePyType;
    }

    private static boolean isSetType(PyType type) {
        return PyTypes.isClass(type, "set") || PyTypes.isClass(type, "frozenset");
    }

    private PyType concatTuples(TuplePyType left, TuplePyType right) {
        if (left.isVariadic() || right.isVariadic()) return null;
        List<PyType> elements = new ArrayList<PyType>(left.getElements());
        elements.addAll(right.getElements());
        return elements.size() <= maxTupleArity ? TuplePyType.of(elements) : null;
    }

    @Override
    public PyType visitUnaryExpr(UnaryExpr node, InferenceContext ctx) {
        switch (node.getOperator()) {
            case NOT:
                return PyTypes.BOOL;
            case INVERT:
                return PyTypes.INT;
            case POS:
            case NEG:
            default:
                return infer(node.getOperand(), ctx);
        }
    }

    @Override
    public PyType visitCompareExpr(CompareExpr node, InferenceContext ctx) {
        return PyTypes.BOOL;
    }

    @Override
    public PyType visitBoolOpExpr(BoolOpExpr node, InferenceContext ctx) {
        return PyTypes.BOOL;
    }

    // ============ 推导式 ============

    @Override
    public PyType visitComprehensionExpr(ComprehensionExpr node, InferenceContext ctx) {
        InferenceContext inner = bindClauses(node.getClauses(), ctx);
        PyType elem = infer(node.getElement(), inner);
        switch (node.getComprehensionKind()) {
            case LIST:
                return TypeUnifier.isConcrete(elem) ? PyTypes.listOf(elem) : PyTypes.LIST;
            case SET:
                return TypeUnifier.isConcrete(elem) ? PyTypes.setOf(elem) : PyTypes.SET;
            case DICT:
                return mappingOf(elem, infer(node.getValue(), inner));
            case GENERATOR:
            default:
                return PyTypes.generatorOf(TypeUnifier.isConcrete(elem) ? elem : PyTypes.ANY);
        }
    }

    /** 依次把每个 for 子句的目标绑定为其可迭代对象的元素类型 */
    private InferenceContext bindClauses(List<ComprehensionClause> clauses, InferenceContext ctx) {
        InferenceContext current = ctx;
        for (ComprehensionClause clause : clauses) {
            PyType elem = elementTypeOf(infer(clause.getIterable(), current));
            Map<String, PyType> bound = new LinkedHashMap<String, PyType>();
            bindTarget(clause.getTarget(), elem, bound);
            current = current.withBindings(bound);
        }
        return current;
    }

    /**
     * 把目标表达式中的名称绑定到给定类型；元组解包按位置分配
     */
    public void bindTarget(Expression target, PyType type, Map<String, PyType> out) {
        if (target instanceof Identifier) {
            out.put(((Identifier) target).getName(), type);
        } else if (target instanceof StarredExpr) {
            bindTarget(((StarredExpr) target).getValue(), PyTypes.LIST, out);
        } else if (target instanceof CollectionLiteral) {
            List<Expression> parts = ((CollectionLiteral) target).getElements();
            TuplePyType tuple = type instanceof TuplePyType ? (TuplePyType) type : null;
            for (int i = 0; i < parts.size(); i++) {
                PyType partType = PyTypes.ANY;
                if (tuple != null && (tuple.isVariadic() || tuple.getElements().size() == parts.size())) {
                    partType = tuple.elementAt(i);
                }
                bindTarget(parts.get(i), partType, out);
            }
        }
    }

    @Override
    public PyType visitComprehensionClause(ComprehensionClause node, InferenceContext ctx) {
        return PyTypes.UNKNOWN;
    }

    // ============ 其他表达式 ============

    @Override
    public PyType visitConditionalExpr(ConditionalExpr node, InferenceContext ctx) {
        return unifier.unify(infer(node.getThenExpr(), ctx), infer(node.getElseExpr(), ctx));
    }

    @Override
    public PyType visitLambdaExpr(LambdaExpr node, InferenceContext ctx) {
        Map<String, PyType> params = new LinkedHashMap<String, PyType>();
        for (Parameter p : node.getParams()) {
            params.put(p.getName(), PyTypes.ANY);
        }
        PyType result = infer(node.getBody(), ctx.withBindings(params));
        return new CallablePyType(TypeUnifier.isConcrete(result) ? result : PyTypes.ANY);
    }

    @Override
    public PyType visitMemberExpr(MemberExpr node, InferenceContext ctx) {
        PyType base = infer(node.getTarget(), ctx);
        String member = node.getMember();
        if (PyTypes.COMPLEX.equals(base) && ("real".equals(member) || "imag".equals(member))) {
            return PyTypes.FLOAT;
        }
        if (base instanceof ClassPyType) {
            ClassSymbol cls = ctx.getSymbolTable().getClass(((ClassPyType) base).getName());
            if (cls != null) {
                PyType attr = cls.getAttributeType(member);
                if (attr != null) return attr;
            }
        }
        return PyTypes.ANY;
    }

    @Override
    public PyType visitIndexExpr(IndexExpr node, InferenceContext ctx) {
        PyType base = infer(node.getTarget(), ctx);
        Expression index = node.getIndex();
        if (index instanceof SliceExpr) {
            if (base instanceof TuplePyType) {
                return ((TuplePyType) base).isVariadic() ? base : PyTypes.TUPLE;
            }
            if (PyTypes.STR.equals(base) || PyTypes.BYTES.equals(base)
                    || PyTypes.isClass(base, "list") || PyTypes.isClass(base, "tuple")) {
                return base;
            }
            return PyTypes.ANY;
        }
        if (PyTypes.STR.equals(base)) return PyTypes.STR;
        if (PyTypes.BYTES.equals(base)) return PyTypes.INT;
        if (base instanceof ClassPyType) {
            ClassPyType ct = (ClassPyType) base;
            if (("list".equals(ct.getName()) || "Sequence".equals(ct.getName())) && ct.hasTypeArgs()) {
                return ct.getTypeArg(0);
            }
            if (("dict".equals(ct.getName()) || "Mapping".equals(ct.getName())) && ct.getTypeArgs().size() == 2) {
                return ct.getTypeArg(1);
            }
        }
        if (base instanceof TuplePyType) {
            TuplePyType tuple = (TuplePyType) base;
            if (tuple.isVariadic()) return tuple.getElements().get(0);
            Integer position = constantIndex(index);
            if (position != null) {
                PyType elem = tuple.elementAt(position);
                if (elem != null) return elem;
            }
        }
        return PyTypes.ANY;
    }

    /** 整数常量下标（含负号），不是常量时返回 null */
    private static Integer constantIndex(Expression index) {
        boolean negative = false;
        Expression e = index;
        if (e instanceof UnaryExpr && ((UnaryExpr) e).getOperator() == UnaryExpr.UnaryOp.NEG) {
            negative = true;
            e = ((UnaryExpr) e).getOperand();
        }
        if (e instanceof Literal && ((Literal) e).getLiteralKind() == Literal.LiteralKind.INT) {
            Object value = ((Literal) e).getValue();
            if (!(value instanceof Long)) return null;
            long n = (Long) value;
            if (n > Integer.MAX_VALUE) return null;
            int i = Math.toIntExact(n);
            return negative ? -i : i;
        }
        return null;
    }

    @Override
    public PyType visitSliceExpr(SliceExpr node, InferenceContext ctx) {
        return PyTypes.SLICE;
    }

    @Override
    public PyType visitStarredExpr(StarredExpr node, InferenceContext ctx) {
        return PyTypes.ANY;
    }

    @Override
    public PyType visitNamedExpr(NamedExpr node, InferenceContext ctx) {
        return infer(node.getValue(), ctx);
    }

    @Override
    public PyType visitAwaitExpr(AwaitExpr node, InferenceContext ctx) {
        return PyTypes.ANY;
    }

    @Override
    public PyType visitYieldExpr(YieldExpr node, InferenceContext ctx) {
        return PyTypes.ANY;
    }
}
