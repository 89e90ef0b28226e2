package com.typelens.compiler.ast;

/**
 * 节点种类。displayName 与可视化输出中的 node_type 一致。
 */
public enum NodeKind {
    // ============ 声明 ============
    MODULE("Module"),
    FUNCTION_DEF("FunctionDef"),
    ASYNC_FUNCTION_DEF("AsyncFunctionDef"),
    CLASS_DEF("ClassDef"),
    PARAMETER("arg"),
    IMPORT("Import"),
    IMPORT_FROM("ImportFrom"),

    // ============ 语句 ============
    EXPRESSION_STMT("Expr"),
    ASSIGN("Assign"),
    AUG_ASSIGN("AugAssign"),
    ANN_ASSIGN("AnnAssign"),
    RETURN("Return"),
    DELETE("Delete"),
    PASS("Pass"),
    BREAK("Break"),
    CONTINUE("Continue"),
    RAISE("Raise"),
    GLOBAL("Global"),
    NONLOCAL("Nonlocal"),
    ASSERT("Assert"),
    IF("If"),
    WHILE("While"),
    FOR("For"),
    ASYNC_FOR("AsyncFor"),
    TRY("Try"),
    EXCEPT_HANDLER("ExceptHandler"),
    WITH("With"),
    ASYNC_WITH("AsyncWith"),
    WITH_ITEM("withitem"),

    // ============ 表达式 ============
    CONSTANT("Constant"),
    FORMATTED_STRING("JoinedStr"),
    NAME("Name"),
    LIST("List"),
    TUPLE("Tuple"),
    SET("Set"),
    DICT("Dict"),
    CALL("Call"),
    ARGUMENT("keyword"),
    BINARY_OP("BinOp"),
    UNARY_OP("UnaryOp"),
    COMPARE("Compare"),
    BOOL_OP("BoolOp"),
    LIST_COMP("ListComp"),
    SET_COMP("SetComp"),
    DICT_COMP("DictComp"),
    GENERATOR_EXP("GeneratorExp"),
    COMPREHENSION("comprehension"),
    CONDITIONAL("IfExp"),
    LAMBDA("Lambda"),
    ATTRIBUTE("Attribute"),
    SUBSCRIPT("Subscript"),
    SLICE("Slice"),
    STARRED("Starred"),
    NAMED_EXPR("NamedExpr"),
    AWAIT("Await"),
    YIELD("Yield"),
    YIELD_FROM("YieldFrom");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
