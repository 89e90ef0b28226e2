package com.typelens.compiler.analysis;

import com.typelens.compiler.ast.AstScanner;
import com.typelens.compiler.ast.decl.FunctionDef;
import com.typelens.compiler.ast.decl.Module;
import com.typelens.compiler.ast.decl.Parameter;
import com.typelens.compiler.ast.expr.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 未声明名称检测：报告不属于任何已知声明、内置名称或当前函数参数 / 局部名称的读取引用。
 *
 * <p>只维护单个"当前函数"标记：进入 def 时设置、退出时恢复，嵌套函数覆盖外层。
 * 推导式目标与 lambda 参数在其表达式内部视为已声明。</p>
 *
 * <p>实例保存单次检测的状态，不可并发使用。</p>
 */
public final class UndeclaredNameDetector extends AstScanner<Void> {

    private Set<String> declared;
    private Map<String, Set<String>> functionLocals;
    private final Deque<Set<String>> expressionScopes = new ArrayDeque<Set<String>>();
    private Set<UndeclaredReference> found;
    private String currentFunction;

    /** 检测入口；结果按首次出现顺序排列且不重复 */
    public List<UndeclaredReference> detect(Module module, SymbolTable table) {
        declared = table.getDeclaredNames();
        functionLocals = new HashMap<String, Set<String>>();
        for (FunctionSymbol fn : table.getFunctions().values()) {
            Set<String> names = new HashSet<String>(fn.getParameterNames());
            names.addAll(fn.getLocalNames());
            functionLocals.put(fn.getName(), names);
        }
        found = new LinkedHashSet<UndeclaredReference>();
        currentFunction = null;
        expressionScopes.clear();
        try {
            scan(module, null);
            return new ArrayList<UndeclaredReference>(found);
        } finally {
            declared = null;
            functionLocals = null;
            found = null;
        }
    }

    private boolean isKnown(String name) {
        if (declared.contains(name) || BuiltinRegistry.isBuiltinName(name)) {
            return true;
        }
        if (currentFunction != null) {
            Set<String> locals = functionLocals.get(currentFunction);
            if (locals != null && locals.contains(name)) return true;
        }
        for (Set<String> scope : expressionScopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }

    @Override
    public Void visitFunctionDef(FunctionDef node, Void ctx) {
        String saved = currentFunction;
        currentFunction = node.getName();
        try {
            return super.visitFunctionDef(node, ctx);
        } finally {
            currentFunction = saved;
        }
    }

    @Override
    public Void visitIdentifier(Identifier node, Void ctx) {
        if (node.isLoad() && !isKnown(node.getName())) {
            found.add(new UndeclaredReference(node.getName(), node.getLine(), node.getColumn(), currentFunction));
        }
        return null;
    }

    @Override
    public Void visitComprehensionExpr(ComprehensionExpr node, Void ctx) {
        Set<String> bound = new HashSet<String>();
        for (ComprehensionClause clause : node.getClauses()) {
            collectNames(clause.getTarget(), bound);
        }
        expressionScopes.push(bound);
        try {
            return super.visitComprehensionExpr(node, ctx);
        } finally {
            expressionScopes.pop();
        }
    }

    @Override
    public Void visitLambdaExpr(LambdaExpr node, Void ctx) {
        for (Parameter p : node.getParams()) {
            scan(p.getDefaultValue(), ctx);
        }
        Set<String> bound = new HashSet<String>();
        for (Parameter p : node.getParams()) {
            bound.add(p.getName());
        }
        expressionScopes.push(bound);
        try {
            scan(node.getBody(), ctx);
        } finally {
            expressionScopes.pop();
        }
        return null;
    }

    private static void collectNames(Expression target, Set<String> out) {
        if (target instanceof Identifier) {
            out.add(((Identifier) target).getName());
        } else if (target instanceof CollectionLiteral) {
            for (Expression e : ((CollectionLiteral) target).getElements()) {
                collectNames(e, out);
            }
        } else if (target instanceof StarredExpr) {
            collectNames(((StarredExpr) target).getValue(), out);
        }
    }
}
