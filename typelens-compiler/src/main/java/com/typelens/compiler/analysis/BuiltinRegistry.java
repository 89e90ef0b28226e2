package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.ClassPyType;
import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.analysis.types.PyTypes;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 内置函数 / 方法返回类型表、命名启发式与内置名称集合。
 * 所有表在类加载时构建，之后只读。
 */
public final class BuiltinRegistry {

    private BuiltinRegistry() {}

    /** 内置函数返回类型 */
    private static final Map<String, PyType> BUILTIN_RETURNS;
    /** 不依赖接收者的方法返回类型 */
    private static final Map<String, PyType> METHOD_RETURNS;
    /** 名称子串 → 类型（按插入顺序匹配） */
    private static final Map<String, PyType> NAME_PATTERNS;
    /** 检测未声明名称时视为已知的内置名称 */
    private static final Set<String> BUILTIN_NAMES;

    static {
        Map<String, PyType> b = new HashMap<String, PyType>();
        b.put("len", PyTypes.INT);
        b.put("sum", PyTypes.NUMBER);
        b.put("min", PyTypes.NUMBER);
        b.put("max", PyTypes.NUMBER);
        b.put("abs", PyTypes.NUMBER);
        b.put("round", PyTypes.NUMBER);
        b.put("str", PyTypes.STR);
        b.put("int", PyTypes.INT);
        b.put("float", PyTypes.FLOAT);
        b.put("bool", PyTypes.BOOL);
        b.put("list", PyTypes.LIST);
        b.put("dict", PyTypes.DICT);
        b.put("set", PyTypes.SET);
        b.put("tuple", PyTypes.TUPLE);
        b.put("type", new ClassPyType("type"));
        b.put("range", new ClassPyType("range"));
        b.put("enumerate", new ClassPyType("enumerate"));
        b.put("zip", new ClassPyType("zip"));
        b.put("map", new ClassPyType("map"));
        b.put("filter", new ClassPyType("filter"));
        b.put("sorted", PyTypes.LIST);
        b.put("reversed", new ClassPyType("reversed"));
        b.put("open", new ClassPyType("TextIOWrapper"));
        b.put("input", PyTypes.STR);
        b.put("print", PyTypes.NONE);
        BUILTIN_RETURNS = Collections.unmodifiableMap(b);

        Map<String, PyType> m = new HashMap<String, PyType>();
        m.put("append", PyTypes.NONE);
        m.put("extend", PyTypes.NONE);
        m.put("insert", PyTypes.NONE);
        m.put("remove", PyTypes.NONE);
        m.put("pop", PyTypes.ANY);
        m.put("clear", PyTypes.NONE);
        m.put("copy", PyTypes.LIST);
        m.put("count", PyTypes.INT);
        m.put("index", PyTypes.INT);
        m.put("reverse", PyTypes.NONE);
        m.put("sort", PyTypes.NONE);
        m.put("join", PyTypes.STR);
        m.put("split", PyTypes.listOf(PyTypes.STR));
        m.put("strip", PyTypes.STR);
        m.put("upper", PyTypes.STR);
        m.put("lower", PyTypes.STR);
        m.put("replace", PyTypes.STR);
        m.put("format", PyTypes.STR);
        m.put("get", PyTypes.ANY);
        m.put("keys", new ClassPyType("dict_keys"));
        m.put("values", new ClassPyType("dict_values"));
        m.put("items", new ClassPyType("dict_items"));
        m.put("update", PyTypes.NONE);
        m.put("add", PyTypes.NONE);
        m.put("discard", PyTypes.NONE);
        m.put("union", PyTypes.SET);
        m.put("intersection", PyTypes.SET);
        METHOD_RETURNS = Collections.unmodifiableMap(m);

        Map<String, PyType> n = new LinkedHashMap<String, PyType>();
        n.put("numbers", PyTypes.listOf(PyTypes.NUMBER));
        n.put("items", PyTypes.LIST);
        n.put("data", PyTypes.LIST);
        n.put("text", PyTypes.STR);
        n.put("value", PyTypes.NUMBER);
        n.put("count", PyTypes.INT);
        n.put("index", PyTypes.INT);
        n.put("name", PyTypes.STR);
        n.put("path", PyTypes.STR);
        n.put("file", PyTypes.STR);
        n.put("content", PyTypes.STR);
        n.put("flag", PyTypes.BOOL);
        n.put("enabled", PyTypes.BOOL);
        n.put("config", PyTypes.DICT);
        n.put("settings", PyTypes.DICT);
        NAME_PATTERNS = Collections.unmodifiableMap(n);

        BUILTIN_NAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
                // 常用函数
                "print", "len", "str", "int", "float", "bool", "list", "dict", "set", "tuple",
                "sum", "min", "max", "abs", "round", "sorted", "reversed", "enumerate", "zip",
                "map", "filter", "any", "all", "range", "iter", "next", "open", "type", "isinstance",
                "issubclass", "hasattr", "getattr", "setattr", "delattr", "dir", "vars", "globals", "locals",
                "eval", "exec", "compile", "format", "repr", "chr", "ord", "hex", "oct", "bin",
                "input", "help", "id", "hash", "callable", "classmethod", "staticmethod", "property",
                "super", "slice", "memoryview", "bytearray", "bytes", "frozenset", "complex",
                "divmod", "pow", "ascii", "aiter", "anext", "breakpoint",
                // 异常类
                "Exception", "BaseException", "ValueError", "TypeError", "IndexError", "KeyError",
                "AttributeError", "NameError", "SyntaxError", "RuntimeError", "NotImplementedError",
                "ImportError", "ModuleNotFoundError", "FileNotFoundError", "PermissionError",
                "OSError", "IOError", "ZeroDivisionError", "OverflowError", "RecursionError",
                "StopIteration", "StopAsyncIteration", "AssertionError", "LookupError",
                "ArithmeticError", "UnicodeError", "UnicodeDecodeError", "UnicodeEncodeError",
                "KeyboardInterrupt", "SystemExit", "GeneratorExit", "TimeoutError",
                "ConnectionError", "FileExistsError", "IsADirectoryError", "NotADirectoryError",
                "Warning", "UserWarning", "DeprecationWarning", "RuntimeWarning",
                // 常量
                "True", "False", "None", "__name__", "__file__", "__doc__", "__package__",
                "__spec__", "__loader__", "__cached__", "__builtins__", "__debug__",
                "object", "Ellipsis", "NotImplemented"
        )));
    }

    /** 内置函数的返回类型，不在表中时返回 null */
    public static PyType builtinReturnType(String name) {
        return BUILTIN_RETURNS.get(name);
    }

    /** 方法表中的返回类型，不在表中时返回 null */
    public static PyType methodReturnType(String name) {
        return METHOD_RETURNS.get(name);
    }

    /** 内置名称（函数、异常类型、常量） */
    public static boolean isBuiltinName(String name) {
        return BUILTIN_NAMES.contains(name);
    }

    /**
     * 按名称猜测类型。is_ / has_ 前缀 → bool；名称子串按表顺序匹配（忽略大小写）；
     * 以 s（非 ss）结尾 → list。无法猜测时返回 null。
     */
    public static PyType guessTypeFromName(String name) {
        if (name == null || name.isEmpty()) return null;
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.startsWith("is_") || lower.startsWith("has_")) {
            return PyTypes.BOOL;
        }
        for (Map.Entry<String, PyType> e : NAME_PATTERNS.entrySet()) {
            if (lower.contains(e.getKey())) {
                return e.getValue();
            }
        }
        if (name.length() > 1 && lower.endsWith("s") && !lower.endsWith("ss")) {
            return PyTypes.LIST;
        }
        return null;
    }
}
