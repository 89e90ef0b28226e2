package com.typelens.compiler.analysis.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 预定义类型常量和工厂方法。
 */
public final class PyTypes {

    private PyTypes() {}

    // 原始类型
    public static final PrimitivePyType INT = new PrimitivePyType("int");
    public static final PrimitivePyType FLOAT = new PrimitivePyType("float");
    public static final PrimitivePyType COMPLEX = new PrimitivePyType("complex");
    public static final PrimitivePyType STR = new PrimitivePyType("str");
    public static final PrimitivePyType BOOL = new PrimitivePyType("bool");
    public static final PrimitivePyType BYTES = new PrimitivePyType("bytes");
    public static final PrimitivePyType NONE = new PrimitivePyType("None");

    // 裸容器
    public static final ClassPyType LIST = new ClassPyType("list");
    public static final ClassPyType DICT = new ClassPyType("dict");
    public static final ClassPyType SET = new ClassPyType("set");
    public static final ClassPyType FROZENSET = new ClassPyType("frozenset");
    public static final ClassPyType TUPLE = new ClassPyType("tuple");
    public static final ClassPyType SLICE = new ClassPyType("slice");
    public static final ClassPyType ELLIPSIS = new ClassPyType("ellipsis");

    // 兜底
    public static final AnyPyType ANY = AnyPyType.INSTANCE;
    public static final UnknownPyType UNKNOWN = UnknownPyType.INSTANCE;

    /** int | float，数值结果无法确定时使用 */
    public static final PyType NUMBER = union(Arrays.<PyType>asList(INT, FLOAT));

    /** 创建 list[elem] 类型 */
    public static ClassPyType listOf(PyType elem) {
        return new ClassPyType("list", Collections.singletonList(elem));
    }

    /** 创建 set[elem] 类型 */
    public static ClassPyType setOf(PyType elem) {
        return new ClassPyType("set", Collections.singletonList(elem));
    }

    /** 创建 dict[key, value] 类型 */
    public static ClassPyType dictOf(PyType key, PyType value) {
        return new ClassPyType("dict", Arrays.asList(key, value));
    }

    /** 创建 Generator[elem, None, None] 类型 */
    public static ClassPyType generatorOf(PyType elem) {
        return new ClassPyType("Generator", Arrays.asList(elem, NONE, NONE));
    }

    public static DeferredPyType deferred(String name) {
        return new DeferredPyType(name);
    }

    /**
     * 构造联合类型：展平嵌套联合、去重并保持首次出现顺序。
     * 只剩一个备选时返回该备选；含 Any 或超过 3 个备选时返回 Any。
     */
    public static PyType union(Collection<? extends PyType> types) {
        List<PyType> alternatives = new ArrayList<PyType>();
        for (PyType type : types) {
            if (type == null) continue;
            if (type instanceof UnionPyType) {
                for (PyType alt : ((UnionPyType) type).getAlternatives()) {
                    if (!alternatives.contains(alt)) alternatives.add(alt);
                }
            } else if (!alternatives.contains(type)) {
                alternatives.add(type);
            }
        }
        if (alternatives.isEmpty() || alternatives.contains(ANY)) {
            return ANY;
        }
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        if (alternatives.size() > UnionPyType.MAX_ALTERNATIVES) {
            return ANY;
        }
        return new UnionPyType(alternatives);
    }

    public static PyType union(PyType... types) {
        return union(Arrays.asList(types));
    }

    /** 原始类型或 Any 的名称查找，未知名称返回 null */
    public static PyType fromName(String name) {
        if (name == null) return null;
        switch (name) {
            case "int": return INT;
            case "float": return FLOAT;
            case "complex": return COMPLEX;
            case "str": return STR;
            case "bool": return BOOL;
            case "bytes": return BYTES;
            case "None": case "NoneType": return NONE;
            case "Any": return ANY;
            default: return null;
        }
    }

    /** 是否为 int / float / complex / bool */
    public static boolean isNumeric(PyType type) {
        return type instanceof PrimitivePyType && ((PrimitivePyType) type).isNumeric();
    }

    /** 是否为名称为 name 的名义类型（忽略类型参数） */
    public static boolean isClass(PyType type, String name) {
        return type instanceof ClassPyType && ((ClassPyType) type).getName().equals(name);
    }

    /**
     * 解析注解文本为类型描述符（用于推断中的下标 / 成员投影）。
     * 识别 Optional[X]、Union[...]、X | Y、typing 容器别名与 tuple[T, ...]；
     * 无法解析的部分保留为名义类型。
     */
    public static PyType parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            return ANY;
        }
        try {
            return new TypeTextParser(text.trim()).parseAll();
        } catch (IllegalArgumentException e) {
            return new ClassPyType(text.trim());
        }
    }

    /**
     * 注解文本的简单递归下降解析器
     */
    private static final class TypeTextParser {
        private final String text;
        private int pos;

        TypeTextParser(String text) {
            this.text = text;
        }

        PyType parseAll() {
            PyType type = parseUnion();
            if (pos != text.length()) {
                throw new IllegalArgumentException(text);
            }
            return type;
        }

        PyType parseUnion() {
            List<PyType> parts = new ArrayList<PyType>();
            parts.add(parseAtom());
            skipSpaces();
            while (pos < text.length() && text.charAt(pos) == '|') {
                pos++;
                parts.add(parseAtom());
                skipSpaces();
            }
            if (pos != text.length() && depthZeroEnd()) {
                throw new IllegalArgumentException(text);
            }
            if (parts.size() > UnionPyType.MAX_ALTERNATIVES) {
                throw new IllegalArgumentException(text);
            }
            return parts.size() == 1 ? parts.get(0) : union(parts);
        }

        private boolean depthZeroEnd() {
            char c = text.charAt(pos);
            return c != ',' && c != ']';
        }

        private PyType parseAtom() {
            skipSpaces();
            int start = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                    pos++;
                } else {
                    break;
                }
            }
            if (start == pos) {
                throw new IllegalArgumentException(text);
            }
            String name = text.substring(start, pos);
            skipSpaces();
            List<PyType> args = new ArrayList<PyType>();
            boolean variadic = false;
            if (pos < text.length() && text.charAt(pos) == '[') {
                pos++;
                while (true) {
                    skipSpaces();
                    if (text.startsWith("...", pos)) {
                        pos += 3;
                        variadic = true;
                    } else {
                        args.add(parseUnion());
                    }
                    skipSpaces();
                    if (pos >= text.length()) throw new IllegalArgumentException(text);
                    char c = text.charAt(pos++);
                    if (c == ']') break;
                    if (c != ',') throw new IllegalArgumentException(text);
                }
            }
            return build(name, args, variadic);
        }

        private PyType build(String name, List<PyType> args, boolean variadic) {
            String simple = name.startsWith("typing.") ? name.substring("typing.".length()) : name;
            if (args.isEmpty()) {
                PyType primitive = fromName(simple);
                if (primitive != null) return primitive;
                return new ClassPyType(builtinAlias(simple));
            }
            switch (simple) {
                case "Optional":
                    return union(args.get(0), NONE);
                case "Union":
                    if (args.size() > UnionPyType.MAX_ALTERNATIVES) throw new IllegalArgumentException(text);
                    return union(args);
                case "tuple":
                case "Tuple":
                    if (args.isEmpty()) throw new IllegalArgumentException(text);
                    return variadic ? TuplePyType.homogeneous(args.get(0)) : TuplePyType.of(args);
                default:
                    return new ClassPyType(builtinAlias(simple), args);
            }
        }

        private static String builtinAlias(String name) {
            switch (name) {
                case "List": return "list";
                case "Dict": return "dict";
                case "Set": return "set";
                case "FrozenSet": return "frozenset";
                case "Type": return "type";
                default: return name;
            }
        }

        private void skipSpaces() {
            while (pos < text.length() && text.charAt(pos) == ' ') pos++;
        }
    }
}
