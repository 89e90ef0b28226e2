package com.typelens.compiler.analysis;

import com.typelens.compiler.analysis.types.ClassPyType;
import com.typelens.compiler.analysis.types.PyType;
import com.typelens.compiler.analysis.types.PyTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeUnifier 单元测试
 */
class TypeUnifierTest {

    private final TypeUnifier unifier = new TypeUnifier();

    private String unify(PyType... types) {
        return unifier.unify(Arrays.asList(types)).toDisplayString();
    }

    // ============ 统一规则 ============

    @Nested
    @DisplayName("类型统一")
    class UnifyTests {

        @Test
        @DisplayName("相同类型保持不变")
        void testIdentical() {
            assertEquals("int", unify(PyTypes.INT, PyTypes.INT, PyTypes.INT));
            assertEquals("list[str]", unify(PyTypes.listOf(PyTypes.STR), PyTypes.listOf(PyTypes.STR)));
        }

        @Test
        @DisplayName("int 与 float 提升为 float")
        void testNumericWidening() {
            assertEquals("float", unify(PyTypes.INT, PyTypes.FLOAT));
            assertEquals("float", unify(PyTypes.FLOAT, PyTypes.INT, PyTypes.INT));
        }

        @Test
        @DisplayName("数值与 str 混合为 Any")
        void testNumericAndString() {
            assertEquals("Any", unify(PyTypes.INT, PyTypes.STR));
            assertEquals("Any", unify(PyTypes.FLOAT, PyTypes.STR, PyTypes.NONE));
        }

        @Test
        @DisplayName("不确定类型参与时为 Any")
        void testIndeterminate() {
            assertEquals("Any", unify(PyTypes.INT, PyTypes.ANY));
            assertEquals("Any", unify(PyTypes.STR, PyTypes.UNKNOWN));
            assertEquals("Any", unify(PyTypes.STR, PyTypes.deferred("load")));
        }

        @Test
        @DisplayName("其余情况取联合")
        void testUnion() {
            assertEquals("str | None", unify(PyTypes.STR, PyTypes.NONE));
            assertEquals("int | None", unify(PyTypes.INT, PyTypes.NONE, PyTypes.INT));
            assertEquals("str | bytes | None", unify(PyTypes.STR, PyTypes.BYTES, PyTypes.NONE));
        }

        @Test
        @DisplayName("超过三路联合为 Any")
        void testTooManyAlternatives() {
            assertEquals("Any", unify(PyTypes.STR, PyTypes.BYTES, PyTypes.NONE, new ClassPyType("Path")));
        }

        @Test
        @DisplayName("空集合为 unknown")
        void testEmpty() {
            assertSame(PyTypes.UNKNOWN, unifier.unify(Collections.<PyType>emptyList()));
        }
    }

    // ============ 抽样 ============

    @Nested
    @DisplayName("元素抽样")
    class SamplingTests {

        @Test
        @DisplayName("不超过上限时全部取用")
        void testSmall() {
            assertEquals(Arrays.asList(0, 1, 2), unifier.sampleIndices(3));
        }

        @Test
        @DisplayName("超过上限时等步长取样并包含首尾")
        void testLarge() {
            TypeUnifier small = new TypeUnifier(3);
            assertEquals(Arrays.asList(0, 4, 9), small.sampleIndices(10));
            List<Integer> indices = unifier.sampleIndices(1000);
            assertEquals(10, indices.size());
            assertEquals(0, indices.get(0));
            assertEquals(999, indices.get(9));
        }

        @Test
        @DisplayName("抽样上限至少为 2")
        void testInvalidLimit() {
            assertThrows(IllegalArgumentException.class, () -> new TypeUnifier(1));
        }

        @Test
        @DisplayName("抽样只看被选中的元素")
        void testSampleSkipsMiddle() {
            TypeUnifier small = new TypeUnifier(2);
            List<String> picked = small.sample(Arrays.asList("a", "b", "c", "d"));
            assertEquals(Arrays.asList("a", "d"), picked);
        }
    }

    // ============ 确定性 ============

    @Test
    @DisplayName("isConcrete 排除 Any、unknown 和延迟占位")
    void testIsConcrete() {
        assertTrue(TypeUnifier.isConcrete(PyTypes.INT));
        assertTrue(TypeUnifier.isConcrete(PyTypes.union(PyTypes.INT, PyTypes.NONE)));
        assertFalse(TypeUnifier.isConcrete(PyTypes.ANY));
        assertFalse(TypeUnifier.isConcrete(PyTypes.UNKNOWN));
        assertFalse(TypeUnifier.isConcrete(PyTypes.deferred("f")));
        assertFalse(TypeUnifier.isConcrete(null));
    }

    @Test
    @DisplayName("注解文本解析")
    void testParseAnnotation() {
        assertEquals("int | None", PyTypes.parse("Optional[int]").toDisplayString());
        assertEquals("list[str]", PyTypes.parse("List[str]").toDisplayString());
        assertEquals("tuple[int, ...]", PyTypes.parse("Tuple[int, ...]").toDisplayString());
        assertEquals("dict[str, int | float]", PyTypes.parse("Dict[str, Union[int, float]]").toDisplayString());
        assertEquals("Any", PyTypes.parse("").toDisplayString());
    }
}
