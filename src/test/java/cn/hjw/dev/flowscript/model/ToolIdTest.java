package cn.hjw.dev.flowscript.model;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Slf4j
public class ToolIdTest {

    /**
     * 场景: 数字ID与非数字ID混合排序
     * 预期: 数字按数值 (10 在 9 之后), 非数字按字典序排在最后
     */
    @Test
    public void testOrdering_NumericBeforeText() {
        List<ToolId> ids = new ArrayList<>(List.of(
                ToolId.of("b"), ToolId.of("10"), ToolId.of("9"), ToolId.of("a"), ToolId.of("2")));
        Collections.sort(ids);
        Assertions.assertEquals(
                List.of(ToolId.of(2), ToolId.of(9), ToolId.of(10), ToolId.of("a"), ToolId.of("b")), ids);
    }

    /**
     * 场景: 前导零与两端空白
     * 预期: 空白被去掉; "01" 与 "1" 不相等但排序稳定
     */
    @Test
    public void testNormalization() {
        Assertions.assertEquals(ToolId.of("5"), ToolId.of(" 5 "));
        Assertions.assertNotEquals(ToolId.of("01"), ToolId.of("1"));
        Assertions.assertTrue(ToolId.of("01").compareTo(ToolId.of("1")) < 0);
        Assertions.assertFalse(ToolId.of("x1").isNumeric());
    }
}
