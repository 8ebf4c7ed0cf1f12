package cn.hjw.dev.flowscript.model;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Slf4j
public class ConfigMapTest {

    /**
     * 场景: 同名键重复出现
     * 预期: 折叠为有序列表, text 取首个
     */
    @Test
    public void testRepeatedKeysCollapseToList() {
        ConfigMap map = ConfigMap.builder()
                .put("Field", ConfigValue.scalar("a"))
                .put("Field", ConfigValue.scalar("b"))
                .build();
        List<ConfigValue> fields = map.list("Field");
        Assertions.assertEquals(2, fields.size());
        Assertions.assertEquals(Optional.of("b"), fields.get(1).text());
        Assertions.assertEquals(Optional.of("a"), map.text("Field"));
    }

    /**
     * 场景: 值以 value 属性形式给出, 以及空白文本
     * 预期: text 回退到 value 属性; 空白视为缺失
     */
    @Test
    public void testTextFallsBackToValueAttribute() {
        ConfigMap nested = ConfigMap.builder().put("value", ConfigValue.scalar("42")).build();
        ConfigMap map = ConfigMap.builder()
                .put("NumRows", nested)
                .put("Blank", ConfigValue.scalar("   "))
                .build();
        Assertions.assertEquals(Optional.of("42"), map.text("NumRows"));
        Assertions.assertEquals(Optional.empty(), map.text("Blank"));
        Assertions.assertEquals(Optional.empty(), map.text("Missing"));
    }

    /**
     * 场景: 标量类型识别与布尔开关
     */
    @Test
    public void testScalarKindsAndFlags() {
        Assertions.assertTrue(ConfigValue.scalar("12.50") instanceof NumberValue);
        Assertions.assertEquals(Optional.of(new BigDecimal("12.50")), ConfigValue.scalar("12.50").asNumber());
        // 原样保留字面量
        Assertions.assertEquals(Optional.of("12.50"), ConfigValue.scalar("12.50").text());
        Assertions.assertTrue(ConfigValue.scalar("True") instanceof BooleanValue);

        ConfigMap map = ConfigMap.builder()
                .put("On", ConfigValue.scalar("True"))
                .put("Off", ConfigMap.builder().put("value", ConfigValue.scalar("False")).build())
                .build();
        Assertions.assertTrue(map.flag("On", false));
        Assertions.assertFalse(map.flag("Off", true));
        Assertions.assertTrue(map.flag("Missing", true));
    }
}
