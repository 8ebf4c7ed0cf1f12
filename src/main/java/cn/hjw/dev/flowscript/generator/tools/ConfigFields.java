package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.ConfigValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 常见配置结构的读取工具
 * 例如 {@code <SortInfo><Field field="A" order="Ascending"/></SortInfo>}
 */
final class ConfigFields {

    private ConfigFields() {
    }

    /**
     * container 下所有 element 子元素, 只保留映射形式的项
     */
    static List<ConfigMap> entries(ConfigMap config, String container, String element) {
        return config.child(container).map(c -> maps(c.list(element))).orElseGet(ArrayList::new);
    }

    static List<ConfigMap> maps(List<ConfigValue> values) {
        List<ConfigMap> result = new ArrayList<>();
        for (ConfigValue v : values) {
            v.asMap().ifPresent(result::add);
        }
        return result;
    }

    /**
     * container 下各 element 的 attribute 值, 跳过缺失项
     */
    static List<String> names(ConfigMap config, String container, String element, String attribute) {
        List<String> result = new ArrayList<>();
        for (ConfigMap entry : entries(config, container, element)) {
            entry.text(attribute).ifPresent(result::add);
        }
        return result;
    }

    /**
     * 子元素 key 的 attribute 值, 如 {@code <HeaderField field="Quarter"/>}
     */
    static Optional<String> attribute(ConfigMap config, String key, String attribute) {
        return config.child(key).flatMap(m -> m.text(attribute));
    }
}
