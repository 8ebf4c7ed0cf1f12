package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 有序配置映射
 * XML 元素的属性、子元素以及非空文本 (键 {@value #TEXT_KEY}) 都落在这里
 */
@EqualsAndHashCode(callSuper = false)
public final class ConfigMap extends ConfigValue {

    public static final String TEXT_KEY = "#text";

    public static final ConfigMap EMPTY = new ConfigMap(Collections.emptyMap());

    private final Map<String, ConfigValue> entries;

    private ConfigMap(Map<String, ConfigValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ConfigValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * 读取文本: 优先取值本身的文本, 其次取 {@code <Key value="..."/>} 形式的 value 属性
     * 空白文本视为缺失
     */
    public Optional<String> text(String key) {
        ConfigValue v = entries.get(key);
        if (v == null) {
            return Optional.empty();
        }
        Optional<String> direct = v.text().map(String::trim).filter(s -> !s.isEmpty());
        if (direct.isPresent()) {
            return direct;
        }
        return v.asMap().flatMap(m -> m.text("value"));
    }

    public Optional<ConfigMap> child(String key) {
        return get(key).flatMap(ConfigValue::asMap);
    }

    public List<ConfigValue> list(String key) {
        return get(key).map(ConfigValue::asList).orElse(Collections.emptyList());
    }

    public boolean flag(String key, boolean defaultValue) {
        ConfigValue v = entries.get(key);
        if (v == null) {
            return defaultValue;
        }
        Optional<Boolean> direct = v.asBoolean();
        if (direct.isPresent()) {
            return direct.get();
        }
        return v.asMap()
                .flatMap(m -> m.get("value"))
                .flatMap(ConfigValue::asBoolean)
                .orElse(defaultValue);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public Optional<String> text() {
        ConfigValue t = entries.get(TEXT_KEY);
        return t == null ? Optional.empty() : t.text();
    }

    @Override
    public Optional<ConfigMap> asMap() {
        return Optional.of(this);
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder {

        private final Map<String, List<ConfigValue>> collected = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 同名键重复出现时折叠成列表
         */
        public Builder put(String key, ConfigValue value) {
            collected.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
            return this;
        }

        public ConfigMap build() {
            Map<String, ConfigValue> entries = new LinkedHashMap<>();
            collected.forEach((k, values) ->
                    entries.put(k, values.size() == 1 ? values.get(0) : new ListValue(values)));
            return new ConfigMap(entries);
        }
    }
}
