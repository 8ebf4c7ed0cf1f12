package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.Optional;

// 同名子元素重复出现时折叠成列表, 保持文档顺序
@EqualsAndHashCode(callSuper = false)
public final class ListValue extends ConfigValue {

    private final List<ConfigValue> items;

    public ListValue(List<ConfigValue> items) {
        this.items = List.copyOf(items);
    }

    @Override
    public Optional<String> text() {
        return items.isEmpty() ? Optional.empty() : items.get(0).text();
    }

    @Override
    public List<ConfigValue> asList() {
        return items;
    }

    @Override
    public Optional<ConfigMap> asMap() {
        return items.isEmpty() ? Optional.empty() : items.get(0).asMap();
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
