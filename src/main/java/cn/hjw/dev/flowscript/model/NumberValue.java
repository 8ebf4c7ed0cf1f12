package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

@Getter
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class NumberValue extends ConfigValue {

    // 原始字面量, 生成代码时原样输出, 不做本地化格式化
    private final String literal;

    private final BigDecimal value;

    @Override
    public Optional<String> text() {
        return Optional.of(literal);
    }

    @Override
    public Optional<BigDecimal> asNumber() {
        return Optional.of(value);
    }

    @Override
    public String toString() {
        return literal;
    }
}
