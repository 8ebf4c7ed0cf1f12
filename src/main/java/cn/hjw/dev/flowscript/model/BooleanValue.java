package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@Getter
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class BooleanValue extends ConfigValue {

    private final String literal;

    private final boolean value;

    @Override
    public Optional<String> text() {
        return Optional.of(literal);
    }

    @Override
    public Optional<Boolean> asBoolean() {
        return Optional.of(value);
    }

    @Override
    public String toString() {
        return literal;
    }
}
