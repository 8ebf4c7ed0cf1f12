package cn.hjw.dev.flowscript.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

@Getter
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public final class TextValue extends ConfigValue {

    private final String value;

    @Override
    public Optional<String> text() {
        return Optional.of(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
