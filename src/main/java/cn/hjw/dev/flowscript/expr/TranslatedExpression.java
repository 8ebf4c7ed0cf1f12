package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.script.Requirement;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * 翻译结果
 */
@Getter
@RequiredArgsConstructor
public class TranslatedExpression {

    private final String code;

    private final ValueKind kind;

    private final Set<Requirement> requirements;

    // 语义近似说明, 由生成器写成注释
    private final List<String> notes;

    // true: 至少一处无法翻译, 运行到此会抛 NotImplementedError
    private final boolean placeholder;
}
