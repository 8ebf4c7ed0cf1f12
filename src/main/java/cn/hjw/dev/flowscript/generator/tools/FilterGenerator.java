package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.expr.TranslatedExpression;
import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.Locale;
import java.util.Optional;

/**
 * Filter: True 锚点为主输出, False 锚点在下游有连线时才生成
 * <pre>
 * &lt;Mode&gt;Custom&lt;/Mode&gt;
 * &lt;Expression&gt;[Amount] &amp;gt; 1000&lt;/Expression&gt;
 * </pre>
 * 简单模式 (Mode=Simple) 由 Field / Operator / Operands 组成条件
 */
public class FilterGenerator implements ToolGenerator {

    static final String FALSE_ANCHOR = "False";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = context.primaryInput();
        boolean falseConnected = context.isConnected(FALSE_ANCHOR);
        String falseVariable = context.variable(FALSE_ANCHOR);

        Optional<String> formula = condition(tool.getConfiguration());
        if (formula.isEmpty()) {
            context.warn("Filter has no condition; passing all rows through");
            unit.statement(variable + " = " + PythonSyntax.receiver(source) + ".copy()");
            if (falseConnected) {
                unit.statement(falseVariable + " = " + PythonSyntax.receiver(source) + ".iloc[0:0]");
                unit.binding(FALSE_ANCHOR, falseVariable);
            }
            return unit.build();
        }

        TranslatedExpression condition = context.translate(formula.get(), source, unit);
        String mask = condition.getCode();
        unit.statement(variable + " = " + PythonSyntax.receiver(source) + "[" + mask + "]");
        if (falseConnected) {
            unit.statement(falseVariable + " = " + PythonSyntax.receiver(source) + "[~" + PythonSyntax.receiver(mask) + "]");
            unit.binding(FALSE_ANCHOR, falseVariable);
        }
        return unit.build();
    }

    /**
     * 条件公式: 自定义表达式优先, 其次由简单模式拼出
     */
    static Optional<String> condition(ConfigMap config) {
        String mode = config.text("Mode").orElse("");
        Optional<String> custom = config.text("Expression");
        if (!"simple".equalsIgnoreCase(mode) && custom.isPresent()) {
            return custom;
        }
        Optional<String> simple = config.child("Simple").flatMap(FilterGenerator::simpleCondition);
        return simple.isPresent() ? simple : custom;
    }

    private static Optional<String> simpleCondition(ConfigMap simple) {
        Optional<String> field = simple.text("Field");
        Optional<String> operator = simple.text("Operator");
        if (field.isEmpty() || operator.isEmpty()) {
            return Optional.empty();
        }
        String ref = "[" + field.get().replace("]", "]]") + "]";
        String operand = simple.child("Operands").flatMap(o -> o.text("Operand")).orElse("");
        String value = isNumber(operand) ? operand : quote(operand);

        switch (operator.get().trim().toLowerCase(Locale.ROOT)) {
            case "=":
            case "!=":
            case "<":
            case "<=":
            case ">":
            case ">=":
                return Optional.of(ref + " " + operator.get().trim() + " " + value);
            case "isnull":
                return Optional.of("IsNull(" + ref + ")");
            case "isnotnull":
                return Optional.of("!IsNull(" + ref + ")");
            case "isempty":
                return Optional.of("IsEmpty(" + ref + ")");
            case "isnotempty":
                return Optional.of("!IsEmpty(" + ref + ")");
            case "contains":
                return Optional.of("Contains(" + ref + ", " + value + ")");
            case "doesnotcontain":
                return Optional.of("!Contains(" + ref + ", " + value + ")");
            default:
                // 交给翻译器, 无法识别时生成占位与警告
                return Optional.of(ref + " " + operator.get().trim() + " " + value);
        }
    }

    // 补零的值 (007) 按文本比较
    private static boolean isNumber(String text) {
        return text.matches("-?(0|[1-9]\\d*)(\\.\\d+)?");
    }

    /**
     * 原样文本 -> 公式字符串字面量; 公式中反斜杠是转义符, 需要双写
     */
    static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\"\"") + "\"";
    }
}
