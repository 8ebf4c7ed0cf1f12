package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.expr.TranslatedExpression;
import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Multi-Field Formula: 同一公式作用于多个字段, [_CurrentField_] 替换为当前字段
 * CopyOutput 为 true 时结果写入带前缀/后缀的新字段
 */
public class MultiFieldFormulaGenerator implements ToolGenerator {

    private static final Pattern CURRENT_FIELD = Pattern.compile("\\[_CurrentField_\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern CURRENT_FIELD_NAME = Pattern.compile("\\[_CurrentFieldName_\\]", Pattern.CASE_INSENSITIVE);

    static final String DEFAULT_ADD_ON = "New_";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        unit.statement(variable + " = " + PythonSyntax.receiver(context.primaryInput()) + ".copy()");

        String expression = config.text("Expression").orElse(null);
        List<String> fields = selectedFields(config);
        if (expression == null || fields.isEmpty()) {
            context.warn("Multi-Field Formula has no " + (expression == null ? "expression" : "selected fields")
                    + "; passing data through");
            return unit.build();
        }

        boolean copyOutput = config.flag("CopyOutput", false);
        String addOn = config.text("NewFieldAddOn").orElse(DEFAULT_ADD_ON);
        boolean suffix = "suffix".equalsIgnoreCase(config.text("NewFieldAddOnPos").orElse("Prefix"));
        String outputType = config.flag("ChangeFieldType", false)
                ? ConfigFields.attribute(config, "OutputFieldType", "type").orElse(null)
                : null;

        for (String field : fields) {
            String formula = substitute(expression, field);
            TranslatedExpression expr = context.translate(formula, variable, unit);
            String target = copyOutput ? (suffix ? field + addOn : addOn + field) : field;
            String code = FieldTypes.coerce(expr.getCode(), expr.getKind(), outputType, variable);
            unit.statement(PythonSyntax.column(variable, target) + " = " + code);
        }
        return unit.build();
    }

    // <Fields><Field name="Q1" selected="True"/></Fields>, selected 缺省为选中
    private static List<String> selectedFields(ConfigMap config) {
        List<String> result = new ArrayList<>();
        for (ConfigMap field : ConfigFields.entries(config, "Fields", "Field")) {
            if (field.flag("selected", true)) {
                field.text("name").filter(n -> !n.startsWith("*")).ifPresent(result::add);
            }
        }
        return result;
    }

    static String substitute(String expression, String field) {
        String withField = CURRENT_FIELD.matcher(expression)
                .replaceAll(Matcher.quoteReplacement("[" + field.replace("]", "]]") + "]"));
        return CURRENT_FIELD_NAME.matcher(withField)
                .replaceAll(Matcher.quoteReplacement(FilterGenerator.quote(field)));
    }
}
