package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Transpose: 列转行, 输出 Name / Value 两列
 * 未选择任何数据字段时对全部非键字段展开
 */
public class TransposeGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();

        List<String> keys = ConfigFields.names(config, "KeyFields", "Field", "field");
        List<String> data = new ArrayList<>();
        for (ConfigMap field : ConfigFields.entries(config, "DataFields", "Field")) {
            if (field.flag("selected", true)) {
                field.text("field").filter(f -> !f.startsWith("*")).ifPresent(data::add);
            }
        }

        StringBuilder call = new StringBuilder(PythonSyntax.receiver(context.primaryInput()))
                .append(".melt(id_vars=").append(PythonSyntax.stringList(keys));
        if (!data.isEmpty()) {
            call.append(", value_vars=").append(PythonSyntax.stringList(data));
        }
        call.append(", var_name='Name', value_name='Value')");
        unit.statement(variable + " = " + call);
        return unit.build();
    }
}
