package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.List;

/**
 * Unique: 按键字段保留首条记录
 * Duplicates 锚点在下游有连线时输出其余重复记录
 */
public class UniqueGenerator implements ToolGenerator {

    static final String DUPLICATES_ANCHOR = "Duplicates";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = PythonSyntax.receiver(context.primaryInput());

        List<String> keys = ConfigFields.names(tool.getConfiguration(), "UniqueFields", "Field", "field");
        String subset = "";
        if (keys.isEmpty()) {
            context.warn("Unique has no key fields; comparing all columns");
        } else {
            subset = "subset=" + PythonSyntax.stringList(keys);
        }

        unit.statement(variable + " = " + source + ".drop_duplicates(" + subset + ")");
        if (context.isConnected(DUPLICATES_ANCHOR)) {
            String duplicates = context.variable(DUPLICATES_ANCHOR);
            unit.statement(duplicates + " = " + source + "[" + source + ".duplicated(" + subset + ")]");
            unit.binding(DUPLICATES_ANCHOR, duplicates);
        }
        return unit.build();
    }
}
