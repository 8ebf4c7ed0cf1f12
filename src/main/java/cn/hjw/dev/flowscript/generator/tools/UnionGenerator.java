package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Union: 按输入顺序纵向拼接
 * Mode=ByPos 时其余输入按位置套用第一个输入的列名
 */
public class UnionGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        List<String> inputs = context.inputs();

        if (inputs.size() < 2) {
            if (inputs.isEmpty()) {
                context.warn("Union has no inputs; producing an empty DataFrame");
            }
            unit.statement(variable + " = " + PythonSyntax.receiver(context.primaryInput()) + ".copy()");
            return unit.build();
        }

        boolean byPosition = tool.getConfiguration().text("Mode").map(m -> m.toLowerCase(Locale.ROOT).startsWith("bypos")).orElse(false);
        List<String> frames = new ArrayList<>();
        String first = inputs.get(0);
        frames.add(first);
        for (String input : inputs.subList(1, inputs.size())) {
            frames.add(byPosition ? input + ".set_axis(" + first + ".columns[:len(" + input + ".columns)], axis=1)" : input);
        }
        unit.statement(variable + " = pd.concat([" + String.join(", ", frames) + "], ignore_index=True)");
        return unit.build();
    }
}
