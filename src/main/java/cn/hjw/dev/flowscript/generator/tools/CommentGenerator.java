package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.Tool;

/**
 * Comment / Tool Container: 只输出注释, 不绑定变量
 * 注释框的文本 (Text) 与容器标题 (Caption) 逐行写成注释
 */
public class CommentGenerator implements ToolGenerator {

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String text = tool.getConfiguration().text("Text")
                .orElse(tool.getConfiguration().text("Caption").orElse(""));
        for (String line : text.split("\\r?\\n")) {
            if (!line.isBlank()) {
                unit.statement("# " + line.trim());
            }
        }
        return unit.build();
    }
}
