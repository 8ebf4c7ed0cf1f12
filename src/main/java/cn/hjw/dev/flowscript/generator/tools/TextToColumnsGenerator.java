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
 * Text To Columns: 拆分到多列 (根名 + 序号) 或拆分到多行
 * <pre>
 * &lt;Field&gt;Address&lt;/Field&gt;
 * &lt;RootName&gt;Address&lt;/RootName&gt;
 * &lt;Delimeters value=","/&gt;
 * &lt;NumFields value="3"/&gt;
 * &lt;SplitToRows value="False"/&gt;
 * </pre>
 * 多个分隔符字符按字符类正则拆分
 */
public class TextToColumnsGenerator implements ToolGenerator {

    static final int DEFAULT_COLUMNS = 2;

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        unit.statement(variable + " = " + PythonSyntax.receiver(context.primaryInput()) + ".copy()");

        String field = config.text("Field").orElse(null);
        if (field == null) {
            context.warn("Text To Columns has no field to split; passing data through");
            return unit.build();
        }
        String delimiters = decode(config.text("Delimeters").orElse(","));
        String column = PythonSyntax.column(variable, field);
        String split = column + ".astype(str).str.split(" + pattern(delimiters);

        if (config.flag("SplitToRows", false)) {
            unit.statement(column + " = " + split + ")");
            unit.statement(variable + " = " + variable + ".explode(" + PythonSyntax.string(field) + ", ignore_index=True)");
            return unit.build();
        }

        int count;
        String numText = config.text("NumFields").orElse(null);
        if (numText != null && numText.matches("\\d+") && Integer.parseInt(numText) > 0) {
            count = Integer.parseInt(numText);
        } else {
            context.warn("Text To Columns has no column count; splitting into " + DEFAULT_COLUMNS + " columns");
            count = DEFAULT_COLUMNS;
        }
        String root = config.text("RootName").orElse(field);
        List<String> targets = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            targets.add(root + i);
        }
        unit.statement(variable + "[" + PythonSyntax.stringList(targets) + "] = " + split
                + ", n=" + (count - 1) + ", expand=True).reindex(columns=range(" + count + "))");
        return unit.build();
    }

    // \t 表示制表符, \s 表示空格, \n 表示换行
    static String decode(String raw) {
        return raw.replace("\\t", "\t").replace("\\s", " ").replace("\\n", "\n");
    }

    private static String pattern(String delimiters) {
        if (delimiters.length() == 1) {
            return PythonSyntax.string(delimiters);
        }
        StringBuilder sb = new StringBuilder("[");
        for (char c : delimiters.toCharArray()) {
            if ("\\]^-[".indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return PythonSyntax.string(sb.append(']').toString()) + ", regex=True";
    }
}
