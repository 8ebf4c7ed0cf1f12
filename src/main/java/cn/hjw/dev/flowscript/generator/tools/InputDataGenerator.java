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
 * Input Data: 按扩展名选择 pandas 读取函数
 * <pre>
 * &lt;File&gt;C:\data\sales.csv&lt;/File&gt;
 * &lt;FormatSpecificOptions&gt;&lt;Delimeter&gt;,&lt;/Delimeter&gt;&lt;HeaderRow&gt;True&lt;/HeaderRow&gt;&lt;/FormatSpecificOptions&gt;
 * </pre>
 */
public class InputDataGenerator implements ToolGenerator {

    static final String DEFAULT_FILE = "input.csv";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();

        String file = config.text("File").orElse(config.text("FileName").orElse(null));
        if (file == null) {
            context.warn("Input Data has no file configured; reading '" + DEFAULT_FILE + "'");
            file = DEFAULT_FILE;
        }
        String path = FileFormat.pathPart(file);
        FileFormat format = FileFormat.of(path);
        ConfigMap options = config.child("FormatSpecificOptions").orElse(ConfigMap.EMPTY);

        List<String> args = new ArrayList<>();
        args.add(PythonSyntax.string(path));
        switch (format) {
            case DELIMITED:
                args.add("sep=" + PythonSyntax.string(delimiter(options)));
                addHeaderOption(options, args);
                break;
            case CSV:
                options.text("Delimeter")
                        .map(FileFormat::decodeDelimiter)
                        .filter(d -> !",".equals(d))
                        .ifPresent(d -> args.add("sep=" + PythonSyntax.string(d)));
                addHeaderOption(options, args);
                break;
            case EXCEL:
                String sheet = FileFormat.sheetPart(file);
                if (sheet != null) {
                    args.add("sheet_name=" + PythonSyntax.string(sheet));
                }
                break;
            case UNKNOWN:
                context.warn("Unrecognized file extension for '" + path + "'; reading as CSV");
                break;
            default:
                break;
        }

        String variable = context.outputVariable();
        unit.statement(variable + " = pd." + format.getReader() + "(" + String.join(", ", args) + ")");
        return unit.build();
    }

    // 分隔文本默认制表符
    private static String delimiter(ConfigMap options) {
        return options.text("Delimeter")
                .map(FileFormat::decodeDelimiter)
                .orElse("\t");
    }

    private static void addHeaderOption(ConfigMap options, List<String> args) {
        if (!options.flag("HeaderRow", true)) {
            args.add("header=None");
        }
    }
}
