package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

/**
 * Output Data: 绑定上游数据后按扩展名写出
 */
public class OutputDataGenerator implements ToolGenerator {

    static final String DEFAULT_FILE = "output.csv";

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        unit.statement(variable + " = " + context.primaryInput());

        String file = config.text("File").orElse(config.text("FileName_Out").orElse(null));
        if (file == null) {
            context.warn("Output Data has no file configured; writing '" + DEFAULT_FILE + "'");
            file = DEFAULT_FILE;
        }
        String path = FileFormat.pathPart(file);
        FileFormat format = FileFormat.of(path);

        String target = PythonSyntax.string(path);
        switch (format) {
            case EXCEL:
                String sheet = FileFormat.sheetPart(file);
                unit.statement(variable + ".to_excel(" + target
                        + (sheet != null ? ", sheet_name=" + PythonSyntax.string(sheet) : "") + ", index=False)");
                break;
            case JSON:
                unit.statement(variable + ".to_json(" + target + ", orient='records')");
                break;
            case PARQUET:
                unit.statement(variable + ".to_parquet(" + target + ", index=False)");
                break;
            case DELIMITED:
                unit.statement(variable + ".to_csv(" + target + ", sep='\\t', index=False)");
                break;
            case UNKNOWN:
                context.warn("Unrecognized file extension for '" + path + "'; writing as CSV");
                unit.statement(variable + ".to_csv(" + target + ", index=False)");
                break;
            default:
                unit.statement(variable + ".to_csv(" + target + ", index=False)");
                break;
        }
        return unit.build();
    }
}
