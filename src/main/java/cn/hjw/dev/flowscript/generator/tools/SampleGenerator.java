package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.ConfigValue;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;

/**
 * Sample: First / Last / Skip / 1-of-N / Random
 * First 与 Last 支持按 GroupFields 分组取样
 */
public class SampleGenerator implements ToolGenerator {

    static final int DEFAULT_N = 100;

    // 随机取样的固定种子, 保证生成脚本可重复运行
    static final int RANDOM_SEED = 42;

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();
        String source = PythonSyntax.receiver(context.primaryInput());

        // N <= 0 对 iloc[::n] 无效, 视同缺失
        String n = config.get("N").flatMap(ConfigValue::asNumber)
                .map(BigDecimal::toBigInteger)
                .filter(i -> i.signum() > 0)
                .map(BigInteger::toString)
                .orElse(null);
        if (n == null) {
            context.warn("Sample has no positive record count; using " + DEFAULT_N);
            n = String.valueOf(DEFAULT_N);
        }
        List<String> groups = ConfigFields.names(config, "GroupFields", "Field", "field");
        String grouped = groups.isEmpty() ? source : source + ".groupby(" + PythonSyntax.stringList(groups) + ", sort=False)";

        String mode = config.text("Mode").orElse("First").toLowerCase(Locale.ROOT).replace(" ", "");
        String code;
        if (mode.startsWith("first")) {
            code = grouped + ".head(" + n + ")";
        } else if (mode.startsWith("last")) {
            code = grouped + ".tail(" + n + ")";
        } else if (mode.startsWith("skip")) {
            code = source + ".iloc[" + n + ":]";
        } else if (mode.startsWith("sample") || mode.contains("1of") || mode.contains("nth")) {
            code = source + ".iloc[::" + n + "]";
        } else if (mode.startsWith("random")) {
            code = source + ".sample(n=min(" + n + ", len(" + source + ")), random_state=" + RANDOM_SEED + ")";
        } else {
            context.warn("Unknown sample mode '" + mode + "'; taking the first " + n + " records");
            code = grouped + ".head(" + n + ")";
        }
        unit.statement(variable + " = " + code);
        return unit.build();
    }
}
