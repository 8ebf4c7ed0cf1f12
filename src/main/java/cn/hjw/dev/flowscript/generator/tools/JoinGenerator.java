package cn.hjw.dev.flowscript.generator.tools;

import cn.hjw.dev.flowscript.generator.CodeUnit;
import cn.hjw.dev.flowscript.generator.GenerationContext;
import cn.hjw.dev.flowscript.generator.ToolGenerator;
import cn.hjw.dev.flowscript.model.ConfigMap;
import cn.hjw.dev.flowscript.model.Tool;
import cn.hjw.dev.flowscript.script.PythonSyntax;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Join: Left/Right 两个输入按键合并
 * <pre>
 * &lt;JoinInfo connection="Left"&gt;&lt;Field field="CustomerID"/&gt;&lt;/JoinInfo&gt;
 * &lt;JoinInfo connection="Right"&gt;&lt;Field field="ID"/&gt;&lt;/JoinInfo&gt;
 * </pre>
 * 主输出 Join 锚点; Left / Right 锚点为未匹配的记录, 下游有连线时才生成
 */
public class JoinGenerator implements ToolGenerator {

    static final String LEFT_ANCHOR = "Left";
    static final String RIGHT_ANCHOR = "Right";

    @Getter
    @RequiredArgsConstructor
    enum JoinKind {
        INNER("inner"),
        LEFT("left"),
        RIGHT("right"),
        OUTER("outer"),
        // 只保留两侧未匹配的记录
        EXCLUDE("outer");

        private final String how;

        static JoinKind parse(String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "inner":
                    return INNER;
                case "left":
                    return LEFT;
                case "right":
                    return RIGHT;
                case "outer":
                case "full":
                    return OUTER;
                case "exclude":
                    return EXCLUDE;
                default:
                    return null;
            }
        }
    }

    @Override
    public CodeUnit generate(Tool tool, GenerationContext context) {
        ConfigMap config = tool.getConfiguration();
        CodeUnit.CodeUnitBuilder unit = context.newUnit();
        String variable = context.outputVariable();

        List<String> inputs = context.inputs();
        if (inputs.size() < 2) {
            context.warn("Join needs two inputs but has " + inputs.size() + "; passing the first input through");
            unit.statement(variable + " = " + context.primaryInput());
            return unit.build();
        }
        String left = context.input(LEFT_ANCHOR).orElse(inputs.get(0));
        String right = context.input(RIGHT_ANCHOR).orElse(inputs.get(1));

        boolean byPosition = config.flag("joinByRecordPos", false);
        List<String> leftKeys = keys(config, LEFT_ANCHOR);
        List<String> rightKeys = keys(config, RIGHT_ANCHOR);
        if (!byPosition && (leftKeys.isEmpty() || leftKeys.size() != rightKeys.size())) {
            context.warn("Join has no matching key pairs; passing the left input through");
            unit.statement(variable + " = " + left);
            return unit.build();
        }

        JoinKind kind = JoinKind.INNER;
        String kindText = config.text("JoinType").orElse(null);
        if (kindText != null) {
            JoinKind parsed = JoinKind.parse(kindText);
            if (parsed == null) {
                context.warn("Unknown join type '" + kindText + "'; using inner join");
            } else {
                kind = parsed;
            }
        }

        String on = byPosition
                ? "left_index=True, right_index=True"
                : "left_on=" + PythonSyntax.stringList(leftKeys) + ", right_on=" + PythonSyntax.stringList(rightKeys);
        if (kind == JoinKind.EXCLUDE) {
            unit.statement(variable + " = pd.merge(" + left + ", " + right + ", " + on + ", how='outer', indicator=True)");
            unit.statement(variable + " = " + variable + "[" + PythonSyntax.column(variable, "_merge") + " != 'both']"
                    + ".drop(columns=['_merge'])");
        } else {
            unit.statement(variable + " = pd.merge(" + left + ", " + right + ", " + on + ", how='" + kind.getHow() + "')");
        }

        // 未匹配记录
        if (context.isConnected(LEFT_ANCHOR)) {
            String unmatched = context.variable(LEFT_ANCHOR);
            unit.statement(unmatched + " = " + left + "[~" + membership(left, leftKeys, right, rightKeys, byPosition) + "]");
            unit.binding(LEFT_ANCHOR, unmatched);
        }
        if (context.isConnected(RIGHT_ANCHOR)) {
            String unmatched = context.variable(RIGHT_ANCHOR);
            unit.statement(unmatched + " = " + right + "[~" + membership(right, rightKeys, left, leftKeys, byPosition) + "]");
            unit.binding(RIGHT_ANCHOR, unmatched);
        }
        return unit.build();
    }

    private static List<String> keys(ConfigMap config, String side) {
        List<String> result = new ArrayList<>();
        for (ConfigMap info : ConfigFields.maps(config.list("JoinInfo"))) {
            if (side.equalsIgnoreCase(info.text("connection").orElse(""))) {
                for (ConfigMap field : ConfigFields.maps(info.list("Field"))) {
                    field.text("field").ifPresent(result::add);
                }
            }
        }
        return result;
    }

    // frame 的键是否出现在 other 中
    private static String membership(String frame, List<String> keys, String other, List<String> otherKeys,
                                     boolean byPosition) {
        if (byPosition) {
            return frame + ".index.isin(" + other + ".index)";
        }
        return "pd.MultiIndex.from_frame(" + frame + "[" + PythonSyntax.stringList(keys) + "])"
                + ".isin(pd.MultiIndex.from_frame(" + other + "[" + PythonSyntax.stringList(otherKeys) + "]))";
    }
}
