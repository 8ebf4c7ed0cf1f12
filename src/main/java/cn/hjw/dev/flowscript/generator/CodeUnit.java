package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.model.ToolId;
import cn.hjw.dev.flowscript.script.Requirement;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单个工具生成的代码片段 (不可变)
 *
 * outputVariable 为主输出锚点绑定的变量, 文档类工具为 null;
 * bindings 为次要输出锚点 -> 变量 (例如 Filter 的 False 分支)
 */
@Getter
@Builder(toBuilder = true)
public class CodeUnit {

    @NonNull
    private final ToolId toolId;

    // 头部注释正文, 装配时加上注释前缀
    @NonNull
    private final String header;

    // 语句按生成顺序排列, 不含外层缩进
    @Singular
    private final List<String> statements;

    private final String outputVariable;

    @Singular
    private final Map<String, String> bindings;

    @Singular
    private final List<String> inputVariables;

    @Singular
    private final Set<Requirement> requirements;

    /**
     * 下游通过某个输出锚点取数据时对应的变量
     * 未单独绑定的锚点取主输出
     */
    public String variableFor(String anchor) {
        if (anchor != null) {
            for (Map.Entry<String, String> e : bindings.entrySet()) {
                if (e.getKey().equalsIgnoreCase(anchor)) {
                    return e.getValue();
                }
            }
        }
        return outputVariable;
    }

    public boolean isDocumentation() {
        return outputVariable == null;
    }
}
