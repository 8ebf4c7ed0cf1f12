package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.script.Requirement;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 函数映射表的一项
 */
@Getter
@Builder
public class FunctionMapping {

    public static final int VARIADIC = Integer.MAX_VALUE;

    @NonNull
    private final String name;

    private final int minArity;

    private final int maxArity;

    /**
     * 固定的结果类型; 为 null 时取 {@link #kindFromArgument} 指定参数的类型
     */
    private final ValueKind resultKind;

    @Builder.Default
    private final int kindFromArgument = -1;

    // 写进生成代码前的说明, 例如语义上的近似
    private final String note;

    @Builder.Default
    private final Set<Requirement> requirements = Collections.emptySet();

    @NonNull
    private final CallRenderer renderer;

    public boolean accepts(int arity) {
        return arity >= minArity && arity <= maxArity;
    }

    public ValueKind resultKind(List<ValueKind> argumentKinds) {
        if (resultKind != null) {
            return resultKind;
        }
        if (kindFromArgument >= 0 && kindFromArgument < argumentKinds.size()) {
            return argumentKinds.get(kindFromArgument);
        }
        return ValueKind.UNKNOWN;
    }

    public String render(List<String> arguments) {
        return renderer.render(arguments);
    }
}
