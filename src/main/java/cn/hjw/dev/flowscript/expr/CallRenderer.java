package cn.hjw.dev.flowscript.expr;

import cn.hjw.dev.flowscript.script.PythonSyntax;

import java.util.List;

/**
 * 已翻译参数 -> 目标代码
 */
@FunctionalInterface
public interface CallRenderer {

    String render(List<String> arguments);

    /**
     * 模板渲染: {N} 替换为第 N 个参数, {rN} 替换为其作为方法接收者的写法
     */
    static CallRenderer template(String pattern) {
        return arguments -> {
            StringBuilder sb = new StringBuilder();
            int i = 0;
            while (i < pattern.length()) {
                char c = pattern.charAt(i);
                int close = c == '{' ? pattern.indexOf('}', i) : -1;
                if (close > i) {
                    String slot = pattern.substring(i + 1, close);
                    boolean receiver = slot.startsWith("r");
                    int index = Integer.parseInt(receiver ? slot.substring(1) : slot);
                    String arg = arguments.get(index);
                    sb.append(receiver ? PythonSyntax.receiver(arg) : arg);
                    i = close + 1;
                } else {
                    sb.append(c);
                    i++;
                }
            }
            return sb.toString();
        };
    }

    /**
     * 按参数个数选择模板, patterns[k] 对应 minArity + k 个参数
     */
    static CallRenderer byArity(int minArity, String... patterns) {
        return arguments -> template(patterns[arguments.size() - minArity]).render(arguments);
    }

    /**
     * 二元函数左折叠: f(f(a, b), c) ...
     */
    static CallRenderer fold(String function) {
        return arguments -> {
            String result = arguments.get(0);
            for (int i = 1; i < arguments.size(); i++) {
                result = function + "(" + result + ", " + arguments.get(i) + ")";
            }
            return result;
        };
    }
}
