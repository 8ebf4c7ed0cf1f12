package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.config.ConverterConfig;
import cn.hjw.dev.flowscript.expr.TranslatedExpression;

import java.util.List;
import java.util.Optional;

/**
 * 生成上下文
 * 提供给生成器使用的只读视图: 上游变量、下游连线、命名与公式翻译
 */
public interface GenerationContext {

    /**
     * 全部输入变量: 先按目标锚点排序, 同一锚点按文档中的连线顺序
     */
    List<String> inputs();

    /**
     * 绑定到指定目标锚点的第一个输入
     * @param anchor 目标锚点, 忽略大小写
     */
    Optional<String> input(String anchor);

    /**
     * 第一个输入; 没有上游时记录警告并返回空 DataFrame 构造表达式
     */
    String primaryInput();

    /**
     * 指定输出锚点在下游是否有连线
     */
    boolean isConnected(String outputAnchor);

    /**
     * 主输出变量名
     */
    String outputVariable();

    /**
     * 次要输出锚点的变量名: 主变量 + "_" + 锚点名
     */
    String variable(String anchor);

    /**
     * 翻译公式, 并把所需前导项与语义说明写入 unit
     * @param formula 公式原文
     * @param frame   列引用所在的 DataFrame 变量
     * @param unit    当前工具的代码片段构造器
     */
    TranslatedExpression translate(String formula, String frame, CodeUnit.CodeUnitBuilder unit);

    /**
     * 记录归属于当前工具的警告
     */
    void warn(String message);

    ConverterConfig getConfig();

    /**
     * 预填了工具ID、头部注释、输入与主输出变量的构造器
     */
    CodeUnit.CodeUnitBuilder newUnit();
}
