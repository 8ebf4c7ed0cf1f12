package cn.hjw.dev.flowscript;

/**
 * 工作流文档 -> Python 脚本
 */
public interface ScriptConverter {

    /**
     * 转换工作流文档
     * @param document 文档文本
     * @return 脚本、警告、行区间以及中间产物
     * @throws cn.hjw.dev.flowscript.exception.FlowScriptException 致命错误, 不产生部分脚本
     */
    ConversionResult convert(String document);
}
