package cn.hjw.dev.flowscript.exception;

/**
 * 文档结构损坏, 无法提取任何工具或连线
 */
public class DocumentParseException extends FlowScriptException {

    public DocumentParseException(String message) {
        super(message);
    }

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
