package cn.hjw.dev.flowscript.exception;

// 致命错误的基类: 抛出即终止转换, 不产生任何脚本
public class FlowScriptException extends RuntimeException {

    public FlowScriptException(String message) {
        super(message);
    }

    public FlowScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
