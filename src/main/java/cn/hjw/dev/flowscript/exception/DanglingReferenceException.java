package cn.hjw.dev.flowscript.exception;

import cn.hjw.dev.flowscript.model.Connection;
import lombok.Getter;

/**
 * 连线引用了不存在的工具
 */
@Getter
public class DanglingReferenceException extends FlowScriptException {

    private final transient Connection connection;

    public DanglingReferenceException(Connection connection, String missingEnd) {
        super("Connection [" + connection + "] references missing " + missingEnd + " tool");
        this.connection = connection;
    }
}
