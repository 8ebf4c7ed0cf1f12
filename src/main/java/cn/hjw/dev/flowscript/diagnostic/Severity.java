package cn.hjw.dev.flowscript.diagnostic;

public enum Severity {
    WARNING,
    ERROR
}
