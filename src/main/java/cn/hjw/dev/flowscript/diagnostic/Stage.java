package cn.hjw.dev.flowscript.diagnostic;

// 产生诊断的流水线阶段
public enum Stage {
    PARSE,
    RESOLVE,
    GENERATE
}
