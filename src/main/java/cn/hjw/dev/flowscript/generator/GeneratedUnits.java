package cn.hjw.dev.flowscript.generator;

import cn.hjw.dev.flowscript.diagnostic.Diagnostics;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

// 按执行计划排列的代码片段 + 生成阶段的警告
@Getter
@RequiredArgsConstructor
public class GeneratedUnits {

    private final List<CodeUnit> units;
    private final Diagnostics diagnostics;
}
