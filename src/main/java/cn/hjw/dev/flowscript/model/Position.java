package cn.hjw.dev.flowscript.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

// 画布坐标, 代码生成不使用, 仅透传
@Getter
@RequiredArgsConstructor
public class Position {

    public static final Position ORIGIN = new Position(0, 0);

    private final double x;
    private final double y;
}
