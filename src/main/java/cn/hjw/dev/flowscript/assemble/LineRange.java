package cn.hjw.dev.flowscript.assemble;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 脚本中的行区间, 1 起始, 首尾都包含
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
public class LineRange {

    private final int first;
    private final int last;

    public boolean contains(int line) {
        return line >= first && line <= last;
    }

    @Override
    public String toString() {
        return first + "-" + last;
    }
}
