package org.fsmsim.exceptions;

import lombok.Getter;
import org.fsmsim.parser.ParsedTransition;

/**
 * 同一个 (符号, 状态) 组合声明了多于一条迁移，自动机不确定。
 * 即使两条迁移的目标相同也视为冲突。
 */
@Getter
public class ExtraTransitionException extends ValidationException {

    private final ParsedTransition first;
    private final ParsedTransition second;

    public ExtraTransitionException(ParsedTransition first, ParsedTransition second) {
        super("Transition " + first + " and " + second + " conflict");
        this.first = first;
        this.second = second;
    }
}
