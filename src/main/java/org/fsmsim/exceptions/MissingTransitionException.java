package org.fsmsim.exceptions;

import lombok.Getter;
import org.fsmsim.automata.base.Alphabet;
import org.fsmsim.automata.base.State;

/**
 * 某个 (符号, 状态) 组合没有声明迁移，自动机不完全。
 */
@Getter
public class MissingTransitionException extends ValidationException {

    private final int symbol;
    private final State state;

    public MissingTransitionException(int symbol, State state) {
        super("Missing transition on '" + Alphabet.render(symbol) + "' from " + state);
        this.symbol = symbol;
        this.state = state;
    }
}
