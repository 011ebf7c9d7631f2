package org.fsmsim.parser;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * 解析器的输出：起始状态名、状态声明列表和迁移声明列表，均保持源文本中的顺序。
 * 不做任何语义检查，交给 {@link org.fsmsim.automata.models.DFAValidator} 处理。
 * 此类是不可变的。
 */
@Getter
public final class ParsedFSM {

    private final String startState;
    private final List<ParsedState> states;
    private final List<ParsedTransition> transitions;

    public ParsedFSM(String startState, List<ParsedState> states, List<ParsedTransition> transitions) {
        this.startState = Objects.requireNonNull(startState, "Start state name cannot be null.");
        this.states = List.copyOf(Objects.requireNonNull(states, "States list cannot be null."));
        this.transitions = List.copyOf(Objects.requireNonNull(transitions, "Transitions list cannot be null."));
    }

    @Override
    public String toString() {
        return "ParsedFSM(start='" + startState + "', states=" + states + ", transitions=" + transitions + ")";
    }
}
