package org.fsmsim.parser;

import lombok.Getter;
import org.fsmsim.automata.base.Alphabet;

import java.util.Objects;

/**
 * 解析阶段得到的迁移声明，起止状态均为未解析的名字。
 * input 是一个 Unicode 码点，可以位于基本多文种平面之外。
 */
@Getter
public final class ParsedTransition {

    private final int input;
    private final String startState;
    private final String endState;

    private final int hashCode;

    public ParsedTransition(int input, String startState, String endState) {
        this.input = input;
        this.startState = Objects.requireNonNull(startState, "Start state name cannot be null");
        this.endState = Objects.requireNonNull(endState, "End state name cannot be null");
        this.hashCode = Objects.hash(input, startState, endState);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ParsedTransition that = (ParsedTransition) o;
        return input == that.input &&
                startState.equals(that.startState) &&
                endState.equals(that.endState);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return Alphabet.render(input) + ": " + startState + " -> " + endState;
    }
}
