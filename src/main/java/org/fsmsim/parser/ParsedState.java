package org.fsmsim.parser;

import lombok.Getter;

import java.util.Objects;

/**
 * 解析阶段得到的状态声明：一个名字以及是否为接受状态。
 * 纯文本信息，尚未解析为 {@link org.fsmsim.automata.base.State}。
 */
@Getter
public final class ParsedState {

    private final String name;
    private final boolean accepting;

    private final int hashCode;

    private ParsedState(String name, boolean accepting) {
        this.name = Objects.requireNonNull(name, "State name cannot be null");
        this.accepting = accepting;
        this.hashCode = Objects.hash(name, accepting);
    }

    /**
     * 普通状态声明，对应 {@code \tNAME}。
     */
    public static ParsedState plain(String name) {
        return new ParsedState(name, false);
    }

    /**
     * 接受状态声明，对应 {@code \tfinal: NAME}。
     */
    public static ParsedState accepting(String name) {
        return new ParsedState(name, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ParsedState that = (ParsedState) o;
        return accepting == that.accepting && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return accepting ? "final: " + name : name;
    }
}
