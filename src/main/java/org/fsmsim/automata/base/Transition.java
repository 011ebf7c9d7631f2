package org.fsmsim.automata.base;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Objects;

/**
 * 已解析的迁移：在 source 上读入 input 后到达 target。
 * DFA 以 {@link #key()} 为键保存迁移，每个键恰好对应一条迁移。
 */
@Getter
public final class Transition {

    private final int input;
    private final State source;
    private final State target;

    private final int hashCode;

    /**
     * @param input  触发迁移的码点 (a)
     * @param source 源状态 (q)
     * @param target 目标状态 (q')
     */
    public Transition(int input, State source, State target) {
        this.input = input;
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(input, source, target);
    }

    /**
     * 迁移函数的键 (input, source)。
     */
    public Pair<Integer, State> key() {
        return keyOf(input, source);
    }

    public static Pair<Integer, State> keyOf(int input, State source) {
        return Pair.of(input, source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return input == that.input &&
                source.equals(that.source) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%s]--> %s", source.getName(), Alphabet.render(input), target.getName());
    }
}
