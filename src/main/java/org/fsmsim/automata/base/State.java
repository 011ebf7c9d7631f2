package org.fsmsim.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 代表 DFA 中的一个状态：名字加上是否为接受状态。
 * State 是不可变对象。
 * <p>
 * 注意：{@link #equals(Object)} 和 {@link #hashCode()} 只比较名字，不比较 accepting 标记。
 * 同名但标记不同的两个 State 在集合和映射中是同一个键，
 * 因此只能用名字来查找状态，接受与否必须从已解析的实例上读取。
 */
@Getter
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    private final String name;
    private final boolean accepting;

    private final int hashCode;

    private State(String name, boolean accepting) {
        this.name = Objects.requireNonNull(name, "State name cannot be null");
        this.accepting = accepting;
        this.hashCode = name.hashCode();
        logger.debug("创建了一个State: {}", this);
    }

    /**
     * 创建一个普通（非接受）状态。
     * @param name 状态名。
     * @return 新的 State 实例。
     */
    public static State of(String name) {
        return new State(name, false);
    }

    /**
     * 创建一个接受状态。
     * @param name 状态名。
     * @return 新的 State 实例。
     */
    public static State accepting(String name) {
        return new State(name, true);
    }

    public static State of(String name, boolean accepting) {
        return new State(name, accepting);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        // 只比较名字
        return name.equals(state.name);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public int compareTo(State other) {
        return this.name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return (accepting ? "AcceptState(" : "State(") + name + ")";
    }
}
