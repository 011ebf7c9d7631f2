package org.fsmsim.automata.models;

import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.fsmsim.automata.base.Alphabet;
import org.fsmsim.automata.base.State;
import org.fsmsim.automata.base.Transition;
import org.fsmsim.exceptions.CharNotInInputAlphabetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 代表一个经过校验的确定性有限自动机 (DFA)。
 * 只能由 {@link DFAValidator} 构造，因此对字母表中每个字符和每个状态，恰好存在一条迁移。
 * 此类是不可变的，没有任何可变状态，可以被多个线程同时运行。
 */
@Getter
public final class DFA implements Automaton {

    private static final Logger logger = LoggerFactory.getLogger(DFA.class);

    private final State initialState;
    private final Set<State> states;
    private final Alphabet alphabet;
    private final Map<Pair<Integer, State>, Transition> transitionFunction;

    /**
     * @param initialState       初始状态。
     * @param states             状态集合，保持声明顺序。
     * @param alphabet           由迁移推导出的字母表。
     * @param transitionFunction 以 (字符, 源状态) 为键的迁移函数，必须是完全的。
     */
    DFA(State initialState, Collection<State> states, Alphabet alphabet, Map<Pair<Integer, State>, Transition> transitionFunction) {
        this.initialState = Objects.requireNonNull(initialState, "Initial state cannot be null.");
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(states, "States cannot be null.")));
        this.alphabet = Objects.requireNonNull(alphabet, "Alphabet cannot be null.");
        this.transitionFunction = Map.copyOf(Objects.requireNonNull(transitionFunction, "Transition function cannot be null."));
    }

    @Override
    public Collection<Transition> getTransitions() {
        return transitionFunction.values();
    }

    /**
     * 单步迁移。
     *
     * @param current 当前状态，必须属于此 DFA。
     * @param symbol  读入的码点。
     * @return 后继状态，带有正确的 accepting 标记。
     * @throws CharNotInInputAlphabetException symbol 不在字母表中时抛出。
     */
    public State step(State current, int symbol) {
        if (!alphabet.contains(symbol)) {
            logger.debug("字符 '{}' 不在字母表 {} 中", Alphabet.render(symbol), alphabet);
            throw new CharNotInInputAlphabetException(symbol);
        }
        Transition transition = transitionFunction.get(Transition.keyOf(symbol, current));
        if (transition == null) {
            throw new IllegalArgumentException("State " + current + " does not belong to this DFA");
        }
        return transition.getTarget();
    }

    @Override
    public boolean run(String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        State current = initialState;
        for (int symbol : input.codePoints().toArray()) {
            current = step(current, symbol);
        }
        logger.debug("输入 \"{}\" 结束于 {}", input, current);
        return current.isAccepting();
    }

    /**
     * 运行并记录经过的状态序列，第一个元素是初始状态。
     * 失败语义与 {@link #run(String)} 相同。
     */
    public List<State> trace(String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        List<State> visited = new ArrayList<>(input.length() + 1);
        State current = initialState;
        visited.add(current);
        for (int symbol : input.codePoints().toArray()) {
            current = step(current, symbol);
            visited.add(current);
        }
        return Collections.unmodifiableList(visited);
    }

    @Override
    public String toString() {
        return "DFA(initial=" + initialState + ", states=" + states.size() + ", " + alphabet + ")";
    }
}
