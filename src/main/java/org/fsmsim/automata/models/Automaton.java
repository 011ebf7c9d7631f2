package org.fsmsim.automata.models;

import org.fsmsim.automata.base.Alphabet;
import org.fsmsim.automata.base.State;
import org.fsmsim.automata.base.Transition;

import java.util.Collection;
import java.util.Set;

/**
 * 有限自动机的只读视图。
 */
public interface Automaton {

    State getInitialState();

    Set<State> getStates();

    Alphabet getAlphabet();

    Collection<Transition> getTransitions();

    /**
     * 从初始状态出发依次读入 input 中的字符。
     *
     * @param input 输入串，不做任何规范化处理。
     * @return 结束时所在状态是否为接受状态。
     */
    boolean run(String input);
}
