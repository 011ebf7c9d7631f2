package org.fsmsim.automata.models;

import org.apache.commons.lang3.tuple.Pair;
import org.fsmsim.automata.base.Alphabet;
import org.fsmsim.automata.base.State;
import org.fsmsim.automata.base.Transition;
import org.fsmsim.exceptions.ExtraTransitionException;
import org.fsmsim.exceptions.MissingTransitionException;
import org.fsmsim.exceptions.NoStartStateException;
import org.fsmsim.exceptions.UnknownStateException;
import org.fsmsim.parser.ParsedFSM;
import org.fsmsim.parser.ParsedState;
import org.fsmsim.parser.ParsedTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 将 {@link ParsedFSM} 校验并构造成 {@link DFA}。
 * <p>
 * 检查顺序固定，遇到第一个错误立即失败：
 * <ol>
 *     <li>按声明顺序解析状态；同名状态只保留第一次声明。找不到起始状态时抛出 {@link NoStartStateException}。</li>
 *     <li>字母表取迁移声明中出现过的所有字符。</li>
 *     <li>按码点升序、状态声明顺序遍历 (字符, 状态)：没有迁移抛出 {@link MissingTransitionException}，
 *     多于一条抛出 {@link ExtraTransitionException}，目标状态未声明抛出 {@link UnknownStateException}。</li>
 * </ol>
 * 源状态未声明的迁移不会被遍历到，因此不会报错。
 */
public final class DFAValidator {

    private static final Logger logger = LoggerFactory.getLogger(DFAValidator.class);

    private DFAValidator() {
    }

    /**
     * @param parsed 解析结果。
     * @return 完全且确定的 DFA。
     * @throws org.fsmsim.exceptions.ValidationException 校验失败时抛出，不会产生部分构造的 DFA。
     */
    public static DFA validate(ParsedFSM parsed) {
        Objects.requireNonNull(parsed, "Parsed FSM cannot be null");

        Map<String, State> states = resolveStates(parsed.getStates());
        State initialState = states.get(parsed.getStartState());
        if (initialState == null) {
            logger.debug("起始状态 '{}' 未声明", parsed.getStartState());
            throw new NoStartStateException();
        }

        Alphabet alphabet = deriveAlphabet(parsed.getTransitions());
        Map<Pair<Integer, State>, Transition> transitionFunction =
                resolveTransitions(alphabet, states, parsed.getTransitions());

        DFA dfa = new DFA(initialState, states.values(), alphabet, transitionFunction);
        logger.info("校验通过: {}", dfa);
        return dfa;
    }

    /**
     * 名字到状态的映射，保持声明顺序。
     */
    static Map<String, State> resolveStates(List<ParsedState> declared) {
        Map<String, State> states = new LinkedHashMap<>();
        for (ParsedState declaration : declared) {
            State state = State.of(declaration.getName(), declaration.isAccepting());
            State existing = states.putIfAbsent(state.getName(), state);
            if (existing != null) {
                logger.warn("状态 '{}' 被重复声明，保留第一次声明 {}，忽略 {}", state.getName(), existing, state);
            }
        }
        return states;
    }

    static Alphabet deriveAlphabet(List<ParsedTransition> declared) {
        return Alphabet.of(declared.stream()
                .map(ParsedTransition::getInput)
                .collect(Collectors.toSet()));
    }

    private static Map<Pair<Integer, State>, Transition> resolveTransitions(
            Alphabet alphabet, Map<String, State> states, List<ParsedTransition> declared) {
        Map<Pair<Integer, State>, Transition> transitionFunction = new HashMap<>();
        for (int symbol : alphabet.getSymbols()) {
            for (State source : states.values()) {
                List<ParsedTransition> found = declared.stream()
                        .filter(t -> t.getInput() == symbol && t.getStartState().equals(source.getName()))
                        .limit(2)
                        .collect(Collectors.toList());
                if (found.isEmpty()) {
                    throw new MissingTransitionException(symbol, source);
                }
                if (found.size() > 1) {
                    throw new ExtraTransitionException(found.get(0), found.get(1));
                }
                String targetName = found.get(0).getEndState();
                State target = states.get(targetName);
                if (target == null) {
                    throw new UnknownStateException(targetName);
                }
                Transition transition = new Transition(symbol, source, target);
                transitionFunction.put(transition.key(), transition);
            }
        }
        return transitionFunction;
    }
}
