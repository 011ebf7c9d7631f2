package org.fsmsim.automata.models;

import org.fsmsim.automata.base.State;
import org.fsmsim.exceptions.ExtraTransitionException;
import org.fsmsim.exceptions.MissingTransitionException;
import org.fsmsim.exceptions.NoStartStateException;
import org.fsmsim.exceptions.UnknownStateException;
import org.fsmsim.parser.FSMParser;
import org.fsmsim.parser.ParsedFSM;
import org.fsmsim.parser.ParsedState;
import org.fsmsim.parser.ParsedTransition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DFAValidatorTest {

    private static final String SAMPLE = "states:\n\tA\n\tB\n\tfinal: C\n\n"
            + "transitions:\n\t0: A -> B\n\t0: B -> C\n\t0: C -> A\n\t1: B -> A\n\t1: C -> B\n\t1: A -> C\n\n"
            + "start: A";

    private static DFA validate(String source) {
        return DFAValidator.validate(FSMParser.parse(source));
    }

    @Nested
    @DisplayName("构造 (Construction)")
    class ConstructionTests {

        @Test
        @DisplayName("示例自动机校验通过")
        void testValidate_Sample() {
            DFA dfa = validate(SAMPLE);

            assertAll("Sample DFA",
                    () -> assertEquals("A", dfa.getInitialState().getName()),
                    () -> assertFalse(dfa.getInitialState().isAccepting()),
                    () -> assertEquals(3, dfa.getStates().size()),
                    () -> assertEquals(Set.of((int) '0', (int) '1'), dfa.getAlphabet().getSymbols()),
                    () -> assertEquals(6, dfa.getTransitions().size())
            );
        }

        @Test
        @DisplayName("完全性：每个 (字符, 状态) 恰好一条迁移")
        void testValidate_Totality() {
            DFA dfa = validate(SAMPLE);

            assertEquals(dfa.getStates().size() * dfa.getAlphabet().size(), dfa.getTransitions().size());
            for (State state : dfa.getStates()) {
                for (int symbol : dfa.getAlphabet().getSymbols()) {
                    assertNotNull(dfa.step(state, symbol), "missing " + symbol + " from " + state);
                }
            }
        }

        @Test
        @DisplayName("迁移目标带有声明时的接受标记")
        void testValidate_TargetKeepsAcceptingFlag() {
            DFA dfa = validate(SAMPLE);

            State target = dfa.step(State.of("B"), '0');
            assertEquals("C", target.getName());
            assertTrue(target.isAccepting());
        }

        @Test
        @DisplayName("字母表只包含迁移中出现的字符")
        void testValidate_AlphabetDerivedFromTransitions() {
            DFA dfa = validate("states:\n\tab\ntransitions:\n\tx: ab -> ab\nstart: ab");

            assertEquals(Set.of((int) 'x'), dfa.getAlphabet().getSymbols());
        }

        @Test
        @DisplayName("重复声明的状态合并为第一次声明，起始状态也取第一次声明")
        void testValidate_DuplicateStateCollapses() {
            DFA dfa = validate("states:\n\tA\n\tfinal: A\ntransitions:\n\t0: A -> A\nstart: A");

            assertAll("Duplicate state",
                    () -> assertEquals(1, dfa.getStates().size()),
                    () -> assertFalse(dfa.getInitialState().isAccepting()),
                    () -> assertSame(dfa.getStates().iterator().next(), dfa.getInitialState()),
                    () -> assertFalse(dfa.run("")),
                    () -> assertFalse(dfa.run("0"))
            );
        }

        @Test
        @DisplayName("基本多文种平面之外的字符可以作为符号")
        void testValidate_SupplementaryCodePointSymbol() {
            DFA dfa = validate("states:\n\tA\n\tfinal: B\ntransitions:\n\t😀: A -> B\n\t😀: B -> A\nstart: A");

            assertEquals(Set.of("😀".codePointAt(0)), dfa.getAlphabet().getSymbols());
            assertEquals(2, dfa.getTransitions().size());
        }

        @Test
        @DisplayName("缺少迁移时完整显示符号")
        void testValidate_MissingSupplementaryTransitionMessage() {
            MissingTransitionException e = assertThrows(MissingTransitionException.class,
                    () -> validate("states:\n\tA\n\tB\ntransitions:\n\t😀: A -> B\nstart: A"));

            assertEquals("😀".codePointAt(0), e.getSymbol());
            assertEquals("Missing transition on '😀' from State(B)", e.getMessage());
        }

        @Test
        @DisplayName("源状态未声明的迁移被忽略")
        void testValidate_TransitionFromUndeclaredStateIgnored() {
            DFA dfa = validate("states:\n\tA\ntransitions:\n\t0: A -> A\n\t0: Z -> A\nstart: A");

            assertEquals(1, dfa.getTransitions().size());
        }

        @Test
        @DisplayName("直接从 ParsedFSM 构造")
        void testValidate_FromParsedFSM() {
            ParsedFSM parsed = new ParsedFSM("q",
                    List.of(ParsedState.accepting("q")),
                    List.of(new ParsedTransition('a', "q", "q")));

            DFA dfa = DFAValidator.validate(parsed);
            assertTrue(dfa.run("aaa"));
        }
    }

    @Nested
    @DisplayName("校验错误 (Validation errors)")
    class ErrorTests {

        @Test
        @DisplayName("起始状态未声明")
        void testValidate_NoStartState() {
            NoStartStateException e = assertThrows(NoStartStateException.class,
                    () -> validate("states:\n\tA\ntransitions:\n\t0: A -> A\nstart: Z"));

            assertEquals("No start state set", e.getMessage());
        }

        @Test
        @DisplayName("states 块为空时没有起始状态")
        void testValidate_EmptyStates_NoStartState() {
            assertThrows(NoStartStateException.class,
                    () -> validate("states:\ntransitions:\n\t0: A -> A\nstart: A"));
        }

        @Test
        @DisplayName("迁移目标未声明")
        void testValidate_UnknownTarget() {
            UnknownStateException e = assertThrows(UnknownStateException.class,
                    () -> validate("states:\n\tA\ntransitions:\n\t0: A -> B\nstart: A"));

            assertEquals("B", e.getStateName());
            assertEquals("Unknown state 'B'", e.getMessage());
        }

        @Test
        @DisplayName("缺少迁移")
        void testValidate_MissingTransition() {
            MissingTransitionException e = assertThrows(MissingTransitionException.class,
                    () -> validate("states:\n\tA\n\tB\ntransitions:\n\t0: A -> B\nstart: A"));

            assertAll("Missing transition on '0' from B",
                    () -> assertEquals((int) '0', e.getSymbol()),
                    () -> assertEquals("B", e.getState().getName()),
                    () -> assertEquals("Missing transition on '0' from State(B)", e.getMessage())
            );
        }

        @Test
        @DisplayName("目标相同的重复迁移也视为冲突")
        void testValidate_IdenticalDuplicateTransition() {
            ExtraTransitionException e = assertThrows(ExtraTransitionException.class,
                    () -> validate("states:\n\tA\ntransitions:\n\t0: A -> A\n\t0: A -> A\nstart: A"));

            assertEquals(new ParsedTransition('0', "A", "A"), e.getFirst());
            assertEquals(new ParsedTransition('0', "A", "A"), e.getSecond());
            assertEquals("Transition 0: A -> A and 0: A -> A conflict", e.getMessage());
        }

        @Test
        @DisplayName("不确定迁移报告前两条冲突声明")
        void testValidate_ConflictingTransitions() {
            ExtraTransitionException e = assertThrows(ExtraTransitionException.class,
                    () -> validate("states:\n\tA\n\tB\ntransitions:\n\t0: A -> A\n\t0: B -> B\n\t0: A -> B\n\t0: A -> A\nstart: A"));

            assertEquals(new ParsedTransition('0', "A", "A"), e.getFirst());
            assertEquals(new ParsedTransition('0', "A", "B"), e.getSecond());
        }

        @Test
        @DisplayName("起始状态检查先于迁移检查")
        void testValidate_StartCheckedFirst() {
            assertThrows(NoStartStateException.class,
                    () -> validate("states:\n\tA\n\tB\ntransitions:\n\t0: A -> Z\nstart: Q"));
        }

        @Test
        @DisplayName("按字符升序检查：'0' 上的冲突先于 '1' 上的缺失")
        void testValidate_DeterministicErrorOrder() {
            assertThrows(ExtraTransitionException.class,
                    () -> validate("states:\n\tA\n\tB\ntransitions:\n\t1: A -> A\n\t0: A -> A\n\t0: A -> B\n\t0: B -> A\nstart: A"));
        }

        @Test
        @DisplayName("按状态声明顺序检查")
        void testValidate_StatesInDeclarationOrder() {
            MissingTransitionException e = assertThrows(MissingTransitionException.class,
                    () -> validate("states:\n\tB\n\tA\n\tC\ntransitions:\n\t0: A -> A\nstart: A"));

            assertEquals("B", e.getState().getName());
        }
    }
}
