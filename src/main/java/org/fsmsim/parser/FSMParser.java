package org.fsmsim.parser;

import org.fsmsim.exceptions.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 自动机描述文本的递归下降解析器。
 * <p>
 * 文法（三个块可以任意顺序出现，块内结构固定）：
 * <pre>
 * line    := ('\r' | '\n' | '\0')*
 * blank   := (' ' | '\t')*
 * name    := [^ \t\r\n:]+
 *
 * states:       line "states:" line ('\t' "final:" blank name line | '\t' name line)*
 * transitions:  line "transitions:" line (blank symbol ':' blank name blank "->" blank name line)+
 * start:        line "start:" blank name
 * </pre>
 * 解析器只做语法检查：重复状态、悬空引用、不确定性和不完全性都留给校验器。
 * 每个实例只解析一次，通过 {@link #parse(String)} 使用。
 */
public final class FSMParser {

    private static final Logger logger = LoggerFactory.getLogger(FSMParser.class);

    private static final String LINE_CHARS = "\r\n\0";
    private static final String BLANK_CHARS = " \t";
    private static final String NAME_EXCLUDED = " \t\r\n:";

    private final String source;
    private int pos;

    // 走得最远的失败位置及在该位置期望的语法结构，用于生成错误信息
    private int furthestOffset = -1;
    private final Set<String> furthestExpected = new LinkedHashSet<>();

    private FSMParser(String source) {
        this.source = source;
    }

    /**
     * 将源文本解析为 {@link ParsedFSM}。
     *
     * @param source 完整的自动机描述文本。
     * @return 解析结果，保持声明顺序。
     * @throws ParseException 文本不符合文法时抛出，不会返回部分结果。
     */
    public static ParsedFSM parse(String source) {
        Objects.requireNonNull(source, "Source text cannot be null");
        ParsedFSM parsed = new FSMParser(source).definition();
        logger.debug("解析完成: {}", parsed);
        return parsed;
    }

    /**
     * 依次尝试尚未解析的块，直到三个块都成功，或一整轮没有任何进展。
     */
    private ParsedFSM definition() {
        String startState = null;
        List<ParsedState> states = null;
        List<ParsedTransition> transitions = null;

        while (startState == null || states == null || transitions == null) {
            boolean progressed = false;
            if (startState == null) {
                startState = startBlock();
                progressed |= startState != null;
            }
            if (states == null) {
                states = statesBlock();
                progressed |= states != null;
            }
            if (transitions == null) {
                transitions = transitionsBlock();
                progressed |= transitions != null;
            }
            if (!progressed) {
                throw failure();
            }
        }

        skipWhile(BLANK_CHARS + LINE_CHARS);
        if (!atEnd()) {
            expect("end of input");
            throw failure();
        }
        return new ParsedFSM(startState, states, transitions);
    }

    private String startBlock() {
        int mark = pos;
        skipWhile(LINE_CHARS);
        if (!literal("start:")) {
            pos = mark;
            return null;
        }
        skipWhile(BLANK_CHARS);
        String name = name();
        if (name == null) {
            pos = mark;
        }
        return name;
    }

    private List<ParsedState> statesBlock() {
        int mark = pos;
        skipWhile(LINE_CHARS);
        if (!literal("states:")) {
            pos = mark;
            return null;
        }
        skipWhile(LINE_CHARS);
        List<ParsedState> states = new ArrayList<>();
        ParsedState state;
        while ((state = stateLine()) != null) {
            states.add(state);
        }
        return states;
    }

    private ParsedState stateLine() {
        int mark = pos;
        if (!literal("\t")) {
            return null;
        }
        boolean accepting = literal("final:");
        if (accepting) {
            skipWhile(BLANK_CHARS);
        }
        String name = name();
        if (name == null) {
            pos = mark;
            return null;
        }
        skipWhile(LINE_CHARS);
        return accepting ? ParsedState.accepting(name) : ParsedState.plain(name);
    }

    private List<ParsedTransition> transitionsBlock() {
        int mark = pos;
        skipWhile(LINE_CHARS);
        if (!literal("transitions:")) {
            pos = mark;
            return null;
        }
        skipWhile(LINE_CHARS);
        ParsedTransition transition = transitionLine();
        if (transition == null) {
            // 至少需要一条迁移
            pos = mark;
            return null;
        }
        List<ParsedTransition> transitions = new ArrayList<>();
        do {
            transitions.add(transition);
        } while ((transition = transitionLine()) != null);
        return transitions;
    }

    private ParsedTransition transitionLine() {
        int mark = pos;
        skipWhile(BLANK_CHARS);
        if (atEnd() || NAME_EXCLUDED.indexOf(peek()) >= 0) {
            expect("input symbol");
            pos = mark;
            return null;
        }
        int symbol = source.codePointAt(pos);
        pos += Character.charCount(symbol);
        if (!literal(":")) {
            pos = mark;
            return null;
        }
        skipWhile(BLANK_CHARS);
        String startState = name();
        if (startState == null) {
            pos = mark;
            return null;
        }
        skipWhile(BLANK_CHARS);
        if (!literal("->")) {
            pos = mark;
            return null;
        }
        skipWhile(BLANK_CHARS);
        String endState = name();
        if (endState == null) {
            pos = mark;
            return null;
        }
        skipWhile(LINE_CHARS);
        return new ParsedTransition(symbol, startState, endState);
    }

    /**
     * 读取一个最长的状态名，不能为空。失败时不移动位置。
     */
    private String name() {
        int begin = pos;
        while (!atEnd() && NAME_EXCLUDED.indexOf(peek()) < 0) {
            pos++;
        }
        if (pos == begin) {
            expect("state name");
            return null;
        }
        return source.substring(begin, pos);
    }

    private boolean literal(String text) {
        if (source.startsWith(text, pos)) {
            pos += text.length();
            return true;
        }
        expect("'" + text.replace("\t", "\\t") + "'");
        return false;
    }

    private void skipWhile(String chars) {
        while (!atEnd() && chars.indexOf(peek()) >= 0) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private void expect(String construct) {
        if (pos > furthestOffset) {
            furthestOffset = pos;
            furthestExpected.clear();
        }
        if (pos == furthestOffset) {
            furthestExpected.add(construct);
        }
    }

    private ParseException failure() {
        int offset = Math.max(furthestOffset, 0);
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < offset; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        String expected = String.join(" or ", furthestExpected);
        logger.debug("解析失败: offset={}, expected={}", offset, expected);
        return new ParseException(offset, line, source.codePointCount(lineStart, offset) + 1, expected);
    }
}
