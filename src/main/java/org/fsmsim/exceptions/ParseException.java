package org.fsmsim.exceptions;

import lombok.Getter;

/**
 * 源文本不符合自动机描述文法时抛出。
 * 记录失败位置（偏移、行、列）以及期望的语法结构。
 */
@Getter
public class ParseException extends FSMException {

    private final int offset;
    private final int line;
    private final int column;
    private final String expected;

    public ParseException(int offset, int line, int column, String expected) {
        super("Parse error at line " + line + ", column " + column + ": expected " + expected);
        this.offset = offset;
        this.line = line;
        this.column = column;
        this.expected = expected;
    }
}
