package org.fsmsim.exceptions;

import lombok.Getter;
import org.fsmsim.automata.base.Alphabet;

/**
 * 运行时遇到不属于输入字母表的字符，character 为其 Unicode 码点。
 */
@Getter
public class CharNotInInputAlphabetException extends FSMException {

    private final int character;

    public CharNotInInputAlphabetException(int character) {
        super("'" + Alphabet.render(character) + "' not in input alphabet");
        this.character = character;
    }
}
