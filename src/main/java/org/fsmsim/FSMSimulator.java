package org.fsmsim;

import org.fsmsim.automata.models.DFA;
import org.fsmsim.automata.models.DFAValidator;
import org.fsmsim.parser.FSMParser;
import org.fsmsim.parser.ParsedFSM;

/**
 * 解析 → 校验 → 运行 的入口。
 * 任一阶段失败都会抛出 {@link org.fsmsim.exceptions.FSMException} 的子类。
 */
public final class FSMSimulator {

    private FSMSimulator() {
    }

    public static DFA load(String source) {
        ParsedFSM parsed = FSMParser.parse(source);
        return DFAValidator.validate(parsed);
    }

    public static boolean simulate(String source, String input) {
        return load(source).run(input);
    }
}
