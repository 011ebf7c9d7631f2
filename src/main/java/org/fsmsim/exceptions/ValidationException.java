package org.fsmsim.exceptions;

/**
 * 解析结果在语义上不构成一个完全、确定的 DFA 时抛出。
 */
public abstract class ValidationException extends FSMException {

    protected ValidationException(String message) {
        super(message);
    }
}
