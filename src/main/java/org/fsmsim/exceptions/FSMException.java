package org.fsmsim.exceptions;

/**
 * 解析、校验与执行自动机时抛出的所有异常的公共父类。
 * 所有异常均为非受检异常，调用方决定是否捕获。
 */
public abstract class FSMException extends RuntimeException {

    protected FSMException(String message) {
        super(message);
    }
}
