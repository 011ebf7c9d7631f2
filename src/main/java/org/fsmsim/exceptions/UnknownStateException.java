package org.fsmsim.exceptions;

import lombok.Getter;

/**
 * 迁移的目标状态名没有对应的状态声明。
 */
@Getter
public class UnknownStateException extends ValidationException {

    private final String stateName;

    public UnknownStateException(String stateName) {
        super("Unknown state '" + stateName + "'");
        this.stateName = stateName;
    }
}
