package org.repair.cfg;

/**
 * CFG 构建过程中所有异常的基类。
 */
public class CfgException extends RuntimeException {

    public CfgException(String message) {
        super(message);
    }

    public CfgException(String message, Throwable cause) {
        super(message, cause);
    }
}
