package org.repair.cfg;

/**
 * 指定的目标过程或类不存在，或源码中没有任何过程定义。
 */
public class ProcedureNotFoundException extends CfgException {

    public ProcedureNotFoundException(String message) {
        super(message);
    }
}
