package org.repair.cfg;

/**
 * 语句树前端：把源码解析为已注册的过程集合。
 */
public interface StatementTreeProvider {

    /**
     * 解析源码并确定目标过程。
     *
     * @param source          源码文本
     * @param targetName      目标过程名，null 表示取第一个声明的过程
     * @param targetContainer 目标类名，null 表示不限定
     * @return 已设置 target 的注册表
     * @throws ProcedureNotFoundException 指定的过程/类不存在，或源码中没有任何过程
     * @throws SourceParseException       源码整体无法解析
     */
    ProcedureRegistry load(String source, String targetName, String targetContainer);
}
