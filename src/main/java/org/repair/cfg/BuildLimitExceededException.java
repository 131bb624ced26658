package org.repair.cfg;

/**
 * 单次构建产生的 block 数超过 {@link BuildOptions#maxBlocks()}。
 */
public class BuildLimitExceededException extends CfgException {

    public BuildLimitExceededException(int limit) {
        super("block limit exceeded: more than " + limit + " blocks in one build");
    }
}
