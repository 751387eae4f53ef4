package org.air.lowering;

/**
 * 控制嵌套 block 内累积的假设在离开 block 后是否仍然可用。
 */
public enum AssumptionScoping {

    /**
     * block 只是顺序组合：块内的 assume 和通过的 assert 在块后继续作为事实。
     * 与最弱前置条件的计算一致。
     */
    SEQUENTIAL,

    /**
     * 块内累积的假设在离开 block 时丢弃，块后的语句只看到进入块之前的假设。
     */
    LEXICAL
}
