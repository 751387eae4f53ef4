package org.air.symbolic;

/**
 * check-valid 如何把带标签的蕴含式交给求解器。
 */
public enum CheckStrategy {

    /**
     * 所有蕴含式合成一次查询。较快；在反例模型中为假的蕴含式都会被报告。
     */
    COMBINED,

    /**
     * 每个标签单独一次查询。较慢，但每个断言都得到独立的诊断。
     */
    PER_LABEL
}
