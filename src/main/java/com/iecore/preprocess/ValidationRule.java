package com.iecore.preprocess;

/**
 * 阶段结果校验失败的具体规则。
 */
public enum ValidationRule {
    /** 元素类型不符合阶段要求 */
    WRONG_ELEMENT_TYPE,
    /** 分句结果未升序 */
    NOT_SORTED,
    /** 分句结果包含重复值 */
    HAS_DUPLICATES,
    /** 分句结果首项不为0或末项不等于 token 数 */
    BAD_ENDPOINTS
}
