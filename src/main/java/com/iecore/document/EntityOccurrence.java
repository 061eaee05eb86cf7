package com.iecore.document;

/**
 * 实体在文档中的一次出现，offset 为相对文档的 token 偏移。
 *
 * @param entityKey 所引用实体的 key
 * @param offset token 偏移
 * @param alias 出现处的原文，与规范形式相同时可为null
 */
public record EntityOccurrence(String entityKey, int offset, String alias) {
    public EntityOccurrence {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("entityKey不能为空");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset不能为负数: " + offset);
        }
    }

    public static EntityOccurrence of(String entityKey, int offset) {
        return new EntityOccurrence(entityKey, offset, null);
    }
}
