package com.iecore.document;

/**
 * 去重后的真实实体，key 全局唯一。
 *
 * @param key 唯一键
 * @param canonicalForm 规范展示形式
 * @param kind 实体类别
 */
public record Entity(String key, String canonicalForm, EntityKind kind) {
    public Entity {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("实体key不能为空");
        }
        if (canonicalForm == null) {
            throw new IllegalArgumentException("canonicalForm不能为null, key=" + key);
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind不能为null, key=" + key);
        }
    }

    @Override
    public String toString() {
        return canonicalForm + " (" + kind.code() + ")";
    }
}
