package com.iecore.document;

import java.util.Locale;

/**
 * 实体类别，取值固定。
 */
public enum EntityKind {
    PERSON("person", "Person"),
    LOCATION("location", "Location"),
    ORGANIZATION("organization", "Organization");

    private final String code;
    private final String label;

    EntityKind(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /**
     * 按代码解析实体类别，大小写不敏感。
     *
     * @throws IllegalArgumentException 代码未知时抛出
     */
    public static EntityKind fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("实体类别不能为null");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (EntityKind kind : values()) {
            if (kind.code.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知实体类别: " + code);
    }
}
