package com.iecore.chunk;

import com.iecore.document.EntityKind;

/**
 * 分块内的实体投影，offset 相对分块起点。
 */
public record EntityInChunk(
        String key,
        String canonicalForm,
        EntityKind kind,
        int offset,
        String alias
) {
}
