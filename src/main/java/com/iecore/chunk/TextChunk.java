package com.iecore.chunk;

import java.util.List;

/**
 * 文档在 token 区间 [offset, offset + tokens.size()) 上的只读投影。
 *
 * @param documentId 所属文档的 humanIdentifier
 * @param text 分块的可读文本
 * @param offset 分块起点在文档中的 token 偏移
 * @param tokens token 子序列
 * @param postags 与 tokens 对应的词性标注，文档未标注时为空
 * @param entities 落在区间内的实体，偏移已换算为分块内偏移
 */
public record TextChunk(
        String documentId,
        String text,
        int offset,
        List<String> tokens,
        List<String> postags,
        List<EntityInChunk> entities
) {
    public TextChunk {
        if (offset < 0) {
            throw new IllegalArgumentException("offset不能为负数: " + offset);
        }
        tokens = List.copyOf(tokens);
        postags = List.copyOf(postags);
        entities = List.copyOf(entities);
    }

    /**
     * 分块在文档中的结束 token 偏移（不含）。
     */
    public int offsetEnd() {
        return offset + tokens.size();
    }
}
