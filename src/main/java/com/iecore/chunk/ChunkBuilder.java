package com.iecore.chunk;

import com.iecore.document.Entity;
import com.iecore.document.EntityLookup;
import com.iecore.document.EntityOccurrence;
import com.iecore.document.IeDocument;
import com.iecore.range.Bounds;
import com.iecore.range.InvalidRangeException;
import com.iecore.range.RangeIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 按 token 区间构造分块，并把区间内的实体出现换算为分块内偏移。
 */
public class ChunkBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ChunkBuilder.class);

    private final EntityLookup entityLookup;

    public ChunkBuilder(EntityLookup entityLookup) {
        if (entityLookup == null) {
            throw new IllegalArgumentException("entityLookup不能为null");
        }
        this.entityLookup = entityLookup;
    }

    /**
     * 使用 token 区间 [tokenOffset, tokenOffsetEnd) 构造分块。
     *
     * text 由调用方提供，不与 token 区间做一致性校验。
     *
     * @throws InvalidRangeException 区间越界或起点大于终点
     * @throws IllegalStateException 实体出现引用的 key 无法解析
     */
    public TextChunk build(IeDocument document, int tokenOffset, int tokenOffsetEnd, String text) {
        if (document == null) {
            throw new IllegalArgumentException("document不能为null");
        }
        if (text == null) {
            throw new IllegalArgumentException("text不能为null");
        }
        List<String> tokens = document.getTokens();
        if (tokenOffset < 0 || tokenOffset > tokenOffsetEnd || tokenOffsetEnd > tokens.size()) {
            throw new InvalidRangeException("token区间越界, tokenCount=" + tokens.size(), tokenOffset, tokenOffsetEnd);
        }

        List<String> postags = document.getPostags();
        List<String> chunkPostags;
        if (postags.size() == tokens.size()) {
            chunkPostags = postags.subList(tokenOffset, tokenOffsetEnd);
        } else {
            if (!postags.isEmpty()) {
                logger.warn("词性标注与token数不一致，分块不带标注: doc={}, tokens={}, postags={}",
                    document.getHumanIdentifier(), tokens.size(), postags.size());
            }
            chunkPostags = List.of();
        }

        List<EntityOccurrence> occurrences = document.getEntities();
        Bounds bounds = RangeIndexer.findBounds(occurrences, tokenOffset, tokenOffsetEnd, EntityOccurrence::offset);
        List<EntityInChunk> entities = new ArrayList<>(bounds.size());
        for (EntityOccurrence occurrence : occurrences.subList(bounds.start(), bounds.end())) {
            Entity entity = entityLookup.findByKey(occurrence.entityKey())
                .orElseThrow(() -> new IllegalStateException("实体不存在: key=" + occurrence.entityKey()
                    + ", doc=" + document.getHumanIdentifier()));
            entities.add(new EntityInChunk(
                entity.key(),
                entity.canonicalForm(),
                entity.kind(),
                occurrence.offset() - tokenOffset,
                occurrence.alias()
            ));
        }

        logger.debug("构造分块: doc={}, range=[{}, {}), entities={}",
            document.getHumanIdentifier(), tokenOffset, tokenOffsetEnd, entities.size());
        return new TextChunk(
            document.getHumanIdentifier(),
            text,
            tokenOffset,
            tokens.subList(tokenOffset, tokenOffsetEnd),
            chunkPostags,
            entities
        );
    }
}
