package com.iecore.document;

import com.iecore.range.RangeIndexer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 信息抽取文档。
 *
 * tokens、offsets、postags 每个 token 一项；sentences 为句首 token 偏移；
 * entities 按 offset 升序排列。各字段随预处理阶段逐步填充，
 * 非线程安全，同一时刻只应由一个调用方持有。
 */
public class IeDocument {
    private final String humanIdentifier;
    private final Instant creationDate;
    private String title;
    private String url;
    private String text;

    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Instant> preprocessMetadata = new LinkedHashMap<>();

    private List<String> tokens = List.of();
    private List<Integer> offsets = List.of();
    private List<String> postags = List.of();
    private List<Integer> sentences = List.of();
    private final List<EntityOccurrence> entities = new ArrayList<>();

    public IeDocument(String humanIdentifier, String text) {
        this(humanIdentifier, text, Instant.now());
    }

    public IeDocument(String humanIdentifier, String text, Instant creationDate) {
        if (humanIdentifier == null || humanIdentifier.isBlank()) {
            throw new IllegalArgumentException("humanIdentifier不能为空");
        }
        this.humanIdentifier = humanIdentifier;
        this.text = text;
        this.creationDate = Objects.requireNonNull(creationDate, "creationDate不能为null");
    }

    public String getHumanIdentifier() {
        return humanIdentifier;
    }

    public Instant getCreationDate() {
        return creationDate;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("metadata key不能为null");
        }
        metadata.put(key, value);
    }

    /**
     * 阶段名到完成时间的映射。
     */
    public Map<String, Instant> getPreprocessMetadata() {
        return Collections.unmodifiableMap(preprocessMetadata);
    }

    /**
     * 记录阶段完成时间，重复调用覆盖旧值。
     */
    public void markPreprocessDone(String stageName, Instant doneAt) {
        if (stageName == null || doneAt == null) {
            throw new IllegalArgumentException("stageName与doneAt不能为null");
        }
        preprocessMetadata.put(stageName, doneAt);
    }

    public List<String> getTokens() {
        return tokens;
    }

    public void setTokens(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public int getTokenCount() {
        return tokens.size();
    }

    public List<Integer> getOffsets() {
        return offsets;
    }

    public void setOffsets(List<Integer> offsets) {
        for (int index = 0; index < offsets.size(); index++) {
            Integer offset = offsets.get(index);
            if (offset == null || offset < 0) {
                throw new IllegalArgumentException("字符偏移非法，位置=" + index + ", value=" + offset);
            }
        }
        this.offsets = List.copyOf(offsets);
    }

    public List<String> getPostags() {
        return postags;
    }

    public void setPostags(List<String> postags) {
        this.postags = List.copyOf(postags);
    }

    public List<Integer> getSentences() {
        return sentences;
    }

    public void setSentences(List<Integer> sentences) {
        this.sentences = List.copyOf(sentences);
    }

    public List<EntityOccurrence> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    /**
     * 整体替换实体出现列表。
     *
     * @throws IllegalArgumentException 列表未按 offset 升序排列
     */
    public void setEntities(List<EntityOccurrence> occurrences) {
        for (int index = 1; index < occurrences.size(); index++) {
            if (occurrences.get(index).offset() < occurrences.get(index - 1).offset()) {
                throw new IllegalArgumentException("实体出现必须按offset升序，位置=" + index
                    + ", offset=" + occurrences.get(index).offset());
            }
        }
        entities.clear();
        entities.addAll(occurrences);
    }

    /**
     * 插入一次实体出现并保持有序，相同 offset 的出现保持插入顺序。
     */
    public void addOccurrence(EntityOccurrence occurrence) {
        Objects.requireNonNull(occurrence, "occurrence不能为null");
        int insertAt = RangeIndexer.lowerBound(
            entities, (long) occurrence.offset() + 1, 0, entities.size(), EntityOccurrence::offset);
        entities.add(insertAt, occurrence);
    }

    @Override
    public String toString() {
        return "IeDocument{" + humanIdentifier + ", tokens=" + tokens.size() + ", entities=" + entities.size() + "}";
    }
}
