package com.iecore.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * 导入文件的 JSON 结构。除 humanIdentifier 外字段均可缺省，缺省的阶段不会被标记为完成。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentImport(
        String humanIdentifier,
        String title,
        String url,
        String text,
        Map<String, Object> metadata,
        List<String> tokens,
        List<Integer> offsets,
        List<Integer> sentences,
        List<String> postags,
        List<Mention> entities
) {

    /**
     * 一次实体出现，同时携带实体本身的信息。
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Mention(
            String key,
            String canonicalForm,
            String kind,
            int offset,
            String alias
    ) {
    }
}
