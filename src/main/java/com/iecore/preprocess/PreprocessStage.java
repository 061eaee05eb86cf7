package com.iecore.preprocess;

import java.util.Locale;

/**
 * 预处理阶段。阶段名为常量名的小写形式，用作完成记录的 key。
 */
public enum PreprocessStage {
    TOKENIZATION,
    SEGMENTATION,
    TAGGING,
    NERC;

    public String stageName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 按阶段名解析，大小写不敏感。
     *
     * @throws InvalidStageException 阶段名未知时抛出
     */
    public static PreprocessStage fromName(String stageName) {
        if (stageName != null) {
            String normalized = stageName.trim().toLowerCase(Locale.ROOT);
            for (PreprocessStage stage : values()) {
                if (stage.stageName().equals(normalized)) {
                    return stage;
                }
            }
        }
        throw new InvalidStageException(stageName);
    }
}
