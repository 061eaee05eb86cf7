package com.iecore.preprocess;

import com.iecore.document.IeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 预处理阶段结果的校验与存取。
 *
 * 不强制阶段顺序，重复设置同一阶段会覆盖字段与完成时间。
 * 只修改内存中的文档，持久化由调用方另行触发。
 */
public class PreprocessState {
    private static final Logger logger = LoggerFactory.getLogger(PreprocessState.class);

    private final Clock clock;

    public PreprocessState() {
        this(Clock.systemUTC());
    }

    public PreprocessState(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock不能为null");
        }
        this.clock = clock;
    }

    /**
     * 判断阶段是否已完成。
     */
    public boolean wasDone(IeDocument document, PreprocessStage stage) {
        requireStage(stage);
        return document.getPreprocessMetadata().containsKey(stage.stageName());
    }

    /**
     * 校验并写入阶段结果，记录完成时间。
     *
     * @param document 目标文档
     * @param stage 预处理阶段
     * @param result 阶段输出；NERC 阶段不对应字段，结果被忽略
     * @return 被修改的文档，便于链式调用保存
     * @throws InvalidStageException stage 为null
     * @throws ValidationException 结果违反结构约束
     * @throws CardinalityException 标注结果数量与 token 数不一致
     */
    public IeDocument setResult(IeDocument document, PreprocessStage stage, List<?> result) {
        if (document == null) {
            throw new IllegalArgumentException("document不能为null");
        }
        requireStage(stage);
        if (result == null && stage != PreprocessStage.NERC) {
            throw new IllegalArgumentException(stage.stageName() + " 结果不能为null");
        }

        switch (stage) {
            case TOKENIZATION -> document.setTokens(requireStrings(stage, result));
            case SEGMENTATION -> document.setSentences(validateSegmentation(result, document.getTokenCount()));
            case TAGGING -> document.setPostags(validateTagging(result, document.getTokenCount()));
            case NERC -> {
                // 实体出现由 addOccurrence 维护，这里只记录完成时间
            }
        }

        Instant doneAt = clock.instant();
        document.markPreprocessDone(stage.stageName(), doneAt);
        logger.debug("预处理阶段完成: doc={}, stage={}, doneAt={}", document.getHumanIdentifier(), stage.stageName(), doneAt);
        return document;
    }

    /**
     * 读取阶段结果；阶段未完成时返回空，不抛异常。
     */
    public Optional<List<?>> getResult(IeDocument document, PreprocessStage stage) {
        if (!wasDone(document, stage)) {
            return Optional.empty();
        }
        List<?> value = switch (stage) {
            case TOKENIZATION -> document.getTokens();
            case SEGMENTATION -> document.getSentences();
            case TAGGING -> document.getPostags();
            case NERC -> document.getEntities();
        };
        return Optional.of(value);
    }

    /**
     * 读取阶段完成时间。
     */
    public Optional<Instant> doneAt(IeDocument document, PreprocessStage stage) {
        requireStage(stage);
        return Optional.ofNullable(document.getPreprocessMetadata().get(stage.stageName()));
    }

    private static List<Integer> validateSegmentation(List<?> result, int tokenCount) {
        PreprocessStage stage = PreprocessStage.SEGMENTATION;
        List<Integer> boundaries = new ArrayList<>(result.size());
        for (int index = 0; index < result.size(); index++) {
            Object element = result.get(index);
            if (!(element instanceof Integer boundary)) {
                throw new ValidationException(stage, ValidationRule.WRONG_ELEMENT_TYPE,
                    "分句结果只能包含整数，位置=" + index + ", value=" + element);
            }
            boundaries.add(boundary);
        }
        for (int index = 1; index < boundaries.size(); index++) {
            if (boundaries.get(index) < boundaries.get(index - 1)) {
                throw new ValidationException(stage, ValidationRule.NOT_SORTED,
                    "分句结果必须升序，位置=" + index + ", value=" + boundaries.get(index));
            }
        }
        for (int index = 1; index < boundaries.size(); index++) {
            if (boundaries.get(index).equals(boundaries.get(index - 1))) {
                throw new ValidationException(stage, ValidationRule.HAS_DUPLICATES,
                    "分句结果不能包含重复值: " + boundaries.get(index));
            }
        }
        if (boundaries.isEmpty()
            || boundaries.get(0) != 0
            || boundaries.get(boundaries.size() - 1) != tokenCount) {
            throw new ValidationException(stage, ValidationRule.BAD_ENDPOINTS,
                "分句结果必须以0开始并以token数 " + tokenCount + " 结束: " + boundaries);
        }
        return boundaries;
    }

    private static List<String> validateTagging(List<?> result, int tokenCount) {
        if (result.size() != tokenCount) {
            throw new CardinalityException(PreprocessStage.TAGGING, tokenCount, result.size());
        }
        return requireStrings(PreprocessStage.TAGGING, result);
    }

    private static List<String> requireStrings(PreprocessStage stage, List<?> result) {
        List<String> values = new ArrayList<>(result.size());
        for (int index = 0; index < result.size(); index++) {
            Object element = result.get(index);
            if (!(element instanceof String value)) {
                throw new ValidationException(stage, ValidationRule.WRONG_ELEMENT_TYPE,
                    "结果只能包含字符串，位置=" + index + ", value=" + element);
            }
            values.add(value);
        }
        return values;
    }

    private static void requireStage(PreprocessStage stage) {
        if (stage == null) {
            throw new InvalidStageException(null);
        }
    }
}
