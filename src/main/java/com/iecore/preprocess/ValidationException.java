package com.iecore.preprocess;

/**
 * 阶段结果违反结构约束。
 */
public class ValidationException extends IllegalArgumentException {
    private final PreprocessStage stage;
    private final ValidationRule rule;

    public ValidationException(PreprocessStage stage, ValidationRule rule, String detail) {
        super(stage.stageName() + " 结果校验失败 [" + rule + "]: " + detail);
        this.stage = stage;
        this.rule = rule;
    }

    public PreprocessStage getStage() {
        return stage;
    }

    public ValidationRule getRule() {
        return rule;
    }
}
