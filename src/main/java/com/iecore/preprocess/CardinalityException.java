package com.iecore.preprocess;

/**
 * 阶段结果长度与 token 数不一致。
 */
public class CardinalityException extends IllegalArgumentException {
    private final int expected;
    private final int actual;

    public CardinalityException(PreprocessStage stage, int expected, int actual) {
        super(stage.stageName() + " 结果数量必须与token数一致: expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
