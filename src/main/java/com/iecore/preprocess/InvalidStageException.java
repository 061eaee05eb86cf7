package com.iecore.preprocess;

public class InvalidStageException extends IllegalArgumentException {
    private final String stageName;

    public InvalidStageException(String stageName) {
        super("未知预处理阶段: " + stageName);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
