package com.iecore.range;

/**
 * 搜索下标范围非法，例如 lo 为负数或 hi 超出序列长度。
 */
public class InvalidIndexException extends IllegalArgumentException {
    private final int index;

    public InvalidIndexException(String message, int index) {
        super(message + ", index=" + index);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
