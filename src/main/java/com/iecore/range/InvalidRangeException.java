package com.iecore.range;

/**
 * 查询区间非法：左端点大于右端点，或 token 区间越界。
 */
public class InvalidRangeException extends IllegalArgumentException {
    private final long lower;
    private final long upper;

    public InvalidRangeException(String message, long lower, long upper) {
        super(message + ": [" + lower + ", " + upper + ")");
        this.lower = lower;
        this.upper = upper;
    }

    public long getLower() {
        return lower;
    }

    public long getUpper() {
        return upper;
    }
}
