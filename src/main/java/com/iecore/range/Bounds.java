package com.iecore.range;

/**
 * 区间查询结果，半开区间 [start, end)。
 *
 * @param start 第一个键值 >= xl 的下标
 * @param end 第一个键值 >= xr 的下标
 */
public record Bounds(int start, int end) {
    public Bounds {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("边界非法: start=" + start + ", end=" + end);
        }
    }

    /**
     * 返回区间内元素数量。
     */
    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }
}
