package com.iecore.range;

import java.util.List;
import java.util.Objects;
import java.util.function.IntToLongFunction;
import java.util.function.ToLongFunction;

/**
 * 有序序列上的半开区间定位器。
 *
 * 给定按键值升序排列的序列与查询区间 [xl, xr)，返回 (l, r) 满足：
 * <pre>
 *   sequence[lo:l]  的键值均 &lt; xl
 *   sequence[l:r]   的键值均落在 [xl, xr)
 *   sequence[r:hi]  的键值均 &gt;= xr
 * </pre>
 * 调用方负责保证 sequence[lo:hi] 已按键值排序，这里不做校验。
 */
public final class RangeIndexer {

    private RangeIndexer() {
        // 工具类，禁止实例化
    }

    /**
     * 在整个列表上定位区间 [xl, xr)。
     *
     * @param sequence 按键值升序排列的列表
     * @param xl 区间左端点（含）
     * @param xr 区间右端点（不含）
     * @param key 键值提取函数
     * @return 区间边界
     */
    public static <T> Bounds findBounds(List<? extends T> sequence, long xl, long xr, ToLongFunction<? super T> key) {
        Objects.requireNonNull(sequence, "sequence不能为null");
        return findBounds(sequence, xl, xr, 0, sequence.size(), key);
    }

    /**
     * 在 sequence[lo:hi] 上定位区间 [xl, xr)。
     *
     * @throws InvalidIndexException lo 为负数，或 hi 不在 [lo, size] 内
     * @throws InvalidRangeException xl &gt; xr
     */
    public static <T> Bounds findBounds(List<? extends T> sequence, long xl, long xr, int lo, int hi,
                                        ToLongFunction<? super T> key) {
        Objects.requireNonNull(sequence, "sequence不能为null");
        Objects.requireNonNull(key, "key不能为null");
        return locate(sequence.size(), index -> key.applyAsLong(sequence.get(index)), xl, xr, lo, hi);
    }

    /**
     * 整数列表按自身取值定位。
     */
    public static Bounds findBounds(List<Integer> sequence, long xl, long xr) {
        return findBounds(sequence, xl, xr, Integer::longValue);
    }

    /**
     * 升序 int 数组按自身取值定位。
     */
    public static Bounds findBounds(int[] sorted, long xl, long xr) {
        Objects.requireNonNull(sorted, "sorted不能为null");
        return locate(sorted.length, index -> sorted[index], xl, xr, 0, sorted.length);
    }

    /**
     * 返回 sequence[lo:hi] 中第一个键值 &gt;= x 的下标，不存在时返回 hi。
     */
    public static <T> int lowerBound(List<? extends T> sequence, long x, int lo, int hi, ToLongFunction<? super T> key) {
        Objects.requireNonNull(sequence, "sequence不能为null");
        Objects.requireNonNull(key, "key不能为null");
        checkIndexes(sequence.size(), lo, hi);
        return lowerBound(index -> key.applyAsLong(sequence.get(index)), x, lo, hi);
    }

    private static Bounds locate(int size, IntToLongFunction keyAt, long xl, long xr, int lo, int hi) {
        if (lo < 0) {
            throw new InvalidIndexException("lo不能为负数", lo);
        }
        if (xl > xr) {
            throw new InvalidRangeException("查询区间要求 xl <= xr", xl, xr);
        }
        checkIndexes(size, lo, hi);
        if (lo == hi) {
            return new Bounds(lo, hi);
        }

        // 先同时收缩左右端点，直到中点落入 [xl, xr)
        int split = -1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            long value = keyAt.applyAsLong(mid);
            if (value >= xr) {
                hi = mid;
            } else if (value < xl) {
                lo = mid + 1;
            } else {
                split = mid;
                break;
            }
        }
        if (split < 0) {
            // 区间内没有元素，lo 即为分界点
            return new Bounds(lo, lo);
        }

        int left = lowerBound(keyAt, xl, lo, split);
        int right = lowerBound(keyAt, xr, split + 1, hi);
        return new Bounds(left, right);
    }

    private static int lowerBound(IntToLongFunction keyAt, long x, int lo, int hi) {
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (keyAt.applyAsLong(mid) < x) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static void checkIndexes(int size, int lo, int hi) {
        if (lo < 0) {
            throw new InvalidIndexException("lo不能为负数", lo);
        }
        if (hi > size) {
            throw new InvalidIndexException("hi超出序列长度 " + size, hi);
        }
        if (hi < lo) {
            throw new InvalidIndexException("hi不能小于lo=" + lo, hi);
        }
    }
}
