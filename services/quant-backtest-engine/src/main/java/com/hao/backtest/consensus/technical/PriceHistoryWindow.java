package com.hao.backtest.consensus.technical;

/**
 * 收盘价滑动窗口
 *
 * 设计目的：
 * 1. 为技术面推导维护单只股票最近 N 个交易日的收盘价。
 * 2. 使用环形数组实现 O(1) 写入与按天回溯。
 *
 * 核心算法（环形数组）：
 * 假设容量为5，依次写入 [10,20,30,40,50,60]
 * 数组状态: [60,20,30,40,50]，cursor=0
 * getClose(0) → 60（最新），getClose(1) → 50（昨日）
 *
 * 线程安全说明：
 * - 非线程安全，每次推导新建实例，线程封闭使用。
 *
 * @author hli
 * @date 2026-03-05
 */
public class PriceHistoryWindow {

    /**
     * 默认容量：250 个交易日约等于 52 周
     */
    public static final int DEFAULT_CAPACITY = 250;

    private final double[] closes;

    private final int capacity;

    /**
     * 游标-指向最新数据写入位置，-1 表示尚未写入
     */
    private int cursor = -1;

    private int size = 0;

    public PriceHistoryWindow() {
        this(DEFAULT_CAPACITY);
    }

    public PriceHistoryWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.closes = new double[capacity];
    }

    /**
     * 追加最新收盘价，满容量后覆盖最旧数据
     */
    public void append(double close) {
        // 中文：游标循环递增，实现环形写入
        // English: Cursor increments circularly for ring buffer write
        cursor = (cursor + 1) % capacity;
        closes[cursor] = close;
        if (size < capacity) {
            size++;
        }
    }

    /**
     * 获取 N 天前的收盘价，0 为最新；超出已有数据返回 NaN
     */
    public double getClose(int daysAgo) {
        if (daysAgo < 0 || daysAgo >= size) {
            return Double.NaN;
        }
        int index = (cursor - daysAgo + capacity) % capacity;
        return closes[index];
    }

    /**
     * 最近 n 天最高收盘价，数据不足 n 天时按已有数据计算；无数据返回 NaN
     */
    public double highest(int days) {
        int span = Math.min(days, size);
        if (span <= 0) {
            return Double.NaN;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < span; i++) {
            max = Math.max(max, getClose(i));
        }
        return max;
    }

    /**
     * 最近 n 天简单移动平均，数据不足 n 天返回 NaN
     */
    public double movingAverage(int days) {
        if (days <= 0 || days > size) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = 0; i < days; i++) {
            sum += getClose(i);
        }
        return sum / days;
    }

    public int getSize() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }
}
