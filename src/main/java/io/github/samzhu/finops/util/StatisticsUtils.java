package io.github.samzhu.finops.util;

import java.util.Arrays;
import java.util.List;

/**
 * 統計計算工具類。
 *
 * <p>變異數與標準差皆為樣本版本 (分母 n-1)。
 * 無法定義的結果 (樣本不足、變異為零) 以 {@code 0.0} 表示，
 * 讓門檻比較 ({@code r > 0.7} 等) 自然不成立。
 */
public final class StatisticsUtils {

    private StatisticsUtils() {
        // 工具類不允許實例化
    }

    public static double sum(List<? extends Number> values) {
        double total = 0.0;
        for (Number value : values) {
            total += value.doubleValue();
        }
        return total;
    }

    public static double mean(List<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return sum(values) / values.size();
    }

    /**
     * 樣本變異數。
     *
     * @param values 樣本
     * @return 變異數，樣本數少於 2 時為 0
     */
    public static double sampleVariance(List<? extends Number> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double squares = 0.0;
        for (Number value : values) {
            double diff = value.doubleValue() - mean;
            squares += diff * diff;
        }
        return squares / (n - 1);
    }

    public static double sampleStd(List<? extends Number> values) {
        return Math.sqrt(sampleVariance(values));
    }

    /**
     * Pearson 相關係數。
     *
     * <p>兩個序列長度不同時只取共同長度的前綴。
     *
     * @return 相關係數，樣本不足或任一序列無變異時為 0
     */
    public static double pearson(List<? extends Number> xs, List<? extends Number> ys) {
        int n = Math.min(xs.size(), ys.size());
        if (n < 2) {
            return 0.0;
        }
        double meanX = mean(xs.subList(0, n));
        double meanY = mean(ys.subList(0, n));
        double covariance = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = xs.get(i).doubleValue() - meanX;
            double dy = ys.get(i).doubleValue() - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0.0 || varY == 0.0) {
            return 0.0;
        }
        return covariance / Math.sqrt(varX * varY);
    }

    /**
     * 以線性內插計算分位數。
     *
     * <p>位置 {@code q × (n-1)} 落在兩個排序後樣本之間時取兩者的線性內插。
     *
     * @param values 樣本
     * @param q 分位 (0 到 1)
     * @return 分位數，空樣本為 0
     */
    public static double quantile(List<? extends Number> values, double q) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double[] sorted = values.stream().mapToDouble(Number::doubleValue).toArray();
        Arrays.sort(sorted);
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }
}
