package io.github.samzhu.finops.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 門市內裝置之間的成本外溢關係。
 *
 * @param storeNumber 門市編號
 * @param deviceCount 門市裝置數
 * @param totalStoreCost 門市分攤成本總額
 * @param avgDeviceCost 每台裝置平均成本
 * @param correlations 相關係數超過門檻的裝置配對
 */
public record StoreSpillover(
    String storeNumber,
    int deviceCount,
    double totalStoreCost,
    double avgDeviceCost,
    List<DevicePair> correlations
) {
    /**
     * 一對裝置的成本序列相關性。
     *
     * @param deviceA 裝置 A
     * @param deviceB 裝置 B
     * @param correlation Pearson 相關係數
     * @param direction 正相關或負相關
     */
    public record DevicePair(
        String deviceA,
        String deviceB,
        double correlation,
        Direction direction
    ) {}

    public enum Direction {
        POSITIVE,
        NEGATIVE;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }
}
