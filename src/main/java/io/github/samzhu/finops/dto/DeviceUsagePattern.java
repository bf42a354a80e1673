package io.github.samzhu.finops.dto;

import java.util.List;

/**
 * 裝置在回溯期間內的用量模式，每次分析請求重新計算。
 *
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param avgTokensPerHour 每個有資料的小時平均 token 數
 * @param avgApiCallsPerHour 每個有資料的小時平均呼叫數
 * @param peakHours 尖峰時段 (0-23)，hourly token 總量達 80 百分位以上
 * @param usageConsistencyScore 用量穩定度 [0, 1]
 * @param costEfficiencyScore 每次呼叫 token 數的效率分數 [0, 1]
 * @param totalTokens 回溯期間 token 總數
 * @param totalApiCalls 回溯期間呼叫總數
 * @param activeHours 有資料的小時數
 */
public record DeviceUsagePattern(
    String deviceId,
    String storeNumber,
    double avgTokensPerHour,
    double avgApiCallsPerHour,
    List<Integer> peakHours,
    double usageConsistencyScore,
    double costEfficiencyScore,
    long totalTokens,
    long totalApiCalls,
    long activeHours
) {
    public String deviceStoreKey() {
        return deviceId + "_" + storeNumber;
    }
}
