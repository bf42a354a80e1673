package io.github.samzhu.finops.dto;

import java.time.Instant;

/**
 * 以時間衰減權重關聯的 (裝置, 門市) 與資源。
 *
 * <p>越接近現在的事件權重越高：{@code weight = exp(-hoursAgo / decayHours)}。
 *
 * @param hour 最近一筆事件的整點，遙測與成本在此對齊
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param resourceId 標準化資源名稱
 * @param weightedTokens 加權 token 數
 * @param weightedApiCalls 加權呼叫數
 * @param telemetryWeight 遙測權重總和
 * @param weightedCost 加權成本
 * @param weightedUsage 加權用量
 * @param costWeight 成本權重總和
 */
public record WeightedCorrelation(
    Instant hour,
    String deviceId,
    String storeNumber,
    String resourceId,
    double weightedTokens,
    double weightedApiCalls,
    double telemetryWeight,
    double weightedCost,
    double weightedUsage,
    double costWeight
) {}
