package io.github.samzhu.finops.dto;

/**
 * 單一 (窗口, 資源, 裝置, 門市) 的遙測彙總，每次執行重新計算，不獨立保存。
 *
 * @param window 時間窗口
 * @param resourceId 標準化資源名稱
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param totalTokens token 總數
 * @param apiCallCount API 呼叫次數
 * @param avgResponseTimeMs 平均回應時間 (毫秒)
 */
public record TelemetryAggregate(
    TimeWindow window,
    String resourceId,
    String deviceId,
    String storeNumber,
    long totalTokens,
    long apiCallCount,
    double avgResponseTimeMs
) {}
