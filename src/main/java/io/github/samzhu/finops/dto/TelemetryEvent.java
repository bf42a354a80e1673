package io.github.samzhu.finops.dto;

import java.time.Instant;

/**
 * 正規化後的遙測事件。
 *
 * <p>裝置與門市缺漏時為 {@code unknown}；{@code resourceId} 已轉為標準短名稱。
 *
 * @param timestamp 呼叫時間
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param resourceId 標準化資源名稱
 * @param tokensUsed token 使用量，非負
 * @param statusCode HTTP 狀態碼，無法解析時為 0
 * @param responseTimeMs 回應時間 (毫秒)，非負
 */
public record TelemetryEvent(
    Instant timestamp,
    String deviceId,
    String storeNumber,
    String resourceId,
    long tokensUsed,
    int statusCode,
    double responseTimeMs
) {
    public String deviceStoreKey() {
        return deviceId + "_" + storeNumber;
    }
}
