package io.github.samzhu.finops.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 遙測事件的傳輸格式 (CloudEvent data)。
 *
 * <p>由 API Gateway 對每次 AI 服務呼叫發出。數值欄位以文字保留原始內容，
 * 因為上游可能送出空字串或非數字，解析與預設值交由
 * {@link io.github.samzhu.finops.service.TelemetryWindowingService#normalize} 處理。
 *
 * <p>JSON 範例：
 * <pre>
 * {
 *   "requestId": "4b1c...",
 *   "timeGenerated": "2025-01-15T10:23:45Z",
 *   "deviceId": "POS-0042",
 *   "storeNumber": "1138",
 *   "resourceId": "https://store-ai.openai.azure.com/openai/deployments/gpt-4o",
 *   "apiName": "chat-completions",
 *   "tokensUsed": "1250",
 *   "statusCode": "200",
 *   "responseTime": "842.5"
 * }
 * </pre>
 *
 * @param requestId 請求 ID，與 {@code timeGenerated} 一起用於去重
 * @param timeGenerated 呼叫發生時間，缺漏時無法分配時間窗口
 * @param deviceId 呼叫端裝置 ID
 * @param storeNumber 門市編號
 * @param resourceId 後端資源 (URL 或資源路徑)
 * @param apiName API 名稱
 * @param tokensUsed token 使用量
 * @param statusCode HTTP 狀態碼
 * @param responseTime 回應時間 (毫秒)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelemetryEventData(
    String requestId,
    Instant timeGenerated,
    String deviceId,
    String storeNumber,
    String resourceId,
    String apiName,
    String tokensUsed,
    String statusCode,
    String responseTime
) {
    /**
     * 以 CloudEvent 屬性補齊 payload 未提供的欄位。
     *
     * @param eventId CloudEvent id
     * @param eventTime CloudEvent time
     * @param subject CloudEvent subject，視為裝置 ID
     * @return 補齊後的事件，原本已有值的欄位不變
     */
    public TelemetryEventData withDefaults(String eventId, Instant eventTime, String subject) {
        return new TelemetryEventData(
            requestId != null ? requestId : eventId,
            timeGenerated != null ? timeGenerated : eventTime,
            deviceId != null ? deviceId : subject,
            storeNumber,
            resourceId,
            apiName,
            tokensUsed,
            statusCode,
            responseTime
        );
    }
}
