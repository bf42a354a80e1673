package io.github.samzhu.finops.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 裝置目前用量與學習到的模式相比出現的異常。
 *
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param anomalyType 暴增或驟降
 * @param tokenDeviationRatio token 速率相對偏差
 * @param callDeviationRatio 呼叫速率相對偏差
 * @param severity 嚴重度
 * @param currentTokensPerHour 目前每小時 token 數
 * @param expectedTokensPerHour 預期每小時 token 數
 */
public record AnomalyRecord(
    String deviceId,
    String storeNumber,
    AnomalyType anomalyType,
    double tokenDeviationRatio,
    double callDeviationRatio,
    Severity severity,
    double currentTokensPerHour,
    double expectedTokensPerHour
) {
    public enum AnomalyType {
        SPIKE,
        DROP;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }

    public enum Severity {
        MEDIUM,
        HIGH;

        @JsonValue
        public String value() {
            return name().toLowerCase();
        }
    }
}
