package io.github.samzhu.finops.dto;

import java.util.List;

/**
 * 正規化後的遙測批次與修正、丟棄的紀錄數。
 *
 * @param events 可用的遙測事件
 * @param malformedCount 數值欄位被修正或缺少時間而丟棄的筆數
 */
public record NormalizedTelemetry(List<TelemetryEvent> events, int malformedCount) {}
