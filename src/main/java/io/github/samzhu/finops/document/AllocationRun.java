package io.github.samzhu.finops.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.finops.dto.CorrelationSummary;

/**
 * 單次分攤執行的紀錄。
 *
 * <p>狀態：
 * <ul>
 *   <li>{@code COMPLETED} - 完整寫入分攤結果</li>
 *   <li>{@code SKIPPED} - 來源沒有資料 (例如帳單 API 限流)，下次排程再試</li>
 *   <li>{@code FAILED} - 執行失敗，沒有寫入任何分攤結果</li>
 * </ul>
 *
 * @param id 執行 ID
 * @param status 執行狀態
 * @param trigger 觸發來源：SCHEDULED 或 MANUAL
 * @param allocationMethod 使用的分攤策略
 * @param methodReason 策略選擇原因
 * @param periodStart 資料期間起點
 * @param periodEnd 資料期間終點
 * @param telemetryEvents 遙測筆數
 * @param costEvents 成本筆數
 * @param malformedRecords 異常紀錄數
 * @param correlatedGroups 關聯群組數
 * @param allocatedRecords 分攤紀錄數
 * @param conservationViolations 守恆檢查失敗數
 * @param totalAllocatedCost 分攤成本總額
 * @param summary 摘要統計
 * @param errorMessage 失敗原因
 * @param startedAt 開始時間
 * @param durationMs 執行時間 (毫秒)
 */
@Document(collection = "allocation_runs")
public record AllocationRun(
    @Id String id,
    RunStatus status,
    String trigger,
    String allocationMethod,
    String methodReason,
    Instant periodStart,
    Instant periodEnd,
    int telemetryEvents,
    int costEvents,
    int malformedRecords,
    int correlatedGroups,
    int allocatedRecords,
    int conservationViolations,
    double totalAllocatedCost,
    CorrelationSummary summary,
    String errorMessage,
    Instant startedAt,
    long durationMs
) {
    public enum RunStatus {
        COMPLETED,
        SKIPPED,
        FAILED
    }
}
