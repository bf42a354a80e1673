package io.github.samzhu.finops.dto;

import java.util.List;

/**
 * 一次完整管線執行的結果。
 *
 * @param records 分攤結果
 * @param method 使用的分攤策略
 * @param telemetryEvents 輸入遙測筆數
 * @param costEvents 輸入成本筆數
 * @param malformedRecords 被修正或丟棄的異常紀錄數
 * @param correlatedGroups 成功關聯的 (窗口, 資源) 群組數
 * @param conservationViolations 守恆檢查失敗的群組數
 */
public record AllocationResult(
    List<AllocatedRecord> records,
    AllocationMethod method,
    int telemetryEvents,
    int costEvents,
    int malformedRecords,
    int correlatedGroups,
    int conservationViolations
) {
    public static AllocationResult empty(AllocationMethod method, int telemetryEvents, int costEvents, int malformed) {
        return new AllocationResult(List.of(), method, telemetryEvents, costEvents, malformed, 0, 0);
    }

    public double totalAllocatedCost() {
        return records.stream().mapToDouble(AllocatedRecord::allocatedCost).sum();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
