package io.github.samzhu.finops.dto.api;

import java.time.LocalDate;
import java.util.List;

import io.github.samzhu.finops.document.AllocatedCost;

/**
 * 單一處理日期分區的分攤結果。
 *
 * @param date 處理日期
 * @param partitionPath 分區路徑，例如 {@code 2025/01/15}
 * @param recordCount 紀錄數
 * @param totalAllocatedCost 分攤成本總額
 * @param records 分攤結果
 */
public record AllocationListResponse(
    LocalDate date,
    String partitionPath,
    int recordCount,
    double totalAllocatedCost,
    List<AllocatedCost> records
) {
    public static AllocationListResponse of(LocalDate date, String partitionPath, List<AllocatedCost> records) {
        return new AllocationListResponse(
            date,
            partitionPath,
            records.size(),
            records.stream().mapToDouble(AllocatedCost::allocatedCost).sum(),
            records
        );
    }
}
