package io.github.samzhu.finops.collector;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.CostEvent;

/**
 * 一次執行要寫入 sink 的資料。
 *
 * @param runId 執行 ID
 * @param partitionDate 處理日期分區
 * @param periodStart 資料期間起點
 * @param periodEnd 資料期間終點
 * @param records 分攤結果
 * @param rawCosts 原始成本紀錄 (稽核)
 */
public record AllocationBatch(
    String runId,
    LocalDate partitionDate,
    Instant periodStart,
    Instant periodEnd,
    List<AllocatedRecord> records,
    List<CostEvent> rawCosts
) {}
