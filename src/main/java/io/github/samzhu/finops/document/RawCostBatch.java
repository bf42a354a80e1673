package io.github.samzhu.finops.document;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.finops.dto.CostEvent;

/**
 * 每次執行從帳單來源取得的成本紀錄 (稽核用)。
 *
 * @param id MongoDB ObjectId
 * @param runId 所屬執行 ID
 * @param costs 成本紀錄
 * @param recordCount 紀錄數
 * @param periodStart 查詢起點
 * @param periodEnd 查詢終點
 * @param createdAt 建立時間
 */
@Document(collection = "raw_cost_batches")
public record RawCostBatch(
    @Id String id,
    String runId,
    List<CostEvent> costs,
    int recordCount,
    Instant periodStart,
    Instant periodEnd,
    Instant createdAt
) {
    public static RawCostBatch create(String runId, List<CostEvent> costs, Instant periodStart, Instant periodEnd,
                                      Instant now) {
        return new RawCostBatch(null, runId, List.copyOf(costs), costs.size(), periodStart, periodEnd, now);
    }
}
