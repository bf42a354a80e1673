package io.github.samzhu.finops.dto;

import java.util.List;

/**
 * 共用同一 (窗口, 資源) 與同一群組成本的關聯結果。
 *
 * @param window 時間窗口
 * @param resourceId 標準化資源名稱
 * @param cost 該窗口資源的成本紀錄 (同鍵多筆時已加總)
 * @param members 參與分攤的 (裝置, 門市) 彙總
 */
public record CorrelatedGroup(
    TimeWindow window,
    String resourceId,
    CostEvent cost,
    List<TelemetryAggregate> members
) {
    public double totalCost() {
        return cost.cost();
    }

    public long totalTokens() {
        return members.stream().mapToLong(TelemetryAggregate::totalTokens).sum();
    }

    public long totalApiCalls() {
        return members.stream().mapToLong(TelemetryAggregate::apiCallCount).sum();
    }
}
