package io.github.samzhu.finops.dto;

import java.util.List;

/**
 * 分攤結果的摘要統計，隨執行紀錄一起保存。
 *
 * @param totalRecords 分攤紀錄數
 * @param totalAllocatedCost 分攤成本總額
 * @param uniqueDevices 裝置數
 * @param uniqueStores 門市數
 * @param uniqueCombinations (裝置, 門市) 組合數
 * @param unknownDevicePercentage 未知裝置紀錄百分比
 * @param unknownStorePercentage 未知門市紀錄百分比
 * @param avgConfidence 平均信心度
 * @param avgAccuracy 平均準確度
 * @param avgUtilization 平均使用率
 * @param costByStore 各門市成本，依門市排序
 * @param costByModelFamily 各模型家族成本，依名稱排序
 * @param costByShift 各班別成本，依名稱排序
 * @param businessHoursCost 營業時間內成本
 * @param offHoursCost 營業時間外成本
 * @param topDevices 成本前 10 名裝置
 * @param topStores 成本前 10 名門市
 * @param responseTime 回應時間分布
 */
public record CorrelationSummary(
    int totalRecords,
    double totalAllocatedCost,
    int uniqueDevices,
    int uniqueStores,
    int uniqueCombinations,
    double unknownDevicePercentage,
    double unknownStorePercentage,
    double avgConfidence,
    double avgAccuracy,
    double avgUtilization,
    List<EntityCost> costByStore,
    List<EntityCost> costByModelFamily,
    List<EntityCost> costByShift,
    double businessHoursCost,
    double offHoursCost,
    List<EntityCost> topDevices,
    List<EntityCost> topStores,
    ResponseTimeStats responseTime
) {
    public static CorrelationSummary empty() {
        return new CorrelationSummary(0, 0.0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0,
            List.of(), List.of(), List.of(), 0.0, 0.0, List.of(), List.of(), ResponseTimeStats.empty());
    }

    /**
     * 單一維度值 (裝置、門市、模型家族、班別) 的彙總。
     *
     * @param key 維度值
     * @param allocatedCost 分攤成本
     * @param tokens token 數
     * @param apiCalls 呼叫數
     * @param records 紀錄數
     */
    public record EntityCost(
        String key,
        double allocatedCost,
        long tokens,
        long apiCalls,
        int records
    ) {}

    /**
     * 回應時間百分位 (T-Digest 近似)。
     *
     * @param count 樣本數 (每筆分攤紀錄的平均回應時間，以呼叫數加權)
     * @param avgMs 平均 (毫秒)
     * @param p50Ms P50
     * @param p95Ms P95
     * @param p99Ms P99
     */
    public record ResponseTimeStats(
        long count,
        double avgMs,
        double p50Ms,
        double p95Ms,
        double p99Ms
    ) {
        public static ResponseTimeStats empty() {
            return new ResponseTimeStats(0, 0.0, 0.0, 0.0, 0.0);
        }
    }
}
