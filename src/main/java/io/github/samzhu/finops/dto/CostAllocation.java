package io.github.samzhu.finops.dto;

/**
 * 分攤服務的輸出，尚未加上品質指標與時間特徵。
 *
 * @param window 時間窗口
 * @param resourceId 標準化資源名稱
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param allocatedCost 分得成本
 * @param totalCost 群組成本
 * @param method 使用的分攤策略
 * @param tokensUsed 該組合的 token 數
 * @param apiCalls 該組合的呼叫數
 * @param avgResponseTimeMs 平均回應時間
 * @param tokenShare token 佔比，群組總數為 0 時為 0
 * @param apiCallShare 呼叫數佔比，群組總數為 0 時為 0
 * @param costType 成本類型
 * @param modelFamily 模型家族
 * @param meterName 計量名稱
 * @param currency 幣別
 */
public record CostAllocation(
    TimeWindow window,
    String resourceId,
    String deviceId,
    String storeNumber,
    double allocatedCost,
    double totalCost,
    AllocationMethod method,
    long tokensUsed,
    long apiCalls,
    double avgResponseTimeMs,
    double tokenShare,
    double apiCallShare,
    String costType,
    String modelFamily,
    String meterName,
    String currency
) {}
