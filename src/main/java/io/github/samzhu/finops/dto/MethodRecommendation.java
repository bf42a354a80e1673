package io.github.samzhu.finops.dto;

/**
 * 依資料特徵建議的分攤策略與判斷依據。
 *
 * @param method 建議策略
 * @param reason 判斷原因
 * @param unknownDeviceRatio 未知裝置事件比例
 * @param tokenVariation 裝置間 token 總量的離散度
 * @param callVariation 裝置間呼叫數的離散度
 * @param deviceCount 裝置數
 */
public record MethodRecommendation(
    AllocationMethod method,
    String reason,
    double unknownDeviceRatio,
    double tokenVariation,
    double callVariation,
    int deviceCount
) {}
