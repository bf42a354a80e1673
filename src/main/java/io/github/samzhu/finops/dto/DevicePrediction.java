package io.github.samzhu.finops.dto;

/**
 * 依歷史分攤資料預測的裝置成本。
 *
 * @param deviceId 裝置 ID
 * @param storeNumber 門市編號
 * @param predictedCost 預測成本，不為負
 * @param predictor 採用的預測依據
 * @param tokenCorrelation 歷史 token 與成本的相關係數
 * @param callCorrelation 歷史呼叫數與成本的相關係數
 */
public record DevicePrediction(
    String deviceId,
    String storeNumber,
    double predictedCost,
    Predictor predictor,
    double tokenCorrelation,
    double callCorrelation
) {
    public enum Predictor {
        TOKENS,
        API_CALLS,
        HISTORICAL_MEAN
    }

    public String deviceStoreKey() {
        return deviceId + "_" + storeNumber;
    }
}
