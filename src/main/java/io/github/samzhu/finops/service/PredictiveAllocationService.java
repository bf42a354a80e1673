package io.github.samzhu.finops.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.DevicePrediction;
import io.github.samzhu.finops.dto.DevicePrediction.Predictor;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.util.StatisticsUtils;

/**
 * 預測式成本分攤服務。
 *
 * <p>以歷史分攤紀錄為每個 (裝置, 門市) 建立簡單模型：
 * <ul>
 *   <li>token 與成本的 Pearson 相關係數 &gt; 0.5 → {@code tokens × 平均每 token 成本}</li>
 *   <li>否則呼叫數與成本的相關係數 &gt; 0.5 → {@code calls × 平均每次呼叫成本}</li>
 *   <li>否則 → 歷史平均成本</li>
 * </ul>
 *
 * <p>歷史筆數少於 {@code minHistoryPoints} 或成本沒有變異的裝置不建模型，也不產生預測。
 * 預測值不會為負。
 */
@Service
public class PredictiveAllocationService {

    private static final Logger log = LoggerFactory.getLogger(PredictiveAllocationService.class);

    private final int minHistoryPoints;
    private final double predictorThreshold;

    public PredictiveAllocationService(FinopsProperties properties) {
        this.minHistoryPoints = properties.analytics().minHistoryPoints();
        this.predictorThreshold = properties.analytics().predictorThreshold();
    }

    /**
     * 預測目前用量的成本。
     *
     * @param history 歷史分攤紀錄
     * @param currentUsage 目前尚未有成本的遙測事件
     * @return 有模型的裝置預測，依裝置與門市排序
     */
    public List<DevicePrediction> predict(List<AllocatedRecord> history, List<TelemetryEvent> currentUsage) {
        if (history.isEmpty() || currentUsage.isEmpty()) {
            return List.of();
        }

        Map<String, CostModel> models = buildModels(history);

        Map<String, List<TelemetryEvent>> byDevice = new TreeMap<>();
        for (TelemetryEvent event : currentUsage) {
            byDevice.computeIfAbsent(event.deviceStoreKey(), k -> new ArrayList<>()).add(event);
        }

        List<DevicePrediction> predictions = new ArrayList<>();
        byDevice.forEach((key, events) -> {
            CostModel model = models.get(key);
            if (model == null) {
                return;
            }
            long tokens = events.stream().mapToLong(TelemetryEvent::tokensUsed).sum();
            predictions.add(model.predict(events.get(0), tokens, events.size(), predictorThreshold));
        });

        log.info("Predicted costs for {} of {} devices ({} models)", predictions.size(), byDevice.size(), models.size());
        return predictions;
    }

    private Map<String, CostModel> buildModels(List<AllocatedRecord> history) {
        Map<String, List<AllocatedRecord>> byDevice = new HashMap<>();
        for (AllocatedRecord record : history) {
            byDevice.computeIfAbsent(record.deviceStoreKey(), k -> new ArrayList<>()).add(record);
        }

        Map<String, CostModel> models = new HashMap<>();
        byDevice.forEach((key, records) -> {
            if (records.size() < minHistoryPoints) {
                return;
            }
            List<Double> costs = records.stream().map(AllocatedRecord::allocatedCost).toList();
            if (StatisticsUtils.sampleStd(costs) <= 0) {
                return;
            }
            List<Long> tokens = records.stream().map(AllocatedRecord::tokensUsed).toList();
            List<Long> calls = records.stream().map(AllocatedRecord::apiCalls).toList();

            double costSum = StatisticsUtils.sum(costs);
            models.put(key, new CostModel(
                StatisticsUtils.pearson(tokens, costs),
                StatisticsUtils.pearson(calls, costs),
                costSum / Math.max(StatisticsUtils.sum(tokens), 1.0),
                costSum / Math.max(StatisticsUtils.sum(calls), 1.0),
                StatisticsUtils.mean(costs)));
        });
        return models;
    }

    private record CostModel(
        double tokenCorrelation,
        double callCorrelation,
        double avgCostPerToken,
        double avgCostPerCall,
        double historicalAverage
    ) {
        DevicePrediction predict(TelemetryEvent sample, long tokens, long calls, double threshold) {
            double prediction;
            Predictor predictor;
            if (tokenCorrelation > threshold) {
                prediction = tokens * avgCostPerToken;
                predictor = Predictor.TOKENS;
            } else if (callCorrelation > threshold) {
                prediction = calls * avgCostPerCall;
                predictor = Predictor.API_CALLS;
            } else {
                prediction = historicalAverage;
                predictor = Predictor.HISTORICAL_MEAN;
            }
            return new DevicePrediction(sample.deviceId(), sample.storeNumber(), Math.max(prediction, 0.0),
                predictor, tokenCorrelation, callCorrelation);
        }
    }
}
