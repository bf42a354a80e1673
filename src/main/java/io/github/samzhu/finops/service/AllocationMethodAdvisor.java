package io.github.samzhu.finops.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.MethodRecommendation;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.util.AttributionNormalizer;
import io.github.samzhu.finops.util.StatisticsUtils;

/**
 * 依資料特徵建議分攤策略。
 *
 * <p>判斷順序：
 * <ol>
 *   <li>未知裝置事件比例 &gt; 0.5 → EQUAL</li>
 *   <li>token 離散度 &gt; 2.0 且平均 &gt; 0 → TOKEN_BASED</li>
 *   <li>裝置呼叫數離散度 &gt; 1.5 → USAGE_BASED</li>
 *   <li>裝置數 &gt; 10 → PROPORTIONAL</li>
 *   <li>其餘 → PROPORTIONAL</li>
 * </ol>
 *
 * <p>離散度定義為 {@code 樣本變異數 / max(平均, 1)}。
 */
@Service
public class AllocationMethodAdvisor {

    private static final Logger log = LoggerFactory.getLogger(AllocationMethodAdvisor.class);

    private static final double UNKNOWN_RATIO_LIMIT = 0.5;
    private static final double TOKEN_VARIATION_LIMIT = 2.0;
    private static final double CALL_VARIATION_LIMIT = 1.5;
    private static final int LARGE_FLEET = 10;

    /**
     * 建議分攤策略。
     *
     * @param telemetry 正規化後的遙測事件
     * @param costs 成本紀錄
     * @return 建議結果，任一輸入為空時為 EQUAL
     */
    public MethodRecommendation recommend(List<TelemetryEvent> telemetry, List<CostEvent> costs) {
        if (telemetry.isEmpty() || costs.isEmpty()) {
            return new MethodRecommendation(AllocationMethod.EQUAL, "No data available", 0.0, 0.0, 0.0, 0);
        }

        List<Long> tokens = new ArrayList<>(telemetry.size());
        Map<String, Long> callsPerDevice = new LinkedHashMap<>();
        Set<String> devices = new HashSet<>();
        int unknownDevices = 0;
        for (TelemetryEvent event : telemetry) {
            tokens.add(event.tokensUsed());
            callsPerDevice.merge(event.deviceStoreKey(), 1L, Long::sum);
            devices.add(event.deviceId());
            if (AttributionNormalizer.isUnknown(event.deviceId())) {
                unknownDevices++;
            }
        }

        double tokenMean = StatisticsUtils.mean(tokens);
        double tokenVariation = StatisticsUtils.sampleVariance(tokens) / Math.max(tokenMean, 1.0);
        List<Long> calls = new ArrayList<>(callsPerDevice.values());
        double callVariation = StatisticsUtils.sampleVariance(calls) / Math.max(StatisticsUtils.mean(calls), 1.0);
        double unknownRatio = (double) unknownDevices / telemetry.size();

        AllocationMethod method;
        String reason;
        if (unknownRatio > UNKNOWN_RATIO_LIMIT) {
            method = AllocationMethod.EQUAL;
            reason = "High ratio of unknown devices";
        } else if (tokenVariation > TOKEN_VARIATION_LIMIT && tokenMean > 0) {
            method = AllocationMethod.TOKEN_BASED;
            reason = "High token usage variance between devices";
        } else if (callVariation > CALL_VARIATION_LIMIT) {
            method = AllocationMethod.USAGE_BASED;
            reason = "High API call variance between devices";
        } else if (devices.size() > LARGE_FLEET) {
            method = AllocationMethod.PROPORTIONAL;
            reason = "Large number of devices with moderate variance";
        } else {
            method = AllocationMethod.PROPORTIONAL;
            reason = "Balanced usage patterns";
        }

        log.info("Recommended allocation method: {} ({}), unknownRatio={}, tokenVariation={}, callVariation={}, devices={}",
            method.value(), reason, unknownRatio, tokenVariation, callVariation, devices.size());
        return new MethodRecommendation(method, reason, unknownRatio, tokenVariation, callVariation, devices.size());
    }
}
