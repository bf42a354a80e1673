package io.github.samzhu.finops.service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AnomalyRecord;
import io.github.samzhu.finops.dto.AnomalyRecord.AnomalyType;
import io.github.samzhu.finops.dto.AnomalyRecord.Severity;
import io.github.samzhu.finops.dto.DeviceUsagePattern;
import io.github.samzhu.finops.dto.TelemetryEvent;

/**
 * 用量異常偵測服務。
 *
 * <p>將裝置目前每小時的 token 與呼叫速率和學習到的模式比較：
 * <pre>
 * deviation = |current - expected| / max(expected, 1)
 * </pre>
 * 任一偏差達到 {@code anomalyThreshold} (預設 2.0) 即視為異常；
 * 最大偏差超過 {@code highSeverityThreshold} (預設 5.0) 為 high，否則為 medium。
 *
 * <p>沒有模式可比較的裝置不會產生異常。
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final double threshold;
    private final double highSeverityThreshold;

    public AnomalyDetectionService(FinopsProperties properties) {
        this.threshold = properties.analytics().anomalyThreshold();
        this.highSeverityThreshold = properties.analytics().highSeverityThreshold();
    }

    /**
     * 偵測異常。
     *
     * @param currentUsage 目前期間的遙測事件
     * @param patterns 學習到的用量模式
     * @return 異常清單，依裝置與門市排序
     */
    public List<AnomalyRecord> detect(List<TelemetryEvent> currentUsage, List<DeviceUsagePattern> patterns) {
        Map<String, DeviceUsagePattern> lookup = patterns.stream()
            .collect(Collectors.toMap(DeviceUsagePattern::deviceStoreKey, Function.identity(), (a, b) -> a,
                LinkedHashMap::new));

        Map<String, List<TelemetryEvent>> byDevice = new TreeMap<>();
        for (TelemetryEvent event : currentUsage) {
            if (lookup.containsKey(event.deviceStoreKey())) {
                byDevice.computeIfAbsent(event.deviceStoreKey(), k -> new ArrayList<>()).add(event);
            }
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        byDevice.forEach((key, events) -> {
            AnomalyRecord anomaly = evaluate(events, lookup.get(key));
            if (anomaly != null) {
                anomalies.add(anomaly);
            }
        });

        log.info("Detected {} usage anomalies across {} devices", anomalies.size(), byDevice.size());
        return anomalies;
    }

    private AnomalyRecord evaluate(List<TelemetryEvent> events, DeviceUsagePattern pattern) {
        Set<Instant> hours = new HashSet<>();
        long tokens = 0;
        for (TelemetryEvent event : events) {
            hours.add(event.timestamp().truncatedTo(ChronoUnit.HOURS));
            tokens += event.tokensUsed();
        }
        double currentTokens = (double) tokens / hours.size();
        double currentCalls = (double) events.size() / hours.size();

        double tokenDeviation = deviation(currentTokens, pattern.avgTokensPerHour());
        double callDeviation = deviation(currentCalls, pattern.avgApiCallsPerHour());
        if (tokenDeviation < threshold && callDeviation < threshold) {
            return null;
        }

        AnomalyType type = currentTokens > pattern.avgTokensPerHour() ? AnomalyType.SPIKE : AnomalyType.DROP;
        Severity severity = Math.max(tokenDeviation, callDeviation) > highSeverityThreshold
            ? Severity.HIGH
            : Severity.MEDIUM;

        log.debug("Usage anomaly: device={}, store={}, type={}, tokenDeviation={}, callDeviation={}",
            pattern.deviceId(), pattern.storeNumber(), type, tokenDeviation, callDeviation);
        return new AnomalyRecord(
            pattern.deviceId(),
            pattern.storeNumber(),
            type,
            tokenDeviation,
            callDeviation,
            severity,
            currentTokens,
            pattern.avgTokensPerHour());
    }

    private static double deviation(double current, double expected) {
        return Math.abs(current - expected) / Math.max(expected, 1.0);
    }
}
