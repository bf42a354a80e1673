package io.github.samzhu.finops.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.DeviceUsagePattern;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.util.AttributionNormalizer;
import io.github.samzhu.finops.util.StatisticsUtils;

/**
 * 裝置用量模式學習服務。
 *
 * <p>對回溯期間內每個 (裝置, 門市) 建立一天 24 小時的 token 分布：
 * <ul>
 *   <li>尖峰時段：小時 token 總量 ≥ 第 80 百分位 (線性內插)</li>
 *   <li>穩定度：{@code max(0, 1 - std / (mean + 1))}，少於兩個小時有資料時為 0</li>
 *   <li>效率：{@code min(每次呼叫 token 數 / 1000, 1)}</li>
 * </ul>
 *
 * <p>裝置或門市未知的事件無法歸屬，不參與學習。
 */
@Service
public class UsagePatternService {

    private static final Logger log = LoggerFactory.getLogger(UsagePatternService.class);

    private static final double PEAK_QUANTILE = 0.8;

    private final Duration lookback;

    public UsagePatternService(FinopsProperties properties) {
        this.lookback = Duration.ofDays(properties.analytics().patternLookbackDays());
    }

    /**
     * 學習各裝置的用量模式。
     *
     * @param telemetry 正規化後的遙測事件
     * @param now 回溯期間的終點
     * @return 每個已知 (裝置, 門市) 一筆，依裝置與門市排序
     */
    public List<DeviceUsagePattern> analyze(List<TelemetryEvent> telemetry, Instant now) {
        Instant cutoff = now.minus(lookback);
        Map<String, List<TelemetryEvent>> byDevice = new TreeMap<>();
        for (TelemetryEvent event : telemetry) {
            if (event.timestamp().isBefore(cutoff)
                    || AttributionNormalizer.isUnknown(event.deviceId())
                    || AttributionNormalizer.isUnknown(event.storeNumber())) {
                continue;
            }
            byDevice.computeIfAbsent(event.deviceStoreKey(), k -> new ArrayList<>()).add(event);
        }

        List<DeviceUsagePattern> patterns = new ArrayList<>(byDevice.size());
        for (List<TelemetryEvent> events : byDevice.values()) {
            patterns.add(analyzeDevice(events));
        }

        log.info("Analyzed usage patterns for {} devices over {} days", patterns.size(), lookback.toDays());
        return patterns;
    }

    private DeviceUsagePattern analyzeDevice(List<TelemetryEvent> events) {
        TelemetryEvent first = events.get(0);
        Map<Integer, Long> hourlyTokens = new TreeMap<>();
        Set<Instant> activeHours = new HashSet<>();
        long totalTokens = 0;

        for (TelemetryEvent event : events) {
            int hourOfDay = event.timestamp().atZone(ZoneOffset.UTC).getHour();
            hourlyTokens.merge(hourOfDay, event.tokensUsed(), Long::sum);
            activeHours.add(event.timestamp().truncatedTo(ChronoUnit.HOURS));
            totalTokens += event.tokensUsed();
        }

        long calls = events.size();
        long hours = Math.max(activeHours.size(), 1);
        List<Long> totals = new ArrayList<>(hourlyTokens.values());

        double threshold = StatisticsUtils.quantile(totals, PEAK_QUANTILE);
        List<Integer> peakHours = hourlyTokens.entrySet().stream()
            .filter(e -> e.getValue() >= threshold)
            .map(Map.Entry::getKey)
            .toList();

        double consistency = 0.0;
        if (totals.size() >= 2) {
            double variation = StatisticsUtils.sampleStd(totals) / (StatisticsUtils.mean(totals) + 1);
            consistency = Math.max(0.0, 1 - variation);
        }

        double tokensPerCall = (double) totalTokens / calls;
        double efficiency = Math.min(tokensPerCall / 1000.0, 1.0);

        return new DeviceUsagePattern(
            first.deviceId(),
            first.storeNumber(),
            (double) totalTokens / hours,
            (double) calls / hours,
            peakHours,
            consistency,
            efficiency,
            totalTokens,
            calls,
            activeHours.size()
        );
    }
}
