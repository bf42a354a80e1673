package io.github.samzhu.finops.service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.dto.WeightedCorrelation;
import io.github.samzhu.finops.util.AttributionNormalizer;

/**
 * 時間衰減加權的關聯分析。
 *
 * <p>固定窗口的替代做法：越接近現在的事件權重越高，
 * {@code weight = exp(-hoursAgo / decayHours)}。
 * <ol>
 *   <li>遙測依 (裝置, 門市) 加權加總 token 與呼叫數，記錄最近時間</li>
 *   <li>成本依資源加權加總成本與用量，記錄最近時間</li>
 *   <li>兩邊最近時間落在同一整點者配對</li>
 * </ol>
 */
@Service
public class DecayWeightedCorrelationService {

    private static final Logger log = LoggerFactory.getLogger(DecayWeightedCorrelationService.class);

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final double decayHours;

    public DecayWeightedCorrelationService(FinopsProperties properties) {
        this.decayHours = properties.analytics().decayHours();
    }

    /**
     * 執行加權關聯。
     *
     * @param telemetry 正規化後的遙測事件
     * @param costs 成本紀錄
     * @param now 計算權重的參考時間
     * @return 配對結果，依整點、裝置、資源排序
     */
    public List<WeightedCorrelation> correlate(List<TelemetryEvent> telemetry, List<CostEvent> costs, Instant now) {
        if (telemetry.isEmpty() || costs.isEmpty()) {
            return List.of();
        }

        Map<String, WeightedUsage> usage = new TreeMap<>();
        for (TelemetryEvent event : telemetry) {
            double weight = weight(event.timestamp(), now);
            usage.computeIfAbsent(event.deviceStoreKey(),
                    k -> new WeightedUsage(event.deviceId(), event.storeNumber()))
                .add(event.tokensUsed() * weight, weight, event.timestamp());
        }

        Map<String, WeightedCost> spend = new TreeMap<>();
        for (CostEvent cost : costs) {
            if (cost.usageTimestamp() == null) {
                continue;
            }
            double weight = weight(cost.usageTimestamp(), now);
            String resource = AttributionNormalizer.normalizeResourceId(cost.resourceId());
            spend.computeIfAbsent(resource, WeightedCost::new)
                .add(cost.cost() * weight, cost.usageQuantity() * weight, weight, cost.usageTimestamp());
        }

        List<WeightedCorrelation> results = new ArrayList<>();
        for (WeightedUsage u : usage.values()) {
            Instant hour = u.latest.truncatedTo(ChronoUnit.HOURS);
            for (WeightedCost c : spend.values()) {
                if (hour.equals(c.latest.truncatedTo(ChronoUnit.HOURS))) {
                    results.add(new WeightedCorrelation(hour, u.deviceId, u.storeNumber, c.resourceId,
                        u.tokens, u.calls, u.weight, c.cost, c.usage, c.weight));
                }
            }
        }

        log.info("Decay-weighted correlation: {} device groups, {} resources, {} pairs (decayHours={})",
            usage.size(), spend.size(), results.size(), decayHours);
        return results;
    }

    double weight(Instant timestamp, Instant now) {
        double hoursAgo = (now.toEpochMilli() - timestamp.toEpochMilli()) / MILLIS_PER_HOUR;
        return Math.exp(-hoursAgo / decayHours);
    }

    private static final class WeightedUsage {
        private final String deviceId;
        private final String storeNumber;
        private double tokens;
        private double calls;
        private double weight;
        private Instant latest = Instant.MIN;

        WeightedUsage(String deviceId, String storeNumber) {
            this.deviceId = deviceId;
            this.storeNumber = storeNumber;
        }

        void add(double weightedTokens, double eventWeight, Instant timestamp) {
            tokens += weightedTokens;
            calls += eventWeight;
            weight += eventWeight;
            if (timestamp.isAfter(latest)) {
                latest = timestamp;
            }
        }
    }

    private static final class WeightedCost {
        private final String resourceId;
        private double cost;
        private double usage;
        private double weight;
        private Instant latest = Instant.MIN;

        WeightedCost(String resourceId) {
            this.resourceId = resourceId;
        }

        void add(double weightedCost, double weightedUsage, double eventWeight, Instant timestamp) {
            cost += weightedCost;
            usage += weightedUsage;
            weight += eventWeight;
            if (timestamp.isAfter(latest)) {
                latest = timestamp;
            }
        }
    }
}
