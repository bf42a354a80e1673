package io.github.samzhu.finops.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.collector.CostSource;
import io.github.samzhu.finops.collector.TelemetrySource;
import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.document.AllocatedCost;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.AnomalyRecord;
import io.github.samzhu.finops.dto.DevicePrediction;
import io.github.samzhu.finops.dto.DeviceUsagePattern;
import io.github.samzhu.finops.dto.MethodRecommendation;
import io.github.samzhu.finops.dto.StoreSpillover;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.dto.WeightedCorrelation;
import io.github.samzhu.finops.repository.AllocatedCostRepository;

/**
 * 分析查詢服務，為分析 API 準備資料並呼叫各分析元件。
 *
 * <p>資料範圍：
 * <ul>
 *   <li>用量模式、預測、外溢：回溯 {@code finops.analytics.pattern-lookback-days} 天</li>
 *   <li>異常偵測與預測的「目前用量」：最近一小時的遙測；異常偵測的基準不含這一小時</li>
 *   <li>策略建議與衰減加權關聯：由呼叫端指定的時數</li>
 * </ul>
 */
@Service
public class AllocationAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AllocationAnalyticsService.class);

    private static final Duration CURRENT_PERIOD = Duration.ofHours(1);

    private final TelemetrySource telemetrySource;
    private final CostSource costSource;
    private final AllocatedCostRepository allocatedCostRepository;
    private final TelemetryWindowingService windowingService;
    private final UsagePatternService patternService;
    private final AnomalyDetectionService anomalyService;
    private final PredictiveAllocationService predictionService;
    private final SpilloverAnalysisService spilloverService;
    private final AllocationMethodAdvisor methodAdvisor;
    private final DecayWeightedCorrelationService decayService;
    private final Duration historyLookback;
    private final Clock clock;

    public AllocationAnalyticsService(
            TelemetrySource telemetrySource,
            CostSource costSource,
            AllocatedCostRepository allocatedCostRepository,
            TelemetryWindowingService windowingService,
            UsagePatternService patternService,
            AnomalyDetectionService anomalyService,
            PredictiveAllocationService predictionService,
            SpilloverAnalysisService spilloverService,
            AllocationMethodAdvisor methodAdvisor,
            DecayWeightedCorrelationService decayService,
            FinopsProperties properties,
            Clock clock) {
        this.telemetrySource = telemetrySource;
        this.costSource = costSource;
        this.allocatedCostRepository = allocatedCostRepository;
        this.windowingService = windowingService;
        this.patternService = patternService;
        this.anomalyService = anomalyService;
        this.predictionService = predictionService;
        this.spilloverService = spilloverService;
        this.methodAdvisor = methodAdvisor;
        this.decayService = decayService;
        this.historyLookback = Duration.ofDays(properties.analytics().patternLookbackDays());
        this.clock = clock;
    }

    public List<DeviceUsagePattern> patterns() {
        Instant now = clock.instant();
        return patternService.analyze(telemetry(now.minus(historyLookback), now), now);
    }

    /**
     * 以最近一小時的用量比對學得的模式。
     *
     * <p>基準模式只取 {@code now - 1h} (含) 以前的遙測，目前這一小時不計入。
     */
    public List<AnomalyRecord> anomalies() {
        Instant now = clock.instant();
        Instant currentStart = now.minus(CURRENT_PERIOD);
        Map<Boolean, List<TelemetryEvent>> split = telemetry(now.minus(historyLookback), now).stream()
            .collect(Collectors.partitioningBy(e -> e.timestamp().isAfter(currentStart)));
        List<DeviceUsagePattern> baseline = patternService.analyze(split.get(false), now);
        return anomalyService.detect(split.get(true), baseline);
    }

    public List<DevicePrediction> predictions() {
        Instant now = clock.instant();
        return predictionService.predict(history(now), telemetry(now.minus(CURRENT_PERIOD), now));
    }

    public List<StoreSpillover> spillover() {
        return spilloverService.analyze(history(clock.instant()));
    }

    public MethodRecommendation recommendation(int hours) {
        Instant now = clock.instant();
        Instant from = now.minus(Duration.ofHours(hours));
        return methodAdvisor.recommend(telemetry(from, now), costSource.fetch(from, now));
    }

    public List<WeightedCorrelation> decayWeighted(int hours) {
        Instant now = clock.instant();
        Instant from = now.minus(Duration.ofHours(hours));
        return decayService.correlate(telemetry(from, now), costSource.fetch(from, now), now);
    }

    private List<TelemetryEvent> telemetry(Instant from, Instant to) {
        return windowingService.normalize(telemetrySource.fetch(from, to)).events();
    }

    private List<AllocatedRecord> history(Instant now) {
        List<AllocatedRecord> records = allocatedCostRepository
            .findByWindowStartGreaterThanEqualOrderByWindowStartAsc(now.minus(historyLookback))
            .stream()
            .map(AllocatedCost::toRecord)
            .toList();
        log.debug("Loaded {} allocation records for analytics", records.size());
        return records;
    }
}
