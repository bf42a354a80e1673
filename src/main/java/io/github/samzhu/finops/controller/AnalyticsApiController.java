package io.github.samzhu.finops.controller;

import java.util.List;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.finops.dto.AnomalyRecord;
import io.github.samzhu.finops.dto.DevicePrediction;
import io.github.samzhu.finops.dto.DeviceUsagePattern;
import io.github.samzhu.finops.dto.MethodRecommendation;
import io.github.samzhu.finops.dto.StoreSpillover;
import io.github.samzhu.finops.dto.WeightedCorrelation;
import io.github.samzhu.finops.service.AllocationAnalyticsService;

/**
 * 用量分析 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/analytics/patterns} - 裝置用量模式</li>
 *   <li>{@code GET /api/v1/analytics/anomalies} - 最近一小時的用量異常</li>
 *   <li>{@code GET /api/v1/analytics/predictions} - 裝置成本預測</li>
 *   <li>{@code GET /api/v1/analytics/spillover} - 門市內裝置成本關聯</li>
 *   <li>{@code GET /api/v1/analytics/recommendation?hours=} - 分攤策略建議</li>
 *   <li>{@code GET /api/v1/analytics/decay-weighted?hours=} - 時間衰減加權關聯</li>
 * </ul>
 *
 * <p>{@code hours} 須介於 1 到 744 (31 天)，超出範圍回應 400。
 */
@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsApiController {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsApiController.class);

    private static final int MAX_HOURS = 24 * 31;

    private final AllocationAnalyticsService analyticsService;

    public AnalyticsApiController(AllocationAnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/patterns")
    public ResponseEntity<List<DeviceUsagePattern>> getPatterns() {
        log.info("API request: getPatterns");
        return ResponseEntity.ok(analyticsService.patterns());
    }

    @GetMapping("/anomalies")
    public ResponseEntity<List<AnomalyRecord>> getAnomalies() {
        log.info("API request: getAnomalies");
        return ResponseEntity.ok(analyticsService.anomalies());
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<DevicePrediction>> getPredictions() {
        log.info("API request: getPredictions");
        return ResponseEntity.ok(analyticsService.predictions());
    }

    @GetMapping("/spillover")
    public ResponseEntity<List<StoreSpillover>> getSpillover() {
        log.info("API request: getSpillover");
        return ResponseEntity.ok(analyticsService.spillover());
    }

    @GetMapping("/recommendation")
    public ResponseEntity<MethodRecommendation> getRecommendation(
            @RequestParam(defaultValue = "24") @Positive @Max(MAX_HOURS) int hours) {
        log.info("API request: getRecommendation hours={}", hours);
        return ResponseEntity.ok(analyticsService.recommendation(hours));
    }

    @GetMapping("/decay-weighted")
    public ResponseEntity<List<WeightedCorrelation>> getDecayWeighted(
            @RequestParam(defaultValue = "24") @Positive @Max(MAX_HOURS) int hours) {
        log.info("API request: getDecayWeighted hours={}", hours);
        return ResponseEntity.ok(analyticsService.decayWeighted(hours));
    }
}
