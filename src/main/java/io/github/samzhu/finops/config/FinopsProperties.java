package io.github.samzhu.finops.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.github.samzhu.finops.dto.AllocationMethod;

/**
 * FinOps 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置在啟動時建構一次，之後唯讀，透過 constructor injection 傳入各元件：
 * <ul>
 *   <li>{@link CorrelationConfig} - 時間窗口寬度、分攤策略、守恆容忍度</li>
 *   <li>{@link CollectionConfig} - 排程頻率、回溯時間、來源重試設定</li>
 *   <li>{@link BillingConfig} - 帳單 API 連線設定</li>
 *   <li>{@link BufferConfig} - 遙測事件緩衝設定</li>
 *   <li>{@link AnalyticsConfig} - 分析擴充功能的閾值</li>
 *   <li>{@link LatencyConfig} - 回應時間百分位計算設定 (T-Digest)</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * finops:
 *   correlation:
 *     window-minutes: 60
 *     allocation-method: proportional
 *   collection:
 *     cron: "0 *&#47;6 * * * *"
 *     lookback-hours: 1
 *     max-retry-attempts: 3
 *   analytics:
 *     decay-hours: 2.0
 *     anomaly-threshold: 2.0
 * </pre>
 *
 * <p>任何區塊缺漏時皆以預設值補齊，不會產生 {@code null}。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "finops")
public record FinopsProperties(
    CorrelationConfig correlation,
    CollectionConfig collection,
    BillingConfig billing,
    BufferConfig buffer,
    AnalyticsConfig analytics,
    LatencyConfig latency
) {
    public FinopsProperties {
        if (correlation == null) {
            correlation = CorrelationConfig.defaults();
        }
        if (collection == null) {
            collection = CollectionConfig.defaults();
        }
        if (billing == null) {
            billing = BillingConfig.defaults();
        }
        if (buffer == null) {
            buffer = BufferConfig.defaults();
        }
        if (analytics == null) {
            analytics = AnalyticsConfig.defaults();
        }
        if (latency == null) {
            latency = LatencyConfig.defaults();
        }
    }

    /**
     * 建立全部使用預設值的配置。
     */
    public static FinopsProperties defaults() {
        return new FinopsProperties(null, null, null, null, null, null);
    }

    /**
     * 關聯與分攤設定。
     *
     * @param windowMinutes 時間窗口寬度 (分鐘)，預設 60
     * @param allocationMethod 預設分攤策略，可為 proportional、equal、usage-based、token-based
     * @param autoSelectMethod 是否依資料特徵自動選擇分攤策略，預設 false
     * @param conservationTolerance 成本守恆檢查的相對容忍度，預設 0.01 (1%)
     */
    public record CorrelationConfig(
        int windowMinutes,
        String allocationMethod,
        boolean autoSelectMethod,
        double conservationTolerance
    ) {
        public CorrelationConfig {
            if (windowMinutes <= 0) {
                windowMinutes = 60;
            }
            if (allocationMethod == null || allocationMethod.isBlank()) {
                allocationMethod = AllocationMethod.PROPORTIONAL.value();
            }
            // 非法值在啟動時即失敗
            AllocationMethod.fromValue(allocationMethod);
            if (conservationTolerance <= 0) {
                conservationTolerance = 0.01;
            }
        }

        public static CorrelationConfig defaults() {
            return new CorrelationConfig(60, "proportional", false, 0.01);
        }

        public Duration windowWidth() {
            return Duration.ofMinutes(windowMinutes);
        }

        public AllocationMethod method() {
            return AllocationMethod.fromValue(allocationMethod);
        }
    }

    /**
     * 排程收集設定。
     *
     * <p>控制 {@link io.github.samzhu.finops.service.AllocationSettlementService} 的執行頻率，
     * 以及成本來源的重試行為 (指數退避)。
     *
     * @param cron 排程 Cron 表達式，預設每 6 分鐘
     * @param lookbackHours 每次執行回溯的時數，預設 1
     * @param maxRetryAttempts 暫時性失敗的最大嘗試次數，預設 3
     * @param initialBackoff 第一次重試前的等待時間，預設 2 秒
     * @param maxBackoff 重試等待時間上限，預設 30 秒
     */
    public record CollectionConfig(
        String cron,
        int lookbackHours,
        int maxRetryAttempts,
        Duration initialBackoff,
        Duration maxBackoff
    ) {
        public CollectionConfig {
            if (cron == null || cron.isBlank()) {
                cron = "0 */6 * * * *";
            }
            if (lookbackHours <= 0) {
                lookbackHours = 1;
            }
            if (maxRetryAttempts <= 0) {
                maxRetryAttempts = 3;
            }
            if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
                initialBackoff = Duration.ofSeconds(2);
            }
            if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
                maxBackoff = Duration.ofSeconds(30).compareTo(initialBackoff) < 0
                    ? initialBackoff
                    : Duration.ofSeconds(30);
            }
        }

        public static CollectionConfig defaults() {
            return new CollectionConfig("0 */6 * * * *", 1, 3, Duration.ofSeconds(2), Duration.ofSeconds(30));
        }

        public Duration lookback() {
            return Duration.ofHours(lookbackHours);
        }
    }

    /**
     * 帳單 API 連線設定。
     *
     * @param baseUrl 帳單查詢 API 位址
     * @param scope 查詢範圍 (例如訂閱 ID)，會帶入查詢參數
     * @param connectTimeout 連線逾時，預設 5 秒
     * @param readTimeout 讀取逾時，預設 30 秒
     */
    public record BillingConfig(
        String baseUrl,
        String scope,
        Duration connectTimeout,
        Duration readTimeout
    ) {
        public BillingConfig {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "http://localhost:8081";
            }
            if (scope == null) {
                scope = "";
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(30);
            }
        }

        public static BillingConfig defaults() {
            return new BillingConfig("http://localhost:8081", "", Duration.ofSeconds(5), Duration.ofSeconds(30));
        }
    }

    /**
     * 遙測事件緩衝設定。
     *
     * <p>當緩衝區事件數達到 {@code size} 時立即寫入，否則依 {@code flushIntervalMs} 定時寫入。
     *
     * @param size 批次大小，預設 1000
     * @param flushIntervalMs 定時刷新間隔 (毫秒)，預設 5000
     */
    public record BufferConfig(
        int size,
        long flushIntervalMs
    ) {
        public BufferConfig {
            if (size <= 0) {
                size = 1000;
            }
            if (flushIntervalMs <= 0) {
                flushIntervalMs = 5000;
            }
        }

        public static BufferConfig defaults() {
            return new BufferConfig(1000, 5000);
        }
    }

    /**
     * 分析擴充功能設定。
     *
     * @param decayHours 時間衰減權重的半衰尺度 (小時)，預設 2.0
     * @param patternLookbackDays 用量模式學習的回溯天數，預設 7
     * @param anomalyThreshold 異常判定的相對偏差門檻，預設 2.0 (200%)
     * @param highSeverityThreshold 高嚴重度門檻，預設 5.0
     * @param spilloverThreshold 外溢分析的相關係數門檻，預設 0.7
     * @param predictorThreshold 預測模型採用某特徵的相關係數門檻，預設 0.5
     * @param minHistoryPoints 建立預測模型所需的最少歷史筆數，預設 5
     */
    public record AnalyticsConfig(
        double decayHours,
        int patternLookbackDays,
        double anomalyThreshold,
        double highSeverityThreshold,
        double spilloverThreshold,
        double predictorThreshold,
        int minHistoryPoints
    ) {
        public AnalyticsConfig {
            if (decayHours <= 0) {
                decayHours = 2.0;
            }
            if (patternLookbackDays <= 0) {
                patternLookbackDays = 7;
            }
            if (anomalyThreshold <= 0) {
                anomalyThreshold = 2.0;
            }
            if (highSeverityThreshold <= 0) {
                highSeverityThreshold = 5.0;
            }
            if (spilloverThreshold <= 0) {
                spilloverThreshold = 0.7;
            }
            if (predictorThreshold <= 0) {
                predictorThreshold = 0.5;
            }
            if (minHistoryPoints <= 1) {
                minHistoryPoints = 5;
            }
        }

        public static AnalyticsConfig defaults() {
            return new AnalyticsConfig(2.0, 7, 2.0, 5.0, 0.7, 0.5, 5);
        }
    }

    /**
     * 回應時間百分位計算設定。
     *
     * @param digestCompression T-Digest 壓縮因子，預設 100
     */
    public record LatencyConfig(
        int digestCompression
    ) {
        public LatencyConfig {
            if (digestCompression <= 0) {
                digestCompression = 100;
            }
        }

        public static LatencyConfig defaults() {
            return new LatencyConfig(100);
        }
    }
}
