package io.github.samzhu.finops.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.collector.AllocationBatch;
import io.github.samzhu.finops.collector.AllocationSink;
import io.github.samzhu.finops.collector.CostSource;
import io.github.samzhu.finops.collector.TelemetrySource;
import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.document.AllocationRun;
import io.github.samzhu.finops.document.AllocationRun.RunStatus;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.AllocationResult;
import io.github.samzhu.finops.dto.CorrelationSummary;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.MethodRecommendation;
import io.github.samzhu.finops.dto.TelemetryEventData;
import io.github.samzhu.finops.exception.SourceAccessDeniedException;
import io.github.samzhu.finops.repository.AllocationRunRepository;

/**
 * 分攤結算服務，定時收集遙測與成本並執行分攤管線。
 *
 * <p>每次執行流程：
 * <ol>
 *   <li>flush 遙測緩衝區，確保最新事件可被查詢</li>
 *   <li>取得回溯期間 {@code [now - lookback, now)} 的遙測與成本</li>
 *   <li>決定分攤策略：手動指定 &gt; 自動選擇 (若啟用) &gt; 設定值</li>
 *   <li>執行 {@link AllocationPipelineService}，計算摘要統計</li>
 *   <li>寫入 {@link AllocationSink}，記錄 {@link AllocationRun}</li>
 * </ol>
 *
 * <p>任一來源沒有資料時記錄為 SKIPPED，下次排程再處理。回溯期間重疊的執行會以相同文件 ID 覆寫，
 * 因此重跑是安全的。
 *
 * @see TelemetryBufferService
 */
@Service
public class AllocationSettlementService {

    private static final Logger log = LoggerFactory.getLogger(AllocationSettlementService.class);

    private static final String TRIGGER_SCHEDULED = "SCHEDULED";
    private static final String TRIGGER_MANUAL = "MANUAL";

    private final TelemetryBufferService bufferService;
    private final TelemetrySource telemetrySource;
    private final CostSource costSource;
    private final AllocationSink sink;
    private final AllocationPipelineService pipelineService;
    private final TelemetryWindowingService windowingService;
    private final AllocationMethodAdvisor methodAdvisor;
    private final CorrelationSummaryService summaryService;
    private final AllocationRunRepository runRepository;
    private final FinopsProperties properties;
    private final Clock clock;

    public AllocationSettlementService(
            TelemetryBufferService bufferService,
            TelemetrySource telemetrySource,
            CostSource costSource,
            AllocationSink sink,
            AllocationPipelineService pipelineService,
            TelemetryWindowingService windowingService,
            AllocationMethodAdvisor methodAdvisor,
            CorrelationSummaryService summaryService,
            AllocationRunRepository runRepository,
            FinopsProperties properties,
            Clock clock) {
        this.bufferService = bufferService;
        this.telemetrySource = telemetrySource;
        this.costSource = costSource;
        this.sink = sink;
        this.pipelineService = pipelineService;
        this.windowingService = windowingService;
        this.methodAdvisor = methodAdvisor;
        this.summaryService = summaryService;
        this.runRepository = runRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 定時結算任務。
     *
     * <p>失敗會記錄在 {@link AllocationRun}，不中斷排程。
     */
    @Scheduled(cron = "${finops.collection.cron:0 */6 * * * *}")
    public void settle() {
        execute(TRIGGER_SCHEDULED, null, false);
    }

    /**
     * 手動觸發分攤 (供管理 API 使用)。
     *
     * @param methodOverride 指定分攤策略，null 表示依設定
     * @return 執行紀錄
     * @throws SourceAccessDeniedException 資料來源權限不足
     */
    public AllocationRun triggerRun(AllocationMethod methodOverride) {
        log.info("Manual allocation run triggered: method={}",
            methodOverride != null ? methodOverride.value() : "configured");
        return execute(TRIGGER_MANUAL, methodOverride, true);
    }

    private AllocationRun execute(String trigger, AllocationMethod methodOverride, boolean propagateAccessDenied) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        Instant periodEnd = startedAt;
        Instant periodStart = periodEnd.minus(properties.collection().lookback());
        long startTime = System.currentTimeMillis();

        log.info("Starting allocation run: id={}, trigger={}, period={} to {}", runId, trigger, periodStart, periodEnd);

        try {
            bufferService.flushBuffer();

            List<TelemetryEventData> telemetry = telemetrySource.fetch(periodStart, periodEnd);
            List<CostEvent> costs = costSource.fetch(periodStart, periodEnd);

            if (telemetry.isEmpty() || costs.isEmpty()) {
                log.info("Allocation run skipped: telemetry={}, costs={}", telemetry.size(), costs.size());
                return runRepository.save(new AllocationRun(runId, RunStatus.SKIPPED, trigger, null, null,
                    periodStart, periodEnd, telemetry.size(), costs.size(), 0, 0, 0, 0, 0.0,
                    CorrelationSummary.empty(), null, startedAt, System.currentTimeMillis() - startTime));
            }

            MethodRecommendation recommendation = chooseMethod(methodOverride, telemetry, costs);
            AllocationResult result = pipelineService.run(telemetry, costs, recommendation.method());
            CorrelationSummary summary = summaryService.summarize(result.records());

            int written = sink.write(new AllocationBatch(runId, LocalDate.ofInstant(startedAt, ZoneOffset.UTC),
                periodStart, periodEnd, result.records(), costs));

            long duration = System.currentTimeMillis() - startTime;
            log.info("Allocation run completed: id={}, method={}, records={}, allocated={} in {}ms",
                runId, result.method().value(), written, result.totalAllocatedCost(), duration);

            return runRepository.save(new AllocationRun(runId, RunStatus.COMPLETED, trigger,
                result.method().value(), recommendation.reason(), periodStart, periodEnd,
                result.telemetryEvents(), result.costEvents(), result.malformedRecords(),
                result.correlatedGroups(), written, result.conservationViolations(),
                result.totalAllocatedCost(), summary, null, startedAt, duration));
        } catch (SourceAccessDeniedException e) {
            log.error("Allocation run {} failed, data source access denied: {}", runId, e.getMessage(), e);
            AllocationRun failed = saveFailed(runId, trigger, periodStart, periodEnd, startedAt, startTime, e);
            if (propagateAccessDenied) {
                throw e;
            }
            return failed;
        } catch (RuntimeException e) {
            log.error("Allocation run {} failed: {}", runId, e.getMessage(), e);
            return saveFailed(runId, trigger, periodStart, periodEnd, startedAt, startTime, e);
        }
    }

    private MethodRecommendation chooseMethod(AllocationMethod methodOverride, List<TelemetryEventData> telemetry,
                                              List<CostEvent> costs) {
        if (methodOverride != null) {
            return new MethodRecommendation(methodOverride, "Requested", 0.0, 0.0, 0.0, 0);
        }
        if (properties.correlation().autoSelectMethod()) {
            return methodAdvisor.recommend(windowingService.normalize(telemetry).events(), costs);
        }
        return new MethodRecommendation(properties.correlation().method(), "Configured", 0.0, 0.0, 0.0, 0);
    }

    private AllocationRun saveFailed(String runId, String trigger, Instant periodStart, Instant periodEnd,
                                     Instant startedAt, long startTime, RuntimeException e) {
        return runRepository.save(new AllocationRun(runId, RunStatus.FAILED, trigger, null, null,
            periodStart, periodEnd, 0, 0, 0, 0, 0, 0, 0.0, null, e.getMessage(),
            startedAt, System.currentTimeMillis() - startTime));
    }
}
