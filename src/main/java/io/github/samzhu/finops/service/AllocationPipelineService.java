package io.github.samzhu.finops.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.AllocationResult;
import io.github.samzhu.finops.dto.CorrelatedGroup;
import io.github.samzhu.finops.dto.CostAllocation;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.NormalizedTelemetry;
import io.github.samzhu.finops.dto.TelemetryAggregate;
import io.github.samzhu.finops.dto.TelemetryEventData;

/**
 * 成本分攤管線。
 *
 * <p>每次呼叫對完整的遙測批次與成本批次重新執行全部階段，不保留任何游標或狀態：
 * <pre>
 * TelemetryEventData ─ normalize ─ aggregate ─┐
 *                                             ├─ correlate ─ allocate ─ enrich ─ AllocatedRecord
 * CostEvent ──────────────────────────────────┘
 * </pre>
 *
 * <p>此服務不做任何 I/O，相同輸入必定產生相同輸出；資料取得與寫入由
 * {@link AllocationSettlementService} 在管線前後處理。
 */
@Service
public class AllocationPipelineService {

    private static final Logger log = LoggerFactory.getLogger(AllocationPipelineService.class);

    private final TelemetryWindowingService windowingService;
    private final CostCorrelationService correlationService;
    private final CostAllocationService allocationService;
    private final AllocationEnrichmentService enrichmentService;
    private final Duration windowWidth;

    public AllocationPipelineService(
            TelemetryWindowingService windowingService,
            CostCorrelationService correlationService,
            CostAllocationService allocationService,
            AllocationEnrichmentService enrichmentService,
            FinopsProperties properties) {
        this.windowingService = windowingService;
        this.correlationService = correlationService;
        this.allocationService = allocationService;
        this.enrichmentService = enrichmentService;
        this.windowWidth = properties.correlation().windowWidth();
    }

    /**
     * 執行完整管線。
     *
     * @param rawTelemetry 原始遙測
     * @param costs 成本紀錄
     * @param method 分攤策略
     * @return 分攤結果；任一輸入為空或沒有關聯時為空結果
     */
    public AllocationResult run(List<TelemetryEventData> rawTelemetry, List<CostEvent> costs, AllocationMethod method) {
        NormalizedTelemetry normalized = windowingService.normalize(rawTelemetry);
        int malformed = normalized.malformedCount()
            + (int) costs.stream().filter(c -> c.usageTimestamp() == null).count();

        if (normalized.events().isEmpty() || costs.isEmpty()) {
            log.info("Pipeline produced no records: telemetry={}, costs={}", rawTelemetry.size(), costs.size());
            return AllocationResult.empty(method, rawTelemetry.size(), costs.size(), malformed);
        }

        List<TelemetryAggregate> aggregates = windowingService.aggregateTelemetry(normalized.events(), windowWidth);
        List<CorrelatedGroup> groups = correlationService.correlate(aggregates, costs, windowWidth);

        List<AllocatedRecord> records = new ArrayList<>();
        int violations = 0;
        for (CorrelatedGroup group : groups) {
            List<CostAllocation> allocations = allocationService.allocate(group, method);
            if (!allocationService.validateConservation(group, allocations)) {
                violations++;
            }
            for (CostAllocation allocation : allocations) {
                records.add(enrichmentService.enrich(allocation));
            }
        }

        AllocationResult result = new AllocationResult(
            List.copyOf(records), method, rawTelemetry.size(), costs.size(), malformed, groups.size(), violations);
        log.info("Pipeline completed: method={}, groups={}, records={}, allocated={}, malformed={}, violations={}",
            method.value(), groups.size(), records.size(), result.totalAllocatedCost(), malformed, violations);
        return result;
    }

    public Duration windowWidth() {
        return windowWidth;
    }
}
