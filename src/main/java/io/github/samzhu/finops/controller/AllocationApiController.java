package io.github.samzhu.finops.controller;

import java.time.LocalDate;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.finops.document.AllocatedCost;
import io.github.samzhu.finops.document.AllocationRun;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.api.AllocationListResponse;
import io.github.samzhu.finops.repository.AllocatedCostRepository;
import io.github.samzhu.finops.repository.AllocationRunRepository;
import io.github.samzhu.finops.service.AllocationSettlementService;

/**
 * 成本分攤 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code POST /api/v1/allocations/runs?method=} - 手動執行分攤</li>
 *   <li>{@code GET /api/v1/allocations/runs} - 最近 20 次執行紀錄</li>
 *   <li>{@code GET /api/v1/allocations?date=} - 某處理日期的分攤結果</li>
 * </ul>
 *
 * <p>日期參數使用 ISO 格式：{@code YYYY-MM-DD}
 */
@RestController
@RequestMapping("/api/v1/allocations")
public class AllocationApiController {

    private static final Logger log = LoggerFactory.getLogger(AllocationApiController.class);

    private final AllocationSettlementService settlementService;
    private final AllocationRunRepository runRepository;
    private final AllocatedCostRepository allocatedCostRepository;

    public AllocationApiController(AllocationSettlementService settlementService,
                                   AllocationRunRepository runRepository,
                                   AllocatedCostRepository allocatedCostRepository) {
        this.settlementService = settlementService;
        this.runRepository = runRepository;
        this.allocatedCostRepository = allocatedCostRepository;
    }

    /**
     * 手動執行分攤。
     *
     * @param method 分攤策略，省略時依設定
     * @return 執行紀錄
     */
    @PostMapping("/runs")
    public ResponseEntity<AllocationRun> triggerRun(@RequestParam(required = false) String method) {
        log.info("API request: triggerRun method={}", method);
        AllocationMethod override = method == null || method.isBlank() ? null : AllocationMethod.fromValue(method);
        return ResponseEntity.ok(settlementService.triggerRun(override));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<AllocationRun>> getRecentRuns() {
        log.debug("API request: getRecentRuns");
        return ResponseEntity.ok(runRepository.findTop20ByOrderByStartedAtDesc());
    }

    /**
     * 查詢某處理日期的分攤結果。
     *
     * @param date 處理日期
     * @return 分攤結果與總額
     */
    @GetMapping
    public ResponseEntity<AllocationListResponse> getAllocations(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        log.info("API request: getAllocations date={}", date);
        List<AllocatedCost> records = allocatedCostRepository.findByPartitionDateOrderByWindowStartAsc(date);
        String partitionPath = records.isEmpty() ? null : records.get(0).partitionPath();
        return ResponseEntity.ok(AllocationListResponse.of(date, partitionPath, records));
    }
}
