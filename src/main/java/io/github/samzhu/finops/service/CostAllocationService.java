package io.github.samzhu.finops.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.CorrelatedGroup;
import io.github.samzhu.finops.dto.CostAllocation;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.TelemetryAggregate;

/**
 * 成本分攤服務。
 *
 * <p>將每個 (窗口, 資源) 群組的成本分配給群組內所有 (裝置, 門市) 組合：
 * <pre>
 * allocatedCost_i = share_i × groupTotalCost
 * </pre>
 * 比例 {@code share_i} 由 {@link AllocationMethod} 決定。
 *
 * <p>群組成本小於或等於 0 時，所有成員分得 0，不做任何除法。
 *
 * <p>成本守恆：分攤後群組內加總應等於群組成本 (相對誤差在 {@code conservationTolerance} 內)，
 * 違反時只記錄警告，不中斷執行。
 */
@Service
public class CostAllocationService {

    private static final Logger log = LoggerFactory.getLogger(CostAllocationService.class);

    private final double tolerance;

    public CostAllocationService(FinopsProperties properties) {
        this.tolerance = properties.correlation().conservationTolerance();
        log.info("CostAllocationService initialized: conservationTolerance={}", tolerance);
    }

    /**
     * 依策略分攤單一群組的成本。
     *
     * @param group 關聯群組
     * @param method 分攤策略
     * @return 每個成員一筆分攤結果
     */
    public List<CostAllocation> allocate(CorrelatedGroup group, AllocationMethod method) {
        List<TelemetryAggregate> members = group.members();
        if (members.isEmpty()) {
            return List.of();
        }

        CostEvent cost = group.cost();
        double totalCost = group.totalCost();
        long totalTokens = group.totalTokens();
        long totalCalls = group.totalApiCalls();
        int memberCount = members.size();

        List<CostAllocation> allocations = new ArrayList<>(memberCount);
        for (TelemetryAggregate member : members) {
            double allocated = 0.0;
            if (totalCost > 0) {
                double share = method.share(member.totalTokens(), member.apiCallCount(),
                    totalTokens, totalCalls, memberCount);
                allocated = share * totalCost;
            }

            allocations.add(new CostAllocation(
                group.window(),
                group.resourceId(),
                member.deviceId(),
                member.storeNumber(),
                allocated,
                totalCost,
                method,
                member.totalTokens(),
                member.apiCallCount(),
                member.avgResponseTimeMs(),
                totalTokens > 0 ? (double) member.totalTokens() / totalTokens : 0.0,
                totalCalls > 0 ? (double) member.apiCallCount() / totalCalls : 0.0,
                cost.costType(),
                cost.modelFamily(),
                cost.meterName(),
                cost.currency()
            ));
        }

        log.debug("Allocated group: window={}, resource={}, cost={}, members={}, method={}",
            group.window().start(), group.resourceId(), totalCost, memberCount, method.value());
        return allocations;
    }

    /**
     * 檢查群組分攤是否守恆。
     *
     * @param group 關聯群組
     * @param allocations 該群組的分攤結果
     * @return 守恆時為 true
     */
    public boolean validateConservation(CorrelatedGroup group, List<CostAllocation> allocations) {
        double original = group.totalCost();
        double allocated = allocations.stream().mapToDouble(CostAllocation::allocatedCost).sum();

        boolean valid;
        if (original <= 0) {
            valid = allocated == 0.0;
        } else {
            valid = Math.abs(allocated - original) / original <= tolerance;
        }

        if (!valid) {
            log.warn("Cost conservation violated: window={}, resource={}, original={}, allocated={}, tolerance={}",
                group.window().start(), group.resourceId(), original, allocated, tolerance);
        }
        return valid;
    }
}
