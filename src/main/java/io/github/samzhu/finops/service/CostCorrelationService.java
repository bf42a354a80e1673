package io.github.samzhu.finops.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.dto.CorrelatedGroup;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.dto.TelemetryAggregate;
import io.github.samzhu.finops.dto.TimeWindow;
import io.github.samzhu.finops.util.AttributionNormalizer;

/**
 * 遙測與成本的關聯服務。
 *
 * <p>以 (窗口, 標準化資源) 做精確的 inner join，不做最近窗口的模糊比對。
 * 兩邊都以相同寬度取窗口，因此窗口不一致時正常地產生零筆關聯。
 *
 * <p>同一 (窗口, 資源) 有多筆成本時加總為單一群組成本，計量資訊取第一筆。
 */
@Service
public class CostCorrelationService {

    private static final Logger log = LoggerFactory.getLogger(CostCorrelationService.class);

    /**
     * 關聯遙測彙總與成本紀錄。
     *
     * @param aggregates 遙測彙總
     * @param costs 成本紀錄
     * @param windowWidth 窗口寬度，須與遙測彙總使用的相同
     * @return 關聯群組，依窗口與資源排序；任一輸入為空時為空
     */
    public List<CorrelatedGroup> correlate(List<TelemetryAggregate> aggregates, List<CostEvent> costs,
                                           Duration windowWidth) {
        if (aggregates.isEmpty() || costs.isEmpty()) {
            log.debug("Correlation skipped: telemetryGroups={}, costRecords={}", aggregates.size(), costs.size());
            return List.of();
        }

        Map<GroupKey, CostEvent> windowedCosts = windowCosts(costs, windowWidth);

        Map<GroupKey, List<TelemetryAggregate>> members = new LinkedHashMap<>();
        for (TelemetryAggregate aggregate : aggregates) {
            GroupKey key = new GroupKey(aggregate.window(), aggregate.resourceId());
            if (windowedCosts.containsKey(key)) {
                members.computeIfAbsent(key, k -> new ArrayList<>()).add(aggregate);
            }
        }

        List<CorrelatedGroup> groups = new ArrayList<>(members.size());
        members.forEach((key, list) -> groups.add(
            new CorrelatedGroup(key.window(), key.resourceId(), windowedCosts.get(key), List.copyOf(list))));
        groups.sort(Comparator
            .comparing((CorrelatedGroup g) -> g.window().start())
            .thenComparing(CorrelatedGroup::resourceId));

        if (groups.isEmpty()) {
            log.warn("No correlations found despite having both telemetry and cost data. "
                + "Check resource id and time window alignment: telemetryGroups={}, costRecords={}",
                aggregates.size(), costs.size());
        } else {
            log.info("Correlated {} window/resource groups from {} telemetry groups and {} cost records",
                groups.size(), aggregates.size(), costs.size());
        }
        return groups;
    }

    /**
     * 將成本紀錄放入時間窗口，同鍵多筆加總。
     */
    private Map<GroupKey, CostEvent> windowCosts(List<CostEvent> costs, Duration windowWidth) {
        Map<GroupKey, CostEvent> windowed = new LinkedHashMap<>();
        int skipped = 0;
        for (CostEvent cost : costs) {
            if (cost.usageTimestamp() == null) {
                skipped++;
                continue;
            }
            GroupKey key = new GroupKey(
                TimeWindow.of(cost.usageTimestamp(), windowWidth),
                AttributionNormalizer.normalizeResourceId(cost.resourceId()));
            windowed.merge(key, cost, CostCorrelationService::combine);
        }
        if (skipped > 0) {
            log.warn("Skipped {} cost records without usage timestamp", skipped);
        }
        return windowed;
    }

    private static CostEvent combine(CostEvent first, CostEvent second) {
        return new CostEvent(
            first.resourceId(),
            first.usageTimestamp(),
            first.cost() + second.cost(),
            first.usageQuantity() + second.usageQuantity(),
            first.currency(),
            first.meterName(),
            first.serviceName());
    }

    private record GroupKey(TimeWindow window, String resourceId) {}
}
