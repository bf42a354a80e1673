package io.github.samzhu.finops.service;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import com.tdunning.math.stats.TDigest;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.CorrelationSummary;
import io.github.samzhu.finops.dto.CorrelationSummary.EntityCost;
import io.github.samzhu.finops.dto.CorrelationSummary.ResponseTimeStats;

/**
 * 分攤結果摘要服務。
 *
 * <p>彙整一次執行的分攤紀錄：歸屬完整度、平均品質指標、
 * 依門市/模型/班別的成本分布、前 10 名裝置與門市，以及回應時間百分位。
 *
 * <p>回應時間使用 T-Digest 近似百分位，每筆紀錄的平均回應時間以呼叫數為權重加入。
 *
 * @see <a href="https://github.com/tdunning/t-digest">T-Digest GitHub</a>
 */
@Service
public class CorrelationSummaryService {

    private static final int TOP_N = 10;

    private final int compression;

    public CorrelationSummaryService(FinopsProperties properties) {
        this.compression = properties.latency().digestCompression();
    }

    /**
     * 建立摘要。
     *
     * @param records 分攤紀錄
     * @return 摘要，空輸入時為 {@link CorrelationSummary#empty()}
     */
    public CorrelationSummary summarize(List<AllocatedRecord> records) {
        if (records.isEmpty()) {
            return CorrelationSummary.empty();
        }

        int total = records.size();
        Set<String> devices = new HashSet<>();
        Set<String> stores = new HashSet<>();
        Set<String> combinations = new HashSet<>();
        int unknownDevices = 0;
        int unknownStores = 0;
        double confidence = 0.0;
        double accuracy = 0.0;
        double utilization = 0.0;
        double businessHours = 0.0;
        double offHours = 0.0;

        for (AllocatedRecord record : records) {
            devices.add(record.deviceId());
            stores.add(record.storeNumber());
            combinations.add(record.deviceStoreKey());
            if (record.unknownDevice()) {
                unknownDevices++;
            }
            if (record.unknownStore()) {
                unknownStores++;
            }
            confidence += record.confidence();
            accuracy += record.accuracy();
            utilization += record.utilization();
            if (record.businessHours()) {
                businessHours += record.allocatedCost();
            } else {
                offHours += record.allocatedCost();
            }
        }

        return new CorrelationSummary(
            total,
            records.stream().mapToDouble(AllocatedRecord::allocatedCost).sum(),
            devices.size(),
            stores.size(),
            combinations.size(),
            unknownDevices * 100.0 / total,
            unknownStores * 100.0 / total,
            confidence / total,
            accuracy / total,
            utilization / total,
            costBy(records, AllocatedRecord::storeNumber),
            costBy(records, AllocatedRecord::modelFamily),
            costBy(records, AllocatedRecord::shiftCategory),
            businessHours,
            offHours,
            topBy(records, AllocatedRecord::deviceId),
            topBy(records, AllocatedRecord::storeNumber),
            responseTime(records)
        );
    }

    ResponseTimeStats responseTime(List<AllocatedRecord> records) {
        TDigest digest = TDigest.createMergingDigest(compression);
        long calls = 0;
        double weightedSum = 0.0;
        for (AllocatedRecord record : records) {
            if (record.apiCalls() <= 0) {
                continue;
            }
            digest.add(record.avgResponseTimeMs(), (int) Math.min(record.apiCalls(), Integer.MAX_VALUE));
            calls += record.apiCalls();
            weightedSum += record.avgResponseTimeMs() * record.apiCalls();
        }
        if (calls == 0) {
            return ResponseTimeStats.empty();
        }
        return new ResponseTimeStats(
            calls,
            weightedSum / calls,
            digest.quantile(0.5),
            digest.quantile(0.95),
            digest.quantile(0.99));
    }

    private static List<EntityCost> costBy(List<AllocatedRecord> records, Function<AllocatedRecord, String> key) {
        Map<String, EntityCost> totals = new TreeMap<>();
        for (AllocatedRecord record : records) {
            totals.merge(key.apply(record),
                new EntityCost(key.apply(record), record.allocatedCost(), record.tokensUsed(), record.apiCalls(), 1),
                (a, b) -> new EntityCost(a.key(), a.allocatedCost() + b.allocatedCost(),
                    a.tokens() + b.tokens(), a.apiCalls() + b.apiCalls(), a.records() + b.records()));
        }
        return List.copyOf(totals.values());
    }

    private static List<EntityCost> topBy(List<AllocatedRecord> records, Function<AllocatedRecord, String> key) {
        return costBy(records, key).stream()
            .sorted(Comparator.comparingDouble(EntityCost::allocatedCost).reversed()
                .thenComparing(EntityCost::key))
            .limit(TOP_N)
            .toList();
    }
}
