package io.github.samzhu.finops.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.StoreSpillover;
import io.github.samzhu.finops.dto.StoreSpillover.DevicePair;
import io.github.samzhu.finops.dto.StoreSpillover.Direction;
import io.github.samzhu.finops.util.StatisticsUtils;

/**
 * 門市內裝置間的成本外溢分析。
 *
 * <p>同一門市內兩台裝置的分攤成本序列 (依窗口排序) 高度相關時，
 * 可能表示成本歸屬互相影響。只有 |r| 超過 {@code spilloverThreshold} (預設 0.7) 的配對會回報，
 * 沒有配對的門市不出現在結果中。
 */
@Service
public class SpilloverAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(SpilloverAnalysisService.class);

    private final double threshold;

    public SpilloverAnalysisService(FinopsProperties properties) {
        this.threshold = properties.analytics().spilloverThreshold();
    }

    /**
     * 分析成本外溢。
     *
     * @param records 分攤紀錄
     * @return 有外溢配對的門市，依門市編號排序
     */
    public List<StoreSpillover> analyze(List<AllocatedRecord> records) {
        Map<String, List<AllocatedRecord>> byStore = new TreeMap<>();
        for (AllocatedRecord record : records) {
            byStore.computeIfAbsent(record.storeNumber(), k -> new ArrayList<>()).add(record);
        }

        List<StoreSpillover> results = new ArrayList<>();
        byStore.forEach((store, storeRecords) -> {
            StoreSpillover spillover = analyzeStore(store, storeRecords);
            if (spillover != null) {
                results.add(spillover);
            }
        });

        log.info("Spillover analysis: {} of {} stores with correlated devices", results.size(), byStore.size());
        return results;
    }

    private StoreSpillover analyzeStore(String store, List<AllocatedRecord> records) {
        Map<String, List<Double>> series = new LinkedHashMap<>();
        records.stream()
            .sorted(Comparator.comparing(AllocatedRecord::windowStart).thenComparing(AllocatedRecord::resourceId))
            .forEach(r -> series.computeIfAbsent(r.deviceId(), k -> new ArrayList<>()).add(r.allocatedCost()));

        if (series.size() < 2) {
            return null;
        }

        List<String> devices = new ArrayList<>(series.keySet());
        List<DevicePair> pairs = new ArrayList<>();
        for (int i = 0; i < devices.size(); i++) {
            for (int j = i + 1; j < devices.size(); j++) {
                List<Double> a = series.get(devices.get(i));
                List<Double> b = series.get(devices.get(j));
                if (a.size() < 2 || b.size() < 2) {
                    continue;
                }
                double r = StatisticsUtils.pearson(a, b);
                if (Math.abs(r) > threshold) {
                    pairs.add(new DevicePair(devices.get(i), devices.get(j), r,
                        r > 0 ? Direction.POSITIVE : Direction.NEGATIVE));
                }
            }
        }

        if (pairs.isEmpty()) {
            return null;
        }
        double total = records.stream().mapToDouble(AllocatedRecord::allocatedCost).sum();
        return new StoreSpillover(store, devices.size(), total, total / devices.size(), pairs);
    }
}
