package io.github.samzhu.finops.service;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

import org.springframework.stereotype.Service;

import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.CostAllocation;
import io.github.samzhu.finops.util.AttributionNormalizer;

/**
 * 分攤結果的品質指標與時間特徵。
 *
 * <p>信心度與準確度都是依序套用 (條件, 倍率) 的乘法調整，
 * 只在最後做上限裁切，因此順序不可變更：
 * <pre>
 * 信心度 (起始 1.0)             準確度 (起始為策略基準值)
 *   未知裝置        × 0.6         未知裝置  × 0.7
 *   未知門市        × 0.8         未知門市  × 0.9
 *   token = 0       × 0.5
 *   完整歸屬        × 1.1
 *   token > 100     × 1.05
 *   min(..., 1.0)
 * </pre>
 *
 * <p>時間特徵以窗口起點 (UTC) 計算：
 * <ul>
 *   <li>營業時間：9 到 17 時 (含)</li>
 *   <li>班別：Morning [6, 14)、Evening [14, 22)、其餘 Night</li>
 * </ul>
 *
 * <p>使用率為 {@code (min(calls/10, 1) + min(tokens/1000, 1)) / 2}。
 */
@Service
public class AllocationEnrichmentService {

    private static final List<Adjustment> CONFIDENCE_ADJUSTMENTS = List.of(
        new Adjustment(Attribution::unknownDevice, 0.6),
        new Adjustment(Attribution::unknownStore, 0.8),
        new Adjustment(a -> a.tokens() == 0, 0.5),
        new Adjustment(Attribution::complete, 1.1),
        new Adjustment(a -> a.tokens() > 100, 1.05)
    );

    private static final List<Adjustment> ACCURACY_ADJUSTMENTS = List.of(
        new Adjustment(Attribution::unknownDevice, 0.7),
        new Adjustment(Attribution::unknownStore, 0.9)
    );

    /**
     * 加上品質指標與時間特徵。
     *
     * @param allocation 分攤結果
     * @return 完整的分攤紀錄
     */
    public AllocatedRecord enrich(CostAllocation allocation) {
        boolean unknownDevice = AttributionNormalizer.isUnknown(allocation.deviceId());
        boolean unknownStore = AttributionNormalizer.isUnknown(allocation.storeNumber());
        Attribution attribution = new Attribution(unknownDevice, unknownStore, allocation.tokensUsed());

        ZonedDateTime windowStart = allocation.window().start().atZone(ZoneOffset.UTC);
        int hour = windowStart.getHour();
        DayOfWeek day = windowStart.getDayOfWeek();

        double confidence = Math.min(apply(CONFIDENCE_ADJUSTMENTS, attribution, 1.0), 1.0);
        double accuracy = apply(ACCURACY_ADJUSTMENTS, attribution,
            allocation.method().baseAccuracy(allocation.tokensUsed()));

        return new AllocatedRecord(
            allocation,
            unknownDevice,
            unknownStore,
            attribution.complete(),
            allocation.tokensUsed() > 0 ? allocation.allocatedCost() / allocation.tokensUsed() : 0.0,
            allocation.apiCalls() > 0 ? allocation.allocatedCost() / allocation.apiCalls() : 0.0,
            hour,
            day.getDisplayName(TextStyle.FULL, Locale.ENGLISH),
            hour >= 9 && hour <= 17,
            day.getValue() <= DayOfWeek.FRIDAY.getValue(),
            shiftOf(hour),
            confidence,
            accuracy,
            utilization(allocation.apiCalls(), allocation.tokensUsed())
        );
    }

    static String shiftOf(int hour) {
        if (hour >= 6 && hour < 14) {
            return "Morning";
        }
        if (hour >= 14 && hour < 22) {
            return "Evening";
        }
        return "Night";
    }

    static double utilization(long apiCalls, long tokens) {
        double callScore = Math.min(apiCalls / 10.0, 1.0);
        double tokenScore = Math.min(tokens / 1000.0, 1.0);
        return (callScore + tokenScore) / 2;
    }

    private static double apply(List<Adjustment> adjustments, Attribution attribution, double start) {
        double value = start;
        for (Adjustment adjustment : adjustments) {
            if (adjustment.applies().test(attribution)) {
                value *= adjustment.factor();
            }
        }
        return value;
    }

    private record Attribution(boolean unknownDevice, boolean unknownStore, long tokens) {
        boolean complete() {
            return !unknownDevice && !unknownStore;
        }
    }

    private record Adjustment(Predicate<Attribution> applies, double factor) {}
}
