package io.github.samzhu.finops.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.dto.NormalizedTelemetry;
import io.github.samzhu.finops.dto.TelemetryAggregate;
import io.github.samzhu.finops.dto.TelemetryEvent;
import io.github.samzhu.finops.dto.TelemetryEventData;
import io.github.samzhu.finops.dto.TimeWindow;
import io.github.samzhu.finops.util.AttributionNormalizer;

/**
 * 遙測正規化與時間窗口彙總服務。
 *
 * <p>處理流程：
 * <ol>
 *   <li>{@link #normalize} - 補齊裝置/門市、標準化資源 ID、解析數值欄位</li>
 *   <li>{@link #aggregateTelemetry} - 依 (窗口, 資源, 裝置, 門市) 加總 token、計數呼叫、平均回應時間</li>
 * </ol>
 *
 * <p>數值欄位無法解析時以 0 代替並計入 malformed，不會中斷整批處理。
 * 缺少時間的事件無法分配窗口，直接丟棄並計入 malformed。
 */
@Service
public class TelemetryWindowingService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryWindowingService.class);

    private static final Comparator<TelemetryAggregate> AGGREGATE_ORDER = Comparator
        .comparing((TelemetryAggregate a) -> a.window().start())
        .thenComparing(TelemetryAggregate::resourceId)
        .thenComparing(TelemetryAggregate::deviceId)
        .thenComparing(TelemetryAggregate::storeNumber);

    /**
     * 正規化原始遙測事件。
     *
     * @param rawEvents 傳輸格式的事件
     * @return 可用的事件與異常筆數
     */
    public NormalizedTelemetry normalize(List<TelemetryEventData> rawEvents) {
        List<TelemetryEvent> events = new ArrayList<>(rawEvents.size());
        int malformed = 0;

        for (TelemetryEventData raw : rawEvents) {
            if (raw == null || raw.timeGenerated() == null) {
                malformed++;
                continue;
            }

            boolean coerced = false;
            OptionalDouble tokens = AttributionNormalizer.parseNonNegative(raw.tokensUsed());
            OptionalDouble status = AttributionNormalizer.parseNonNegative(raw.statusCode());
            OptionalDouble responseTime = AttributionNormalizer.parseNonNegative(raw.responseTime());
            if (isPresent(raw.tokensUsed()) && tokens.isEmpty()) {
                coerced = true;
            }
            if (isPresent(raw.statusCode()) && status.isEmpty()) {
                coerced = true;
            }
            if (isPresent(raw.responseTime()) && responseTime.isEmpty()) {
                coerced = true;
            }
            if (coerced) {
                malformed++;
                log.debug("Coerced malformed telemetry fields: requestId={}, tokens='{}', status='{}', responseTime='{}'",
                    raw.requestId(), raw.tokensUsed(), raw.statusCode(), raw.responseTime());
            }

            events.add(new TelemetryEvent(
                raw.timeGenerated(),
                AttributionNormalizer.normalizeAttribute(raw.deviceId()),
                AttributionNormalizer.normalizeAttribute(raw.storeNumber()),
                AttributionNormalizer.normalizeResourceId(raw.resourceId()),
                (long) tokens.orElse(0),
                (int) status.orElse(0),
                responseTime.orElse(0)
            ));
        }

        if (malformed > 0) {
            log.warn("Telemetry normalization: {} of {} records malformed", malformed, rawEvents.size());
        }
        return new NormalizedTelemetry(events, malformed);
    }

    /**
     * 依 (窗口, 資源, 裝置, 門市) 彙總遙測。
     *
     * @param events 正規化後的事件
     * @param windowWidth 窗口寬度
     * @return 彙總結果，依窗口、資源、裝置、門市排序
     */
    public List<TelemetryAggregate> aggregateTelemetry(List<TelemetryEvent> events, Duration windowWidth) {
        Map<AggregateKey, Accumulator> groups = new LinkedHashMap<>();
        for (TelemetryEvent event : events) {
            AggregateKey key = new AggregateKey(
                TimeWindow.of(event.timestamp(), windowWidth),
                event.resourceId(),
                event.deviceId(),
                event.storeNumber());
            groups.computeIfAbsent(key, k -> new Accumulator()).add(event);
        }

        List<TelemetryAggregate> aggregates = new ArrayList<>(groups.size());
        groups.forEach((key, acc) -> aggregates.add(new TelemetryAggregate(
            key.window(),
            key.resourceId(),
            key.deviceId(),
            key.storeNumber(),
            acc.tokens,
            acc.calls,
            acc.calls > 0 ? acc.responseTimeSum / acc.calls : 0.0
        )));
        aggregates.sort(AGGREGATE_ORDER);

        log.debug("Aggregated {} telemetry events into {} groups (window={})",
            events.size(), aggregates.size(), windowWidth);
        return aggregates;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private record AggregateKey(TimeWindow window, String resourceId, String deviceId, String storeNumber) {}

    private static final class Accumulator {
        private long tokens;
        private long calls;
        private double responseTimeSum;

        void add(TelemetryEvent event) {
            tokens += event.tokensUsed();
            calls++;
            responseTimeSum += event.responseTimeMs();
        }
    }
}
