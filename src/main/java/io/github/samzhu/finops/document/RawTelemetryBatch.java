package io.github.samzhu.finops.document;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.finops.dto.TelemetryEventData;

/**
 * 批次原始遙測文件。
 *
 * <p>多筆遙測事件批次儲存為單一文件以減少寫入次數，同時保留原始資料供重算與稽核。
 * {@code earliestEventTime} 與 {@code latestEventTime} 讓遙測來源能以時間範圍查詢批次。
 *
 * <p>文件 ID 由 MongoDB 自動產生 (ObjectId)。
 */
@Document(collection = "raw_telemetry_batches")
public record RawTelemetryBatch(
    @Id String id,
    List<TelemetryEventData> events,
    int eventCount,
    Instant earliestEventTime,
    Instant latestEventTime,
    Instant createdAt
) {
    /**
     * 從事件列表建立新的批次文件。
     *
     * @param events 要批次儲存的遙測事件
     * @param now 建立時間
     * @return 新建立的批次
     * @throws IllegalArgumentException 如果事件列表為空
     */
    public static RawTelemetryBatch create(List<TelemetryEventData> events, Instant now) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Events list cannot be empty");
        }

        // 沒有時間的事件以建立時間代表批次範圍
        List<Instant> times = events.stream()
            .map(TelemetryEventData::timeGenerated)
            .filter(Objects::nonNull)
            .toList();
        Instant earliest = times.stream().min(Comparator.naturalOrder()).orElse(now);
        Instant latest = times.stream().max(Comparator.naturalOrder()).orElse(now);

        return new RawTelemetryBatch(null, List.copyOf(events), events.size(), earliest, latest, now);
    }
}
