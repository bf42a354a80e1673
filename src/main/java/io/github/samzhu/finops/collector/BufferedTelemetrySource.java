package io.github.samzhu.finops.collector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import com.mongodb.MongoSecurityException;

import io.github.resilience4j.retry.Retry;
import io.github.samzhu.finops.document.RawTelemetryBatch;
import io.github.samzhu.finops.dto.TelemetryEventData;
import io.github.samzhu.finops.exception.SourceAccessDeniedException;
import io.github.samzhu.finops.repository.RawTelemetryBatchRepository;

/**
 * 從 {@code raw_telemetry_batches} 讀取遙測的資料來源。
 *
 * <p>遙測由 {@link io.github.samzhu.finops.function.TelemetryEventFunction} 接收後緩衝寫入，
 * 此來源依事件時間範圍查詢批次，並過濾出 {@code [from, to)} 內的事件。
 *
 * <p>訊息代理至少投遞一次，相同 (requestId, timeGenerated) 的事件只保留第一筆。
 */
@Component
public class BufferedTelemetrySource implements TelemetrySource {

    private static final Logger log = LoggerFactory.getLogger(BufferedTelemetrySource.class);

    private static final String SOURCE_NAME = "telemetry-store";

    private final RawTelemetryBatchRepository repository;
    private final Retry retry;

    public BufferedTelemetrySource(RawTelemetryBatchRepository repository, CollectorRetryFactory retryFactory) {
        this.repository = repository;
        this.retry = retryFactory.create(SOURCE_NAME, BufferedTelemetrySource::isTransient);
    }

    @Override
    public List<TelemetryEventData> fetch(Instant from, Instant to) {
        List<RawTelemetryBatch> batches;
        try {
            batches = Retry.decorateSupplier(retry, () -> repository
                .findByLatestEventTimeGreaterThanEqualAndEarliestEventTimeLessThanOrderByCreatedAtAsc(from, to))
                .get();
        } catch (PermissionDeniedDataAccessException | MongoSecurityException e) {
            throw new SourceAccessDeniedException(SOURCE_NAME, e.getMessage(), e);
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            log.error("Telemetry source unavailable, continuing with empty telemetry: {}", e.getMessage(), e);
            return List.of();
        }

        Set<String> seen = new HashSet<>();
        List<TelemetryEventData> events = new ArrayList<>();
        int duplicates = 0;
        for (RawTelemetryBatch batch : batches) {
            for (TelemetryEventData event : batch.events()) {
                if (event.timeGenerated() != null
                        && (event.timeGenerated().isBefore(from) || !event.timeGenerated().isBefore(to))) {
                    continue;
                }
                if (event.requestId() != null && !seen.add(event.requestId() + "|" + event.timeGenerated())) {
                    duplicates++;
                    continue;
                }
                events.add(event);
            }
        }

        log.info("Collected {} telemetry events from {} batches ({} duplicates dropped), period={} to {}",
            events.size(), batches.size(), duplicates, from, to);
        return events;
    }

    private static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException;
    }
}
