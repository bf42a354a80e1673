package io.github.samzhu.finops.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.finops.document.RawTelemetryBatch;

/**
 * 批次原始遙測資料存取介面。
 *
 * <p>寫入由 {@link io.github.samzhu.finops.service.TelemetryBufferService} 在 flush 時執行；
 * 讀取由 {@link io.github.samzhu.finops.collector.BufferedTelemetrySource} 依時間範圍查詢。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface RawTelemetryBatchRepository extends MongoRepository<RawTelemetryBatch, String> {

    /**
     * 查詢事件時間範圍與 {@code [from, to)} 重疊的批次。
     *
     * @param from 起點 (含)，批次最晚事件須不早於此
     * @param to 終點 (不含)，批次最早事件須早於此
     * @return 批次列表，依建立時間升序
     */
    List<RawTelemetryBatch> findByLatestEventTimeGreaterThanEqualAndEarliestEventTimeLessThanOrderByCreatedAtAsc(
        Instant from, Instant to);
}
