package io.github.samzhu.finops.collector;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.BulkOperations.BulkMode;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import com.mongodb.bulk.BulkWriteResult;

import io.github.resilience4j.retry.Retry;
import io.github.samzhu.finops.document.AllocatedCost;
import io.github.samzhu.finops.document.RawCostBatch;
import io.github.samzhu.finops.repository.RawCostBatchRepository;

/**
 * 將分攤結果寫入 {@code allocated_costs} 的 sink。
 *
 * <p>每筆分攤以 (窗口, 資源, 裝置, 門市) 為文件 ID，整批以一次 unordered bulk replace-upsert 寫入，
 * 同一期間重跑時覆寫舊值，不會重複計入。原始成本紀錄另存於 {@code raw_cost_batches} 供稽核。
 *
 * <p>暫時性錯誤依 {@link CollectorRetryFactory} 重試，重試耗盡則拋出例外，由呼叫端將執行標記為失敗。
 */
@Component
public class MongoAllocationSink implements AllocationSink {

    private static final Logger log = LoggerFactory.getLogger(MongoAllocationSink.class);

    private final MongoTemplate mongoTemplate;
    private final RawCostBatchRepository rawCostBatchRepository;
    private final Clock clock;
    private final Retry retry;

    public MongoAllocationSink(
            MongoTemplate mongoTemplate,
            RawCostBatchRepository rawCostBatchRepository,
            Clock clock,
            CollectorRetryFactory retryFactory) {
        this.mongoTemplate = mongoTemplate;
        this.rawCostBatchRepository = rawCostBatchRepository;
        this.clock = clock;
        this.retry = retryFactory.create("allocation-sink", MongoAllocationSink::isTransient);
    }

    @Override
    public int write(AllocationBatch batch) {
        long startTime = System.currentTimeMillis();
        Instant now = clock.instant();

        if (!batch.rawCosts().isEmpty()) {
            RawCostBatch rawBatch = RawCostBatch.create(
                batch.runId(), batch.rawCosts(), batch.periodStart(), batch.periodEnd(), now);
            Retry.decorateSupplier(retry, () -> rawCostBatchRepository.save(rawBatch)).get();
        }

        if (batch.records().isEmpty()) {
            log.info("No allocation records to write for run {}", batch.runId());
            return 0;
        }

        List<AllocatedCost> documents = batch.records().stream()
            .map(record -> AllocatedCost.from(record, batch.partitionDate(), batch.runId(), now))
            .toList();

        BulkWriteResult result = Retry.decorateSupplier(retry, () -> upsertAll(documents)).get();

        long duration = System.currentTimeMillis() - startTime;
        log.info("Allocation write completed: run={}, partition={}, records={}, inserted={}, replaced={} in {}ms",
            batch.runId(), documents.get(0).partitionPath(), documents.size(),
            result.getUpserts().size(), result.getModifiedCount(), duration);
        return documents.size();
    }

    private BulkWriteResult upsertAll(List<AllocatedCost> documents) {
        BulkOperations bulkOps = mongoTemplate.bulkOps(BulkMode.UNORDERED, AllocatedCost.class);
        for (AllocatedCost document : documents) {
            Query query = Query.query(Criteria.where("_id").is(document.id()));
            bulkOps.replaceOne(query, document, FindAndReplaceOptions.options().upsert());
        }
        return bulkOps.execute();
    }

    private static boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException || e instanceof DataAccessResourceFailureException;
    }
}
