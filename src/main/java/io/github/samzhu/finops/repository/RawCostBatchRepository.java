package io.github.samzhu.finops.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.finops.document.RawCostBatch;

/**
 * 帳單稽核批次資料存取介面。
 */
public interface RawCostBatchRepository extends MongoRepository<RawCostBatch, String> {

    List<RawCostBatch> findByRunId(String runId);
}
