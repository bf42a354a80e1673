package io.github.samzhu.finops.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.finops.document.AllocationRun;

/**
 * 分攤執行紀錄資料存取介面。
 */
public interface AllocationRunRepository extends MongoRepository<AllocationRun, String> {

    /**
     * 查詢最近 20 次執行。
     */
    List<AllocationRun> findTop20ByOrderByStartedAtDesc();
}
