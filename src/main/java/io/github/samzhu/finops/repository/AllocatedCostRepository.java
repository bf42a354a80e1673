package io.github.samzhu.finops.repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.finops.document.AllocatedCost;

/**
 * 分攤結果資料存取介面。
 *
 * <p>寫入由 {@link io.github.samzhu.finops.collector.MongoAllocationSink} 以 bulk upsert 執行。
 */
public interface AllocatedCostRepository extends MongoRepository<AllocatedCost, String> {

    /**
     * 查詢某處理日期分區的分攤結果。
     *
     * @param partitionDate 處理日期
     * @return 分攤結果，依窗口起點排序
     */
    List<AllocatedCost> findByPartitionDateOrderByWindowStartAsc(LocalDate partitionDate);

    /**
     * 查詢窗口起點不早於指定時間的分攤結果，供預測與外溢分析使用。
     *
     * @param from 起點 (含)
     * @return 分攤結果，依窗口起點排序
     */
    List<AllocatedCost> findByWindowStartGreaterThanEqualOrderByWindowStartAsc(Instant from);
}
