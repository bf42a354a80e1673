package io.github.samzhu.finops.collector;

import java.time.Instant;
import java.util.List;

import io.github.samzhu.finops.dto.CostEvent;

/**
 * 成本資料來源。
 *
 * <p>遇到限流 (HTTP 429) 時回傳空列表而非拋出例外，讓排程執行略過並在下次重試。
 * 權限錯誤拋出 {@link io.github.samzhu.finops.exception.SourceAccessDeniedException}。
 */
public interface CostSource {

    /**
     * 取得 {@code [from, to)} 期間依資源/日分組的成本紀錄。
     */
    List<CostEvent> fetch(Instant from, Instant to);
}
