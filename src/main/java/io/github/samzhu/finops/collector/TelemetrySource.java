package io.github.samzhu.finops.collector;

import java.time.Instant;
import java.util.List;

import io.github.samzhu.finops.dto.TelemetryEventData;

/**
 * 遙測資料來源。
 *
 * <p>實作須遵守：
 * <ul>
 *   <li>部分結果可以回傳 (記錄即可)</li>
 *   <li>權限錯誤拋出 {@link io.github.samzhu.finops.exception.SourceAccessDeniedException}</li>
 *   <li>暫時性錯誤以指數退避重試有限次數，仍失敗則回傳空列表</li>
 * </ul>
 */
public interface TelemetrySource {

    /**
     * 取得 {@code [from, to)} 期間的遙測事件。
     */
    List<TelemetryEventData> fetch(Instant from, Instant to);
}
