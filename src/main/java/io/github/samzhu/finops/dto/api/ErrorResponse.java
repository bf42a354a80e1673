package io.github.samzhu.finops.dto.api;

import java.time.Instant;

/**
 * API 錯誤回應。
 *
 * @param status HTTP 狀態碼
 * @param error 錯誤代碼
 * @param message 說明
 * @param path 請求路徑
 * @param timestamp 發生時間
 */
public record ErrorResponse(
    int status,
    String error,
    String message,
    String path,
    Instant timestamp
) {}
