package io.github.samzhu.finops.exception;

/**
 * 資料來源權限不足異常。
 *
 * <p>遙測或帳單來源回應 401/403 時拋出。此類錯誤需要人工處理
 * (例如補上角色授權)，不會重試，排程執行會記錄為失敗。
 */
public class SourceAccessDeniedException extends RuntimeException {

    private final String source;

    public SourceAccessDeniedException(String source, String detail, Throwable cause) {
        super(String.format("Access denied by %s: %s. Check the service identity permissions", source, detail), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
