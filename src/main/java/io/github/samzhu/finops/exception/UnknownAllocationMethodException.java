package io.github.samzhu.finops.exception;

/**
 * 未知分攤策略異常。
 *
 * <p>當設定檔或 API 參數指定了不存在的分攤策略時拋出。
 * 啟動時的設定錯誤會讓應用程式無法啟動，API 參數錯誤則回應 400。
 */
public class UnknownAllocationMethodException extends RuntimeException {

    private final String method;

    public UnknownAllocationMethodException(String method) {
        super(String.format("Unknown allocation method: '%s'. " +
            "Supported methods: proportional, equal, usage-based, token-based", method));
        this.method = method;
    }

    public String getMethod() {
        return method;
    }
}
