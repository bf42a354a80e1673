package io.github.samzhu.finops.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import io.github.samzhu.finops.exception.UnknownAllocationMethodException;

/**
 * 成本分攤策略。
 *
 * <p>每個策略自帶分攤比例與退回規則，分攤服務只負責選擇策略：
 * <pre>
 * | 策略          | 比例      | 退回規則                       |
 * |---------------|-----------|--------------------------------|
 * | EQUAL         | 1/N       | -                              |
 * | PROPORTIONAL  | t_i / T   | T=0 或 t_i=0 時改用 1/N        |
 * | TOKEN_BASED   | t_i / T   | T=0 或 t_i=0 時改用 1/N        |
 * | USAGE_BASED   | c_i / C   | C=0 或 c_i=0 時改用 1/N        |
 * </pre>
 *
 * <p>退回規則以「成員」為單位判斷：同一群組內 token 為 0 的成員取 1/N，
 * 其他成員仍按比例，因此混合群組的分攤總和可能不等於群組成本，
 * 由 {@link io.github.samzhu.finops.service.CostAllocationService#validateConservation} 記錄。
 */
public enum AllocationMethod {

    EQUAL("equal", 0.70) {
        @Override
        public double share(long tokens, long calls, long totalTokens, long totalCalls, int members) {
            return 1.0 / members;
        }
    },

    PROPORTIONAL("proportional", 0.90) {
        @Override
        public double share(long tokens, long calls, long totalTokens, long totalCalls, int members) {
            return ratioOrEqual(tokens, totalTokens, members);
        }
    },

    USAGE_BASED("usage-based", 0.80) {
        @Override
        public double share(long tokens, long calls, long totalTokens, long totalCalls, int members) {
            return ratioOrEqual(calls, totalCalls, members);
        }
    },

    TOKEN_BASED("token-based", 0.95) {
        @Override
        public double share(long tokens, long calls, long totalTokens, long totalCalls, int members) {
            return ratioOrEqual(tokens, totalTokens, members);
        }

        @Override
        public double baseAccuracy(long tokens) {
            // 沒有 token 可依循時不套用策略基準
            return tokens > 0 ? super.baseAccuracy(tokens) : 1.0;
        }
    };

    private final String value;
    private final double accuracy;

    AllocationMethod(String value, double accuracy) {
        this.value = value;
        this.accuracy = accuracy;
    }

    /**
     * 計算單一成員應分得的比例。
     *
     * @param tokens 成員 token 數
     * @param calls 成員 API 呼叫數
     * @param totalTokens 群組 token 總數
     * @param totalCalls 群組呼叫總數
     * @param members 群組成員數 (必定大於 0)
     * @return 分攤比例
     */
    public abstract double share(long tokens, long calls, long totalTokens, long totalCalls, int members);

    /**
     * 策略的準確度基準值，尚未套用未知歸屬的懲罰。
     */
    public double baseAccuracy(long tokens) {
        return accuracy;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * 由設定值或 API 參數解析策略，忽略大小寫並接受底線寫法。
     *
     * @param value 例如 {@code usage-based}、{@code TOKEN_BASED}
     * @return 對應的策略
     * @throws UnknownAllocationMethodException 若無對應策略
     */
    @JsonCreator
    public static AllocationMethod fromValue(String value) {
        if (value != null) {
            String candidate = value.trim().toLowerCase().replace('_', '-');
            for (AllocationMethod method : values()) {
                if (method.value.equals(candidate)) {
                    return method;
                }
            }
        }
        throw new UnknownAllocationMethodException(value);
    }

    private static double ratioOrEqual(long part, long total, int members) {
        if (total > 0 && part > 0) {
            return (double) part / total;
        }
        return 1.0 / members;
    }
}
