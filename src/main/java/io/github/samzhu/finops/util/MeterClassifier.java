package io.github.samzhu.finops.util;

import java.util.Locale;

/**
 * 依帳單計量名稱 (meter name) 分類成本。
 *
 * <p>範例：
 * <pre>
 * "gpt-4o Input Tokens"         → Input Tokens / GPT-4o
 * "GPT-35-turbo Output Tokens"  → Output Tokens / GPT-3.5-Turbo
 * "Provisioned Managed PTU"     → Provisioned Throughput / Unknown
 * </pre>
 */
public final class MeterClassifier {

    public static final String UNKNOWN = "Unknown";

    private MeterClassifier() {
        // 工具類不允許實例化
    }

    /**
     * 判斷成本類型。
     *
     * @param meterName 計量名稱，可為 null
     * @return Input Tokens、Output Tokens、Provisioned Throughput、Fine-tuning、Training 或 Unknown
     */
    public static String costType(String meterName) {
        String meter = lower(meterName);
        if (meter.contains("input") && meter.contains("token")) {
            return "Input Tokens";
        }
        if (meter.contains("output") && meter.contains("token")) {
            return "Output Tokens";
        }
        if (meter.contains("ptu") || meter.contains("provisioned")) {
            return "Provisioned Throughput";
        }
        if (meter.contains("fine-tuning")) {
            return "Fine-tuning";
        }
        if (meter.contains("training")) {
            return "Training";
        }
        return UNKNOWN;
    }

    /**
     * 判斷模型家族，較具體的名稱優先比對。
     *
     * @param meterName 計量名稱，可為 null
     * @return 模型家族名稱，無法辨識時為 Unknown
     */
    public static String modelFamily(String meterName) {
        String meter = lower(meterName);
        if (meter.contains("gpt-5")) {
            if (meter.contains("preview")) {
                return "GPT-5-Preview";
            }
            return meter.contains("turbo") ? "GPT-5-Turbo" : "GPT-5";
        }
        if (meter.contains("gpt-4")) {
            if (meter.contains("gpt-4o")) {
                return "GPT-4o";
            }
            return meter.contains("turbo") ? "GPT-4-Turbo" : "GPT-4";
        }
        if (meter.contains("gpt-3.5") || meter.contains("gpt-35")) {
            return "GPT-3.5-Turbo";
        }
        if (meter.contains("davinci")) {
            return "Davinci";
        }
        if (meter.contains("curie")) {
            return "Curie";
        }
        if (meter.contains("ada")) {
            return "Ada";
        }
        if (meter.contains("babbage")) {
            return "Babbage";
        }
        return UNKNOWN;
    }

    public static boolean isTokenBased(String meterName) {
        String type = costType(meterName);
        return "Input Tokens".equals(type) || "Output Tokens".equals(type);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
