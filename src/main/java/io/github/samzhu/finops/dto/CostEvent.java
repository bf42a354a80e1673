package io.github.samzhu.finops.dto;

import java.time.Instant;

import io.github.samzhu.finops.util.MeterClassifier;

/**
 * 帳單來源的計量成本紀錄。
 *
 * <p>{@code resourceId} 保留原始資源路徑，關聯時才轉為標準短名稱。
 *
 * @param resourceId 原始資源路徑
 * @param usageTimestamp 計量時間 (通常為日粒度)
 * @param cost 成本，非負
 * @param usageQuantity 用量，非負
 * @param currency 幣別
 * @param meterName 計量名稱
 * @param serviceName 服務名稱
 */
public record CostEvent(
    String resourceId,
    Instant usageTimestamp,
    double cost,
    double usageQuantity,
    String currency,
    String meterName,
    String serviceName
) {
    public CostEvent {
        if (currency == null || currency.isBlank()) {
            currency = "USD";
        }
        if (meterName == null || meterName.isBlank()) {
            meterName = MeterClassifier.UNKNOWN;
        }
    }

    public String costType() {
        return MeterClassifier.costType(meterName);
    }

    public String modelFamily() {
        return MeterClassifier.modelFamily(meterName);
    }

    public double costPerUnit() {
        return usageQuantity > 0 ? cost / usageQuantity : 0.0;
    }

    public String subscriptionId() {
        return segmentAfter("subscriptions");
    }

    public String resourceGroup() {
        return segmentAfter("resourceGroups");
    }

    /**
     * 資源路徑的最後一段，不轉小寫。
     */
    public String resourceName() {
        if (resourceId == null || resourceId.isEmpty()) {
            return "";
        }
        String[] parts = resourceId.split("/");
        return parts.length == 0 ? "" : parts[parts.length - 1];
    }

    private String segmentAfter(String key) {
        if (resourceId == null) {
            return "";
        }
        String[] parts = resourceId.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (parts[i].equalsIgnoreCase(key)) {
                return parts[i + 1];
            }
        }
        return "";
    }
}
