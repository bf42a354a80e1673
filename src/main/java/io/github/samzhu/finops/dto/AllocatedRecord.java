package io.github.samzhu.finops.dto;

import java.time.Instant;

/**
 * 分攤結果，組合分攤本體 ({@link CostAllocation}) 與衍生的品質指標、時間特徵。
 *
 * <p>同一 (窗口, 資源) 下所有紀錄的 {@code allocatedCost} 加總應等於
 * {@code totalCost} (成本守恆)。
 *
 * <p>提供便利存取方法 (delegate to allocation)，讓呼叫端可直接使用
 * {@code record.deviceId()} 而非 {@code record.allocation().deviceId()}。
 *
 * @param allocation 分攤本體
 * @param unknownDevice 裝置是否未知
 * @param unknownStore 門市是否未知
 * @param completeAttribution 裝置與門市皆已知
 * @param costPerToken 每 token 成本，token 為 0 時為 0
 * @param costPerApiCall 每次呼叫成本，呼叫數為 0 時為 0
 * @param hour 窗口起點的小時 (UTC)
 * @param dayOfWeek 星期名稱，例如 {@code Monday}
 * @param businessHours 是否為營業時間 (9 到 17 時，含)
 * @param weekday 是否為平日
 * @param shiftCategory 班別：Morning、Evening、Night
 * @param confidence 歸屬信心度 [0, 1]
 * @param accuracy 分攤準確度 [0, 1]
 * @param utilization 使用率 [0, 1]
 */
public record AllocatedRecord(
    CostAllocation allocation,
    boolean unknownDevice,
    boolean unknownStore,
    boolean completeAttribution,
    double costPerToken,
    double costPerApiCall,
    int hour,
    String dayOfWeek,
    boolean businessHours,
    boolean weekday,
    String shiftCategory,
    double confidence,
    double accuracy,
    double utilization
) {
    // ===== 便利存取方法 (Convenience Accessors) =====

    public Instant windowStart() {
        return allocation.window().start();
    }

    public String resourceId() {
        return allocation.resourceId();
    }

    public String deviceId() {
        return allocation.deviceId();
    }

    public String storeNumber() {
        return allocation.storeNumber();
    }

    public double allocatedCost() {
        return allocation.allocatedCost();
    }

    public double totalCost() {
        return allocation.totalCost();
    }

    public AllocationMethod method() {
        return allocation.method();
    }

    public long tokensUsed() {
        return allocation.tokensUsed();
    }

    public long apiCalls() {
        return allocation.apiCalls();
    }

    public double avgResponseTimeMs() {
        return allocation.avgResponseTimeMs();
    }

    public String modelFamily() {
        return allocation.modelFamily();
    }

    public String deviceStoreKey() {
        return allocation.deviceId() + "_" + allocation.storeNumber();
    }
}
