package io.github.samzhu.finops.document;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.finops.dto.AllocatedRecord;
import io.github.samzhu.finops.dto.AllocationMethod;
import io.github.samzhu.finops.dto.CostAllocation;
import io.github.samzhu.finops.dto.TimeWindow;

/**
 * 分攤結果文件。
 *
 * <p>文件 ID 格式：{@code {windowStart}_{resourceId}_{deviceId}_{storeNumber}}，
 * 同一窗口重複執行時覆寫而非重複寫入。
 *
 * <p>{@code partitionDate} 為處理日期，查詢與保存期限都以此分區。
 */
@Document(collection = "allocated_costs")
public record AllocatedCost(
    @Id String id,
    @Indexed LocalDate partitionDate,
    String runId,

    // === 歸屬鍵 ===
    Instant windowStart,
    long windowMinutes,
    String resourceId,
    String deviceId,
    String storeNumber,

    // === 分攤 ===
    double allocatedCost,
    double totalCost,
    String allocationMethod,
    long tokensUsed,
    long apiCalls,
    double avgResponseTimeMs,
    double tokenShare,
    double apiCallShare,
    String costType,
    String modelFamily,
    String meterName,
    String currency,

    // === 品質指標 ===
    boolean unknownDevice,
    boolean unknownStore,
    boolean completeAttribution,
    double costPerToken,
    double costPerApiCall,
    double confidence,
    double accuracy,
    double utilization,

    // === 時間特徵 ===
    int hour,
    String dayOfWeek,
    boolean businessHours,
    boolean weekday,
    String shiftCategory,

    Instant createdAt
) {
    private static final DateTimeFormatter PARTITION_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    /**
     * 由分攤紀錄建立文件。
     *
     * @param record 分攤紀錄
     * @param partitionDate 處理日期
     * @param runId 執行 ID
     * @param now 建立時間
     * @return 文件
     */
    public static AllocatedCost from(AllocatedRecord record, LocalDate partitionDate, String runId, Instant now) {
        CostAllocation a = record.allocation();
        return new AllocatedCost(
            createId(a.window().start(), a.resourceId(), a.deviceId(), a.storeNumber()),
            partitionDate,
            runId,
            a.window().start(),
            a.window().width().toMinutes(),
            a.resourceId(),
            a.deviceId(),
            a.storeNumber(),
            a.allocatedCost(),
            a.totalCost(),
            a.method().value(),
            a.tokensUsed(),
            a.apiCalls(),
            a.avgResponseTimeMs(),
            a.tokenShare(),
            a.apiCallShare(),
            a.costType(),
            a.modelFamily(),
            a.meterName(),
            a.currency(),
            record.unknownDevice(),
            record.unknownStore(),
            record.completeAttribution(),
            record.costPerToken(),
            record.costPerApiCall(),
            record.confidence(),
            record.accuracy(),
            record.utilization(),
            record.hour(),
            record.dayOfWeek(),
            record.businessHours(),
            record.weekday(),
            record.shiftCategory(),
            now
        );
    }

    /**
     * 還原為分攤紀錄，供分析服務使用。
     */
    public AllocatedRecord toRecord() {
        CostAllocation allocation = new CostAllocation(
            new TimeWindow(windowStart, Duration.ofMinutes(windowMinutes)),
            resourceId,
            deviceId,
            storeNumber,
            allocatedCost,
            totalCost,
            AllocationMethod.fromValue(allocationMethod),
            tokensUsed,
            apiCalls,
            avgResponseTimeMs,
            tokenShare,
            apiCallShare,
            costType,
            modelFamily,
            meterName,
            currency
        );
        return new AllocatedRecord(allocation, unknownDevice, unknownStore, completeAttribution,
            costPerToken, costPerApiCall, hour, dayOfWeek, businessHours, weekday, shiftCategory,
            confidence, accuracy, utilization);
    }

    /**
     * 分區路徑，例如 {@code 2025/01/15}。
     */
    public String partitionPath() {
        return partitionDate.format(PARTITION_PATH);
    }

    public static String createId(Instant windowStart, String resourceId, String deviceId, String storeNumber) {
        return windowStart.toString() + "_" + resourceId + "_" + deviceId + "_" + storeNumber;
    }
}
