package io.github.samzhu.finops.dto;

import java.time.Duration;
import java.time.Instant;

/**
 * 固定寬度的時間窗口 {@code [start, start + width)}。
 *
 * <p>窗口身分為 {@code floor(epochMillis / width)}，同一寬度下相同時間點必定落在相同窗口，
 * 遙測與帳單兩邊因此可以精確比對。
 *
 * @param start 窗口起點 (UTC)
 * @param width 窗口寬度
 */
public record TimeWindow(Instant start, Duration width) {

    /**
     * 取得時間點所屬的窗口。
     *
     * @param timestamp 時間點
     * @param width 窗口寬度，必須為正
     * @return 包含該時間點的窗口
     */
    public static TimeWindow of(Instant timestamp, Duration width) {
        long widthMillis = width.toMillis();
        if (widthMillis <= 0) {
            throw new IllegalArgumentException("Window width must be positive: " + width);
        }
        long start = Math.floorDiv(timestamp.toEpochMilli(), widthMillis) * widthMillis;
        return new TimeWindow(Instant.ofEpochMilli(start), width);
    }

    public Instant end() {
        return start.plus(width);
    }

    public boolean contains(Instant timestamp) {
        return !timestamp.isBefore(start) && timestamp.isBefore(end());
    }
}
