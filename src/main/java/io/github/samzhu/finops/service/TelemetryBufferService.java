package io.github.samzhu.finops.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.document.RawTelemetryBatch;
import io.github.samzhu.finops.dto.TelemetryEventData;
import io.github.samzhu.finops.repository.RawTelemetryBatchRepository;

/**
 * 收到的遙測先留在記憶體，累積成 {@link RawTelemetryBatch} 再寫入 MongoDB。
 *
 * <p>寫入時機：累積滿 {@code finops.buffer.size} 筆、定時排程、分攤執行前
 * ({@link AllocationSettlementService}) 以及關閉時。
 *
 * <p>寫入失敗後事件留在緩衝區，之後只由定時排程重試，不再每收一筆就重寫一次；
 * 緩衝區最多保留 {@code size * 10} 筆，超出時丟棄最舊的事件。
 */
@Service
public class TelemetryBufferService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TelemetryBufferService.class);

    static final int MAX_BUFFERED_BATCHES = 10;

    private final RawTelemetryBatchRepository repository;
    private final Clock clock;
    private final List<TelemetryEventData> pending = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean storeUnavailable = new AtomicBoolean(false);

    private final int batchSize;
    private final int capacity;

    public TelemetryBufferService(
            RawTelemetryBatchRepository repository,
            FinopsProperties properties,
            Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.batchSize = properties.buffer().size();
        this.capacity = batchSize * MAX_BUFFERED_BATCHES;
    }

    public void addEvent(TelemetryEventData event) {
        pending.add(event);
        log.debug("Telemetry buffered: requestId={}, deviceId={}, bufferSize={}",
            event.requestId(), event.deviceId(), pending.size());

        if (pending.size() > capacity) {
            dropOldest();
        }
        if (pending.size() >= batchSize && !storeUnavailable.get()) {
            log.info("Buffer size reached {}, triggering flush", batchSize);
            flushBuffer();
        }
    }

    /**
     * 把目前緩衝的事件寫成一個批次。
     *
     * @return 寫入的事件數，失敗時為 0
     */
    public synchronized int flushBuffer() {
        if (pending.isEmpty()) {
            return 0;
        }

        List<TelemetryEventData> batch = new ArrayList<>(pending);
        pending.subList(0, batch.size()).clear();
        long startTime = System.currentTimeMillis();

        try {
            RawTelemetryBatch saved = repository.save(RawTelemetryBatch.create(batch, clock.instant()));
            if (storeUnavailable.compareAndSet(true, false)) {
                log.info("Telemetry store reachable again, size-triggered flushes resumed");
            }
            log.info("Flushed telemetry batch: id={}, events={}, took={}ms",
                saved.id(), batch.size(), System.currentTimeMillis() - startTime);
            return batch.size();
        } catch (Exception e) {
            storeUnavailable.set(true);
            log.error("Failed to flush {} telemetry events, keeping them for the next scheduled flush: {}",
                batch.size(), e.getMessage(), e);
            pending.addAll(0, batch);
            if (pending.size() > capacity) {
                dropOldest();
            }
            return 0;
        }
    }

    private synchronized void dropOldest() {
        int overflow = pending.size() - capacity;
        if (overflow <= 0) {
            return;
        }
        List<TelemetryEventData> dropped = new ArrayList<>(pending.subList(0, overflow));
        pending.subList(0, overflow).clear();
        log.warn("Telemetry buffer over capacity {}, dropped {} oldest events (first requestId={})",
            capacity, dropped.size(), dropped.get(0).requestId());
    }

    @Scheduled(fixedDelayString = "${finops.buffer.flush-interval-ms:5000}")
    public void scheduledFlush() {
        if (running.get()) {
            flushBuffer();
        }
    }

    @Override
    public void start() {
        running.set(true);
        log.info("Telemetry buffer started: batchSize={}, capacity={}", batchSize, capacity);
    }

    @Override
    public void stop() {
        running.set(false);
        int flushed = flushBuffer();
        log.info("Telemetry buffer stopped: flushed={}, left={}", flushed, pending.size());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    // 比 input binding (MAX_VALUE - 1000) 早啟動、晚停止
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 2000;
    }

    public int getBufferSize() {
        return pending.size();
    }
}
