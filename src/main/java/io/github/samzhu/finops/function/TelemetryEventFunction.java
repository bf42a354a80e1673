package io.github.samzhu.finops.function;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.finops.dto.TelemetryEventData;
import io.github.samzhu.finops.service.TelemetryBufferService;

/**
 * CloudEvents 遙測消費者函式配置。
 *
 * <p>API Gateway 對每次 AI 服務呼叫發出一個 CloudEvent，Spring Cloud Stream 解析後：
 * <ul>
 *   <li>CloudEvent attributes → Message Headers</li>
 *   <li>CloudEvent data → {@link TelemetryEventData}</li>
 * </ul>
 *
 * <p>payload 缺少 {@code requestId}、{@code timeGenerated} 或 {@code deviceId} 時，
 * 以 CloudEvent 的 id、time 與 subject 補齊。
 *
 * <p>Binding name: {@code telemetryEvent-in-0}
 *
 * @see <a href="https://spring.io/blog/2020/12/23/cloud-events-and-spring-part-2/">Cloud Events and Spring - part 2</a>
 */
@Configuration
public class TelemetryEventFunction {

    private static final Logger log = LoggerFactory.getLogger(TelemetryEventFunction.class);

    private final TelemetryBufferService bufferService;

    public TelemetryEventFunction(TelemetryBufferService bufferService) {
        this.bufferService = bufferService;
    }

    /**
     * 遙測事件消費者 Bean。
     *
     * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞迴圈。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<TelemetryEventData>> telemetryEvent() {
        return message -> {
            try {
                String eventId = CloudEventMessageUtils.getId(message);
                TelemetryEventData data = message.getPayload().withDefaults(
                    eventId, eventTime(message), CloudEventMessageUtils.getSubject(message));

                log.debug("CloudEvent received: id={}, type={}, source={}, deviceId={}",
                    eventId,
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    data.deviceId());

                bufferService.addEvent(data);
            } catch (Exception e) {
                log.error("Failed to process CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
            }
        };
    }

    /**
     * 讀取 {@code ce-time} (binary mode) 或 {@code ce_time} (部分 binder) header。
     */
    static Instant eventTime(Message<?> message) {
        Object value = message.getHeaders().get(CloudEventMessageUtils.TIME);
        if (value == null) {
            value = message.getHeaders().get("ce_time");
        }
        if (value instanceof OffsetDateTime time) {
            return time.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.toString()).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable CloudEvent time header: {}", value);
            return null;
        }
    }
}
