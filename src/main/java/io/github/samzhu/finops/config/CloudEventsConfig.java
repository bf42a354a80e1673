package io.github.samzhu.finops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>上游 Gateway 以 Structured Mode ({@code application/cloudevents+json}) 發送遙測事件。
 * 註冊 {@link CloudEventMessageConverter} 後，Spring Cloud Stream 會將 CloudEvent
 * attributes 放入 Message Headers，data 反序列化為
 * {@link io.github.samzhu.finops.dto.TelemetryEventData}。
 *
 * <p>JSON 序列化由 {@code cloudevents-json-jackson} 透過 ServiceLoader 提供。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
