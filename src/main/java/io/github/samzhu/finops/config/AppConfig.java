package io.github.samzhu.finops.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link FinopsProperties} 的型別安全配置綁定，並提供：
 * <ul>
 *   <li>{@link Clock} - 所有「現在時間」的來源，方便測試固定時間</li>
 *   <li>帳單 API 專用的 {@link RestClient}</li>
 * </ul>
 *
 * @see FinopsProperties
 */
@Configuration
@EnableConfigurationProperties(FinopsProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 帳單 API 的 HTTP 客戶端，套用連線與讀取逾時。
     *
     * @param builder Spring Boot 自動配置的 builder
     * @param properties 服務配置
     * @return 指向 {@code finops.billing.base-url} 的 RestClient
     */
    @Bean
    public RestClient billingRestClient(RestClient.Builder builder, FinopsProperties properties) {
        FinopsProperties.BillingConfig billing = properties.billing();
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(billing.connectTimeout())
            .withReadTimeout(billing.readTimeout());
        return builder
            .baseUrl(billing.baseUrl())
            .requestFactory(ClientHttpRequestFactories.get(settings))
            .build();
    }
}
