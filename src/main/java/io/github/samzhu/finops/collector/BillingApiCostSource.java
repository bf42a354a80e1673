package io.github.samzhu.finops.collector;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import io.github.resilience4j.retry.Retry;
import io.github.samzhu.finops.config.FinopsProperties;
import io.github.samzhu.finops.dto.CostEvent;
import io.github.samzhu.finops.exception.SourceAccessDeniedException;

/**
 * 透過帳單查詢 API 取得成本的資料來源。
 *
 * <p>查詢以資源、資源類型、服務名稱、計量名稱分組，日粒度加總成本與用量。
 * API 回應為欄位/列格式：
 * <pre>
 * {
 *   "columns": [{"name": "totalCost"}, {"name": "usageQuantity"}, {"name": "UsageDate"},
 *               {"name": "ResourceId"}, {"name": "ServiceName"}, {"name": "Meter"}, {"name": "Currency"}],
 *   "rows": [[12.5, 41000, 20250115, "/subscriptions/.../accounts/store-ai", "Azure OpenAI",
 *             "gpt-4o Input Tokens", "USD"]]
 * }
 * </pre>
 *
 * <p>錯誤處理：
 * <ul>
 *   <li>5xx 與連線錯誤：指數退避重試，仍失敗則回傳空列表</li>
 *   <li>429 限流：不重試，回傳空列表，下次排程再取</li>
 *   <li>401/403：拋出 {@link SourceAccessDeniedException}</li>
 *   <li>無法解析的列：略過並記錄</li>
 * </ul>
 */
@Component
public class BillingApiCostSource implements CostSource {

    private static final Logger log = LoggerFactory.getLogger(BillingApiCostSource.class);

    private static final String SOURCE_NAME = "billing-api";
    private static final List<String> SERVICE_NAMES = List.of("Azure OpenAI", "Cognitive Services");
    private static final List<String> GROUPING = List.of("ResourceId", "ResourceType", "ServiceName", "Meter");
    private static final DateTimeFormatter COMPACT_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final RestClient restClient;
    private final String scope;
    private final Retry retry;
    private final int maxAttempts;

    public BillingApiCostSource(
            @Qualifier("billingRestClient") RestClient restClient,
            FinopsProperties properties,
            CollectorRetryFactory retryFactory) {
        this.restClient = restClient;
        this.scope = properties.billing().scope();
        this.retry = retryFactory.create(SOURCE_NAME, BillingApiCostSource::isTransient);
        this.maxAttempts = retryFactory.maxAttempts();
    }

    @Override
    public List<CostEvent> fetch(Instant from, Instant to) {
        log.info("Starting cost data collection: period={} to {}", from, to);
        QueryResponse response;
        try {
            response = Retry.decorateSupplier(retry, () -> query(from, to)).get();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.TOO_MANY_REQUESTS)) {
                log.warn("Billing API rate limit hit (429), skipping cost collection, retry next run");
                return List.of();
            }
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
                    || e.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                throw new SourceAccessDeniedException(SOURCE_NAME, e.getStatusCode().toString(), e);
            }
            log.error("HTTP error collecting cost data: status={}, body={}",
                e.getStatusCode(), e.getResponseBodyAsString(), e);
            return List.of();
        } catch (RestClientException e) {
            log.error("Billing API unavailable after {} attempts, continuing with empty cost data: {}",
                maxAttempts, e.getMessage(), e);
            return List.of();
        }

        List<CostEvent> costs = parse(response);
        log.info("Collected {} cost records", costs.size());
        return costs;
    }

    private QueryResponse query(Instant from, Instant to) {
        QueryRequest request = new QueryRequest(scope, from, to, "Daily", GROUPING, SERVICE_NAMES);
        return restClient.post()
            .uri("/cost/query")
            .contentType(MediaType.APPLICATION_JSON)
            .body(request)
            .retrieve()
            .body(QueryResponse.class);
    }

    List<CostEvent> parse(QueryResponse response) {
        if (response == null || response.rows() == null || response.rows().isEmpty()) {
            log.warn("No cost data returned from query");
            return List.of();
        }

        Map<String, Integer> index = new HashMap<>();
        if (response.columns() != null) {
            for (int i = 0; i < response.columns().size(); i++) {
                index.put(response.columns().get(i).name(), i);
            }
        }

        List<CostEvent> costs = new ArrayList<>(response.rows().size());
        for (List<Object> row : response.rows()) {
            try {
                costs.add(toCostEvent(row, index));
            } catch (RuntimeException e) {
                log.warn("Skipping unparseable cost row {}: {}", row, e.getMessage());
            }
        }
        return costs;
    }

    private static CostEvent toCostEvent(List<Object> row, Map<String, Integer> index) {
        Object cost = value(row, index, "totalCost");
        if (cost == null) {
            cost = value(row, index, "PreTaxCost");
        }
        return new CostEvent(
            text(value(row, index, "ResourceId")),
            usageDate(value(row, index, "UsageDate")),
            number(cost),
            number(value(row, index, "usageQuantity")),
            text(value(row, index, "Currency")),
            text(value(row, index, "Meter")),
            text(value(row, index, "ServiceName"))
        );
    }

    private static Object value(List<Object> row, Map<String, Integer> index, String column) {
        Integer i = index.get(column);
        return i != null && i < row.size() ? row.get(i) : null;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static double number(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(value.toString().trim());
    }

    /**
     * 帳單日期可能為 {@code 20250115}、{@code 2025-01-15} 或完整時間戳記。
     */
    static Instant usageDate(Object value) {
        if (value == null) {
            return null;
        }
        String text = value instanceof Number n ? Long.toString(n.longValue()) : value.toString().trim();
        try {
            if (text.length() == 8) {
                return LocalDate.parse(text, COMPACT_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unsupported usage date: " + text, e);
        }
    }

    private static boolean isTransient(Throwable e) {
        return e instanceof HttpServerErrorException || e instanceof ResourceAccessException;
    }

    /**
     * 帳單查詢請求。
     */
    public record QueryRequest(
        String scope,
        Instant from,
        Instant to,
        String granularity,
        List<String> groupBy,
        List<String> serviceNames
    ) {}

    /**
     * 帳單查詢回應。
     */
    public record QueryResponse(
        List<Column> columns,
        List<List<Object>> rows
    ) {}

    public record Column(String name, String type) {}
}
