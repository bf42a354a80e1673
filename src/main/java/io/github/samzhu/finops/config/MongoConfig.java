package io.github.samzhu.finops.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code raw_telemetry_batches} - 緩衝後批次寫入的原始遙測</li>
 *   <li>{@code raw_cost_batches} - 每次執行取得的帳單資料 (稽核)</li>
 *   <li>{@code allocated_costs} - 分攤結果，依處理日期分區</li>
 *   <li>{@code allocation_runs} - 每次分攤執行的摘要</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.finops.repository")
@EnableMongoAuditing
public class MongoConfig {
}
