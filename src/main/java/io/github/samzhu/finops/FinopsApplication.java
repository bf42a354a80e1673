package io.github.samzhu.finops;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * FinOps Service - 遙測與帳單關聯的成本分攤服務。
 *
 * <p>此服務將共用的雲端 AI 服務費用分攤到實際產生用量的裝置與門市：
 * <ul>
 *   <li>接收 CloudEvents 格式的 API 呼叫遙測 (token 數、回應時間)</li>
 *   <li>定時從帳單 API 取得計量成本</li>
 *   <li>以時間窗口與資源 ID 關聯兩條資料流</li>
 *   <li>依分攤策略將成本分配到 (裝置, 門市) 組合</li>
 *   <li>計算信心度、準確度、使用率等品質指標</li>
 *   <li>提供用量模式、異常偵測、預測分攤等分析 API</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Gateway (Publisher) → Pub/Sub → Telemetry Consumer → raw_telemetry_batches
 *                                                            ↓
 * Billing API ──────────────→ AllocationSettlementService (每 6 分鐘)
 *                                                            ↓
 *                                       allocated_costs  (分攤結果)
 *                                       raw_cost_batches (帳單稽核)
 *                                       allocation_runs  (執行紀錄)
 * </pre>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
@EnableScheduling
public class FinopsApplication {

    private static final Logger log = LoggerFactory.getLogger(FinopsApplication.class);

    public static void main(String[] args) {
        log.info("Starting FinOps Service - Telemetry Cost Allocation");
        SpringApplication.run(FinopsApplication.class, args);
    }
}
