package io.github.samzhu.finops.collector;

/**
 * 分攤結果的持久化目的地。
 *
 * <p>每次執行只呼叫一次 {@link #write}；去重由實作負責。
 */
public interface AllocationSink {

    /**
     * 寫入一次執行的分攤結果與稽核資料。
     *
     * @param batch 執行的輸出
     * @return 寫入的分攤紀錄數
     */
    int write(AllocationBatch batch);
}
