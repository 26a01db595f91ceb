package com.wshg.productsearch.dto;

import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 批量重建结果：只统计入队数量，向量生成由后台任务完成。
 */
@Data
public class BulkReindexResult {
    private boolean success;
    private int totalProducts;
    private int jobsEnqueued;
    private Instant startedAt;
    private Instant completedAt;
    private List<String> errors = new ArrayList<>();

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) return 0;
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
