package com.wshg.productsearch.service;

import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobType;
import com.wshg.productsearch.event.ProductChangeEvent;
import com.wshg.productsearch.job.EmbeddingJobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 监听商品变更事件，映射为一个向量任务并入队，不做其他阻塞 I/O。
 * <pre>
 * CREATED/UPDATED 且可上架 → GENERATE
 * CREATED/UPDATED 且不可上架 → DEACTIVATE
 * DELETED → DELETE
 * PUBLISHED → ACTIVATE
 * UNPUBLISHED → DEACTIVATE
 * BULK_REINDEX → GENERATE
 * </pre>
 */
@Slf4j
@Component
public class ProductChangeDispatcher {

    private final EmbeddingJobQueue jobQueue;
    private final boolean generationEnabled;

    public ProductChangeDispatcher(EmbeddingJobQueue jobQueue, ProductSearchProperties props) {
        this.jobQueue = jobQueue;
        this.generationEnabled = props.isEnableEmbeddingGeneration();
    }

    @EventListener
    public void onProductChanged(ProductChangeEvent event) {
        dispatch(event);
    }

    public Optional<EmbeddingJob> dispatch(ProductChangeEvent event) {
        if (!generationEnabled) {
            log.debug("[Dispatcher] 向量生成已关闭，忽略事件 {}", event != null ? event.getChangeType() : null);
            return Optional.empty();
        }
        if (event == null || event.getProductId() == null || event.getChangeType() == null) {
            log.warn("[Dispatcher] 事件缺少 productId 或 changeType，忽略: {}", event);
            return Optional.empty();
        }
        EmbeddingJobType jobType = resolveJobType(event);
        EmbeddingJob job = jobQueue.enqueue(jobType, event.getProductId());
        log.info("[Dispatcher] {} → {} productId={}, jobId={}",
                event.getChangeType(), jobType, event.getProductId(), job.getId());
        return Optional.of(job);
    }

    public static EmbeddingJobType resolveJobType(ProductChangeEvent event) {
        switch (event.getChangeType()) {
            case CREATED:
            case UPDATED:
                return event.isEligibleForEmbedding() ? EmbeddingJobType.GENERATE : EmbeddingJobType.DEACTIVATE;
            case DELETED:
                return EmbeddingJobType.DELETE;
            case PUBLISHED:
                return EmbeddingJobType.ACTIVATE;
            case UNPUBLISHED:
                return EmbeddingJobType.DEACTIVATE;
            case BULK_REINDEX:
                return EmbeddingJobType.GENERATE;
            default:
                throw new IllegalArgumentException("未知变更类型: " + event.getChangeType());
        }
    }
}
