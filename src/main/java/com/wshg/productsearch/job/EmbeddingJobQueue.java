package com.wshg.productsearch.job;

import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobType;

import java.util.Optional;
import java.util.UUID;

/**
 * 向量任务队列：持久化入队，至少执行一次，失败自动退避重试。
 */
public interface EmbeddingJobQueue {

    EmbeddingJob enqueue(EmbeddingJobType type, UUID productId);

    Optional<EmbeddingJob> find(Long jobId);
}
