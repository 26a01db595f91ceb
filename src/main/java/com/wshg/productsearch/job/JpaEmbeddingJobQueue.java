package com.wshg.productsearch.job;

import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.ServiceException;
import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobStatus;
import com.wshg.productsearch.entity.EmbeddingJobType;
import com.wshg.productsearch.repository.EmbeddingJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 embedding_job 表的任务队列，由 {@link EmbeddingJobRunner} 轮询执行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaEmbeddingJobQueue implements EmbeddingJobQueue {

    private final EmbeddingJobRepository repository;

    @Override
    public EmbeddingJob enqueue(EmbeddingJobType type, UUID productId) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(productId, "productId");
        EmbeddingJob job = EmbeddingJob.builder()
                .jobType(type)
                .productId(productId)
                .status(EmbeddingJobStatus.PENDING)
                .attempts(0)
                .nextAttemptAt(Instant.now())
                .build();
        try {
            EmbeddingJob saved = repository.save(job);
            log.debug("[任务队列] 入队 id={}, type={}, productId={}", saved.getId(), type, productId);
            return saved;
        } catch (DataAccessException e) {
            log.error("[任务队列] 入队失败 type={}, productId={}", type, productId, e);
            throw new ServiceException("任务入队失败: " + productId, e, ProductSearchErrorCode.JOB_ENQUEUE_FAILED);
        }
    }

    @Override
    public Optional<EmbeddingJob> find(Long jobId) {
        if (jobId == null) return Optional.empty();
        return repository.findById(jobId);
    }
}
