package com.wshg.productsearch.job;

import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobStatus;
import com.wshg.productsearch.repository.EmbeddingJobRepository;
import com.wshg.productsearch.service.ProductEmbeddingWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * 轮询 embedding_job 表，把到期的 PENDING 任务交给有界线程池执行。
 * 成功置 DONE；失败按 retryBackoff * 2^(attempts-1) 退避后重试，超过最大次数置 FAILED。
 * 执行实例异常退出遗留的 RUNNING 任务在租约过期后恢复为 PENDING（至少执行一次），
 * DONE / FAILED 任务超过保留时长后删除。
 */
@Slf4j
@Component
public class EmbeddingJobRunner {

    private static final int MAX_ERROR_LENGTH = 1024;

    private final EmbeddingJobRepository repository;
    private final ProductEmbeddingWorker worker;
    private final ProductSearchProperties props;
    private final TaskExecutor executor;

    public EmbeddingJobRunner(EmbeddingJobRepository repository,
                              ProductEmbeddingWorker worker,
                              ProductSearchProperties props,
                              @Qualifier("embeddingJobExecutor") TaskExecutor executor) {
        this.repository = repository;
        this.worker = worker;
        this.props = props;
        this.executor = executor;
    }

    /**
     * 只回收租约已过期的 RUNNING 任务，其他实例正在执行的任务不受影响。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedJobs() {
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(Math.max(1, props.getJobRunningLeaseMinutes())));
        int n = repository.updateStatusBefore(EmbeddingJobStatus.RUNNING, EmbeddingJobStatus.PENDING, cutoff);
        if (n > 0) log.warn("[任务队列] 回收租约过期的任务 {} 个", n);
    }

    public void purgeFinishedJobs() {
        long hours = props.getJobRetentionHours();
        if (hours <= 0) return;
        Instant cutoff = Instant.now().minus(Duration.ofHours(hours));
        long n = repository.deleteByStatusInAndUpdatedAtBefore(
                EnumSet.of(EmbeddingJobStatus.DONE, EmbeddingJobStatus.FAILED), cutoff);
        if (n > 0) log.info("[任务队列] 清理已结束的任务 {} 个，保留 {} 小时", n, hours);
    }

    @Scheduled(fixedDelayString = "${product-search.job-maintenance-interval-ms:300000}",
            initialDelayString = "${product-search.job-maintenance-interval-ms:300000}")
    public void maintain() {
        recoverInterruptedJobs();
        purgeFinishedJobs();
    }

    @Scheduled(fixedDelayString = "${product-search.job-poll-interval-ms:2000}")
    public void poll() {
        List<EmbeddingJob> due = repository.findByStatusAndNextAttemptAtLessThanEqualOrderByIdAsc(
                EmbeddingJobStatus.PENDING, Instant.now(), PageRequest.of(0, Math.max(1, props.getJobPollBatchSize())));
        for (EmbeddingJob job : due) {
            EmbeddingJob claimed = claim(job);
            if (claimed == null) continue;
            try {
                executor.execute(() -> run(claimed));
            } catch (TaskRejectedException e) {
                // 线程池已满，归还任务，下轮再取
                claimed.setStatus(EmbeddingJobStatus.PENDING);
                repository.save(claimed);
                log.debug("[任务队列] 线程池已满，本轮停止领取");
                break;
            }
        }
    }

    void run(EmbeddingJob job) {
        try {
            execute(job);
            job.setStatus(EmbeddingJobStatus.DONE);
            job.setLastError(null);
            log.debug("[任务队列] 完成 id={}, type={}, productId={}", job.getId(), job.getJobType(), job.getProductId());
        } catch (Exception e) {
            int attempts = job.getAttempts() + 1;
            job.setAttempts(attempts);
            job.setLastError(truncate(e.toString()));
            if (attempts >= props.getJobMaxAttempts()) {
                job.setStatus(EmbeddingJobStatus.FAILED);
                log.error("[任务队列] 任务失败且不再重试 id={}, type={}, productId={}, attempts={}",
                        job.getId(), job.getJobType(), job.getProductId(), attempts, e);
            } else {
                Duration delay = backoff(attempts);
                job.setStatus(EmbeddingJobStatus.PENDING);
                job.setNextAttemptAt(Instant.now().plus(delay));
                log.warn("[任务队列] 任务失败，{} 秒后重试 id={}, type={}, productId={}, attempts={}: {}",
                        delay.getSeconds(), job.getId(), job.getJobType(), job.getProductId(), attempts, e.getMessage());
            }
        }
        try {
            repository.save(job);
        } catch (ObjectOptimisticLockingFailureException e) {
            // 租约过期后任务已被回收，由下一次领取重新执行
            log.warn("[任务队列] 任务已被回收，本次结果不回写 id={}, type={}, productId={}, status={}",
                    job.getId(), job.getJobType(), job.getProductId(), job.getStatus());
        }
    }

    Duration backoff(int attempts) {
        long base = Math.max(1, props.getJobRetryBackoffSeconds());
        int exp = Math.min(Math.max(attempts - 1, 0), 20);
        return Duration.ofSeconds(base * (1L << exp));
    }

    private void execute(EmbeddingJob job) {
        switch (job.getJobType()) {
            case GENERATE:
                worker.generateEmbedding(job.getProductId());
                break;
            case DEACTIVATE:
                worker.deactivateEmbeddings(job.getProductId());
                break;
            case DELETE:
                worker.deleteEmbeddings(job.getProductId());
                break;
            case ACTIVATE:
                worker.activateEmbeddings(job.getProductId());
                break;
            default:
                throw new IllegalStateException("未知任务类型: " + job.getJobType());
        }
    }

    private EmbeddingJob claim(EmbeddingJob job) {
        job.setStatus(EmbeddingJobStatus.RUNNING);
        try {
            return repository.save(job);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.debug("[任务队列] 任务已被其他实例领取 id={}", job.getId());
            return null;
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
