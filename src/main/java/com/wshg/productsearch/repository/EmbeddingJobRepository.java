package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface EmbeddingJobRepository extends JpaRepository<EmbeddingJob, Long> {

    List<EmbeddingJob> findByStatusAndNextAttemptAtLessThanEqualOrderByIdAsc(EmbeddingJobStatus status,
                                                                            Instant now,
                                                                            Pageable pageable);

    /**
     * 把 updatedAt 早于 cutoff 的 from 状态任务改为 to，同时递增版本号，
     * 使仍在执行该任务的实例最终回写时触发乐观锁冲突。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update EmbeddingJob j set j.status = :to, j.version = j.version + 1 "
            + "where j.status = :from and j.updatedAt < :cutoff")
    int updateStatusBefore(@Param("from") EmbeddingJobStatus from,
                           @Param("to") EmbeddingJobStatus to,
                           @Param("cutoff") Instant cutoff);

    @Transactional
    long deleteByStatusInAndUpdatedAtBefore(Collection<EmbeddingJobStatus> statuses, Instant cutoff);

    long countByStatus(EmbeddingJobStatus status);
}
