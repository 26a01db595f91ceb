package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobStatus;
import com.wshg.productsearch.entity.EmbeddingJobType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class EmbeddingJobRepositoryTest {

    @Autowired
    private EmbeddingJobRepository repository;

    private EmbeddingJob save(EmbeddingJobStatus status) {
        return repository.saveAndFlush(EmbeddingJob.builder()
                .jobType(EmbeddingJobType.GENERATE)
                .productId(UUID.randomUUID())
                .status(status)
                .build());
    }

    @Test
    void deleteFinished_keepsOpenJobs() {
        save(EmbeddingJobStatus.DONE);
        save(EmbeddingJobStatus.FAILED);
        EmbeddingJob pending = save(EmbeddingJobStatus.PENDING);
        EmbeddingJob running = save(EmbeddingJobStatus.RUNNING);

        long deleted = repository.deleteByStatusInAndUpdatedAtBefore(
                EnumSet.of(EmbeddingJobStatus.DONE, EmbeddingJobStatus.FAILED), Instant.now().plusSeconds(60));

        assertEquals(2, deleted);
        assertEquals(2, repository.count());
        assertTrue(repository.findById(pending.getId()).isPresent());
        assertTrue(repository.findById(running.getId()).isPresent());
    }

    @Test
    void deleteFinished_respectsRetentionCutoff() {
        save(EmbeddingJobStatus.DONE);

        long deleted = repository.deleteByStatusInAndUpdatedAtBefore(
                EnumSet.of(EmbeddingJobStatus.DONE), Instant.now().minusSeconds(3600));

        assertEquals(0, deleted);
    }

    @Test
    void updateStatusBefore_leavesFreshLeasesAlone() {
        EmbeddingJob running = save(EmbeddingJobStatus.RUNNING);

        int n = repository.updateStatusBefore(EmbeddingJobStatus.RUNNING, EmbeddingJobStatus.PENDING,
                Instant.now().minusSeconds(60));

        assertEquals(0, n);
        assertEquals(EmbeddingJobStatus.RUNNING, repository.findById(running.getId()).orElseThrow().getStatus());
    }

    @Test
    void updateStatusBefore_reclaimsAndInvalidatesStaleCopies() {
        EmbeddingJob running = save(EmbeddingJobStatus.RUNNING);

        int n = repository.updateStatusBefore(EmbeddingJobStatus.RUNNING, EmbeddingJobStatus.PENDING,
                Instant.now().plusSeconds(60));

        assertEquals(1, n);
        EmbeddingJob reloaded = repository.findById(running.getId()).orElseThrow();
        assertEquals(EmbeddingJobStatus.PENDING, reloaded.getStatus());
        assertEquals(running.getVersion() + 1, reloaded.getVersion());

        // 原执行实例持有的旧副本回写时冲突
        running.setStatus(EmbeddingJobStatus.DONE);
        assertThrows(ObjectOptimisticLockingFailureException.class, () -> repository.saveAndFlush(running));
    }
}
