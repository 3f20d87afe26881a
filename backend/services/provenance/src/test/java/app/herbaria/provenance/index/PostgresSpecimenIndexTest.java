package app.herbaria.provenance.index;

import app.herbaria.provenance.domain.model.AttemptDraft;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.exception.AttemptConflictException;
import app.herbaria.provenance.support.PostgresContainers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@ActiveProfiles("test")
class PostgresSpecimenIndexTest extends SpecimenIndexContractTest {

    @Container
    private static final PostgreSQLContainer<?> postgres = PostgresContainers.create();

    @DynamicPropertySource
    static void dataSourceProps(DynamicPropertyRegistry registry) {
        PostgresContainers.register(registry, postgres);
    }

    @Autowired
    PostgresSpecimenIndex index;

    @Override
    protected SpecimenIndex index() {
        return index;
    }

    @Test
    void completeAttempt_concurrentWorkersProduceOneCanonicalAttempt() throws Exception {
        String identity = registered();
        AttemptDraft draft = draft(identity, "v3", false);
        int workers = 8;
        List<ExtractionAttempt> pending = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            pending.add(index.openAttempt(draft));
        }

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<Future<ExtractionAttempt>> results = new ArrayList<>();
        try {
            for (ExtractionAttempt attempt : pending) {
                Callable<ExtractionAttempt> task = () -> {
                    start.await();
                    return index.completeAttempt(attempt.attemptId(), completed("ASU-1073"));
                };
                results.add(pool.submit(task));
            }
            start.countDown();

            int winners = 0;
            List<UUID> reportedCanonical = new ArrayList<>();
            UUID winner = null;
            for (Future<ExtractionAttempt> result : results) {
                try {
                    winner = result.get(30, TimeUnit.SECONDS).attemptId();
                    winners++;
                } catch (ExecutionException ex) {
                    assertThat(ex.getCause()).isInstanceOf(AttemptConflictException.class);
                    reportedCanonical.add(((AttemptConflictException) ex.getCause()).getCanonicalAttemptId());
                }
            }

            assertThat(winners).isEqualTo(1);
            assertThat(reportedCanonical).hasSize(workers - 1).containsOnly(winner);
        } finally {
            pool.shutdownNow();
        }

        assertThat(index.findAttempts(identity))
                .filteredOn(attempt -> attempt.status() == AttemptStatus.complete)
                .hasSize(1);
    }

    @Test
    void recordAttempt_concurrentWorkersProduceOneCanonicalAttempt() throws Exception {
        String identity = registered();
        AttemptDraft draft = draft(identity, "v3", false);
        int workers = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        index.recordAttempt(draft, completed("ASU-1073"));
                        return true;
                    } catch (AttemptConflictException ex) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
        assertThat(index.shouldExtract(identity, draft.paramsHash(), false).extract()).isFalse();
    }
}
