package com.openforge.fleetcore.config;

import com.openforge.fleetcore.research.ResearchProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppConfigTest {

    @Test
    void researchExecutorIsBoundedByProperties() {
        ExecutorService executor = new AppConfig()
                .researchExecutor(new ResearchProperties(3, 30, 4, 16, 200, Duration.ofHours(1)));
        try {
            assertThat(executor).isInstanceOf(ThreadPoolExecutor.class);
            ThreadPoolExecutor pool = (ThreadPoolExecutor) executor;
            assertThat(pool.getMaximumPoolSize()).isEqualTo(4);
            assertThat(pool.getQueue().remainingCapacity()).isEqualTo(16);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void submissionsBeyondThreadsAndQueueAreRejected() throws Exception {
        ExecutorService executor = new AppConfig()
                .researchExecutor(new ResearchProperties(3, 30, 1, 1, 200, Duration.ofHours(1)));
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        try {
            executor.submit(blocker);
            executor.submit(blocker);

            assertThatThrownBy(() -> executor.submit(blocker))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
    }
}
