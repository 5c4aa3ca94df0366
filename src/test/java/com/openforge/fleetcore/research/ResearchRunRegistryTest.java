package com.openforge.fleetcore.research;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchRunRegistryTest {

    private static ResearchProperties props(int maxRetainedRuns, Duration retention) {
        return new ResearchProperties(3, 30, 8, 32, maxRetainedRuns, retention);
    }

    private static List<ResearchRun> runSequentially(ResearchRunRegistry registry, String sessionId, int count) {
        List<ResearchRun> runs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ResearchRun run = registry.register(new ResearchRun(sessionId, "q" + i, "Ever Given", ""));
            run.complete("Iteration cap reached");
            runs.add(run);
        }
        return runs;
    }

    // ── Count cap ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("max retained runs")
    class CountCap {

        @Test
        @DisplayName("oldest finished runs are dropped once the cap is exceeded")
        void oldestDropped() {
            ResearchRunRegistry registry = new ResearchRunRegistry(props(3, Duration.ofHours(1)));

            List<ResearchRun> runs = runSequentially(registry, "s1", 10);

            assertThat(registry.find(runs.get(0).getRunId())).isEmpty();
            assertThat(registry.find(runs.get(5).getRunId())).isEmpty();
            assertThat(registry.find(runs.get(9).getRunId())).containsSame(runs.get(9));
            // three kept from the last prune plus the run registered after it
            assertThat(registry.size()).isEqualTo(4);
        }

        @Test
        @DisplayName("a thousand finished runs do not accumulate under the default cap")
        void defaultCapBoundsGrowth() {
            ResearchRunRegistry registry = new ResearchRunRegistry(ResearchProperties.of(3, 30));

            List<ResearchRun> runs = runSequentially(registry, "s1", 1000);

            assertThat(registry.find(runs.get(0).getRunId())).isEmpty();
            assertThat(registry.find(runs.get(999).getRunId())).isPresent();
            assertThat(registry.size()).isLessThanOrEqualTo(201);
        }

        @Test
        @DisplayName("active runs survive pruning even above the cap")
        void activeRunsKept() {
            ResearchRunRegistry registry = new ResearchRunRegistry(props(0, Duration.ofHours(1)));
            ResearchRun a = registry.register(new ResearchRun("s1", "q", "e", ""));
            ResearchRun b = registry.register(new ResearchRun("s2", "q", "e", ""));
            b.markRunning();

            registry.register(new ResearchRun("s3", "q", "e", ""));

            assertThat(registry.find(a.getRunId())).containsSame(a);
            assertThat(registry.find(b.getRunId())).containsSame(b);
            assertThat(registry.size()).isEqualTo(3);
        }
    }

    // ── Retention ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("retention")
    class Retention {

        @Test
        @DisplayName("finished runs older than the retention are dropped on the next registration")
        void expiredDropped() {
            Clock later = Clock.offset(Clock.systemUTC(), Duration.ofHours(2));
            ResearchRunRegistry registry = new ResearchRunRegistry(props(200, Duration.ofHours(1)), later);
            ResearchRun old = registry.register(new ResearchRun("s1", "q", "e", ""));
            old.fail("Search provider unavailable");
            ResearchRun stillRunning = registry.register(new ResearchRun("s2", "q", "e", ""));

            ResearchRun fresh = registry.register(new ResearchRun("s1", "q2", "e", ""));

            assertThat(registry.find(old.getRunId())).isEmpty();
            assertThat(registry.find(stillRunning.getRunId())).containsSame(stillRunning);
            assertThat(registry.findActiveForSession("s1")).containsSame(fresh);
        }

        @Test
        @DisplayName("finished runs within the retention stay pollable")
        void recentKept() {
            ResearchRunRegistry registry = new ResearchRunRegistry(props(200, Duration.ofHours(1)));
            ResearchRun done = registry.register(new ResearchRun("s1", "q", "e", ""));
            done.complete("Profile complete");

            registry.register(new ResearchRun("s1", "q2", "e", ""));

            assertThat(registry.find(done.getRunId())).containsSame(done);
            assertThat(registry.size()).isEqualTo(2);
        }
    }

    // ── Session exclusivity ──────────────────────────────────────────────────

    @Test
    @DisplayName("a second run for a busy session is rejected and nothing is pruned")
    void busySessionRejected() {
        ResearchRunRegistry registry = new ResearchRunRegistry(props(0, Duration.ofHours(1)));
        ResearchRun active = registry.register(new ResearchRun("s1", "q", "e", ""));

        assertThatThrownBy(() -> registry.register(new ResearchRun("s1", "q2", "e", "")))
                .isInstanceOf(ResearchRunRegistry.ActiveRunException.class)
                .hasMessageContaining(active.getRunId());
        assertThat(registry.size()).isEqualTo(1);
    }
}
