package com.mergington.backend.modules.activity;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.mergington.backend.global.error.ProblemException;
import com.mergington.backend.modules.activity.application.ActivityRegistry;
import com.mergington.backend.modules.activity.domain.Activity;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ActivityRegistryConcurrencyTest {

    private static final String ACTIVITY = "Math Club";
    private static final int THREADS = 16;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("concurrent signups never exceed capacity")
    void concurrentSignUpsRespectCapacity() throws Exception {
        ActivityRegistry registry = new ActivityRegistry(
                List.of(new Activity(ACTIVITY, "", "", 10, List.of())), true);

        List<Boolean> outcomes = runConcurrently(40, i -> signUp(registry, "student" + i + "@mergington.edu"));

        assertThat(outcomes.stream().filter(Boolean::booleanValue).count()).isEqualTo(10);
        assertThat(registry.listActivities().get(ACTIVITY).participants()).hasSize(10).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("the same student racing to sign up is enrolled once")
    void concurrentDuplicateSignUpsEnrollOnce() throws Exception {
        ActivityRegistry registry = new ActivityRegistry(
                List.of(new Activity(ACTIVITY, "", "", 10, List.of())), true);

        List<Boolean> outcomes = runConcurrently(THREADS, i -> signUp(registry, "same@mergington.edu"));

        assertThat(outcomes.stream().filter(Boolean::booleanValue).count()).isEqualTo(1);
        assertThat(registry.listActivities().get(ACTIVITY).participants()).containsExactly("same@mergington.edu");
    }

    @Test
    @DisplayName("the same student racing to unregister is removed once")
    void concurrentUnregistersRemoveOnce() throws Exception {
        ActivityRegistry registry = new ActivityRegistry(
                List.of(new Activity(ACTIVITY, "", "", 10, List.of("same@mergington.edu", "other@mergington.edu"))),
                true);

        List<Boolean> outcomes = runConcurrently(THREADS, i -> {
            try {
                registry.unregister(ACTIVITY, "same@mergington.edu");
                return true;
            } catch (ProblemException ex) {
                return false;
            }
        });

        assertThat(outcomes.stream().filter(Boolean::booleanValue).count()).isEqualTo(1);
        assertThat(registry.listActivities().get(ACTIVITY).participants()).containsExactly("other@mergington.edu");
    }

    private static boolean signUp(ActivityRegistry registry, String participant) {
        try {
            registry.signUp(ACTIVITY, participant);
            return true;
        } catch (ProblemException ex) {
            return false;
        }
    }

    private List<Boolean> runConcurrently(int tasks, IndexedTask task) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < tasks; i++) {
            int index = i;
            Callable<Boolean> callable = () -> {
                start.await();
                return task.run(index);
            };
            futures.add(executor.submit(callable));
        }
        start.countDown();
        List<Boolean> outcomes = new ArrayList<>();
        for (Future<Boolean> future : futures) {
            outcomes.add(future.get(10, TimeUnit.SECONDS));
        }
        return outcomes;
    }

    @FunctionalInterface
    private interface IndexedTask {
        boolean run(int index);
    }
}
