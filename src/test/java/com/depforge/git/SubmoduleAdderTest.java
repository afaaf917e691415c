package com.depforge.git;

import com.depforge.core.metrics.GitMetrics;
import com.depforge.core.process.BailOutException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
class SubmoduleAdderTest {

    private static final String URL = "https://github.com/ModOrganizer2/cmake_common.git";

    @TempDir
    Path root;

    private FakeGit git;
    private SubmoduleAdder adder;

    @BeforeEach
    void setUp() {
        git = new FakeGit();
        git.repo(root, "https://github.com/ModOrganizer2/modorganizer.git");
    }

    @AfterEach
    void tearDown() {
        if (adder != null) {
            adder.close();
        }
    }

    private SubmoduleRequest request(String name) {
        return new SubmoduleRequest(URL, root, "master", name);
    }

    @Test
    @DisplayName("requests from many producers are each attempted once, in per-producer order")
    void manyProducers() throws Exception {
        int producers = 4;
        int perProducer = 25;
        var attempted = Collections.synchronizedList(new ArrayList<String>());
        var done = new CountDownLatch(producers * perProducer);
        git.onCall("submodule", args -> {
            attempted.add(args.get(args.size() - 1));
            done.countDown();
        });

        adder = new SubmoduleAdder(git.runtime());
        adder.start();

        var threads = new ArrayList<Thread>();
        for (int p = 0; p < producers; p++) {
            int id = p;
            var t = new Thread(() -> {
                for (int i = 0; i < perProducer; i++) {
                    adder.queue(request("p" + id + "-" + i));
                }
            });
            threads.add(t);
            t.start();
        }
        for (var t : threads) {
            t.join();
        }

        assertTrue(done.await(20, TimeUnit.SECONDS));
        adder.stop();
        adder.join();

        List<String> seen;
        synchronized (attempted) {
            seen = List.copyOf(attempted);
        }
        assertEquals(producers * perProducer, seen.size());
        assertEquals(seen.size(), new HashSet<>(seen).size());

        for (int p = 0; p < producers; p++) {
            String prefix = "p" + p + "-";
            var mine = seen.stream().filter(s -> s.startsWith(prefix)).toList();
            for (int i = 0; i < perProducer; i++) {
                assertEquals(prefix + i, mine.get(i));
            }
        }
    }

    @Test
    @DisplayName("runs the submodule add in the requested repository")
    void addsSubmodule() {
        adder = new SubmoduleAdder(git.runtime());
        adder.start();

        adder.queue(request("cmake_common"));
        adder.awaitIdle();

        assertEquals(List.of("cmake_common"), git.repo(root).submodules);
        assertEquals(0, adder.pending());
    }

    @Test
    @DisplayName("stop lets the running request finish and drops the rest")
    void stopAbandonsPending() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        git.onCall("submodule", args -> {
            if (args.contains("first")) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        adder = new SubmoduleAdder(git.runtime());
        adder.start();

        adder.queue(request("first"));
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        adder.queue(request("second"));
        adder.queue(request("third"));

        adder.stop();
        release.countDown();
        adder.join();

        assertFalse(adder.isRunning());
        assertEquals(List.of("first"), git.repo(root).submodules);
        assertEquals(2, adder.pending());
    }

    @Test
    @DisplayName("a failing request ends the worker without reaching the caller")
    void bailEndsWorker() {
        git.fail("submodule", 128);
        adder = new SubmoduleAdder(git.runtime());
        adder.start();

        assertDoesNotThrow(() -> adder.queue(request("broken")));
        adder.join();

        assertFalse(adder.isRunning());
        assertEquals(1, git.count("submodule"));

        adder.queue(request("after"));
        adder.awaitIdle();
        assertEquals(1, git.count("submodule"));
    }

    @RepeatedTest(20)
    @DisplayName("awaitIdle returns when a failure ends the worker with requests still queued")
    void awaitIdleAfterFailureWithPending() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        git.onCall("submodule", args -> {
            if (args.contains("first")) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new BailOutException(BailOutException.Reason.GENERIC, "first failed");
            }
        });

        adder = new SubmoduleAdder(git.runtime());
        adder.start();

        adder.queue(request("first"));
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        adder.queue(request("second"));

        var waiter = new Thread(adder::awaitIdle);
        waiter.start();
        release.countDown();
        waiter.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(waiter.isAlive());
        assertFalse(adder.isRunning());
        assertEquals(1, adder.pending());
    }

    @Test
    @DisplayName("awaitIdle returns after stop with requests still queued")
    void awaitIdleAfterStopWithPending() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        git.onCall("submodule", args -> {
            if (args.contains("first")) {
                entered.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        });

        adder = new SubmoduleAdder(git.runtime());
        adder.start();

        adder.queue(request("first"));
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        adder.queue(request("second"));
        adder.stop();

        var waiter = new Thread(adder::awaitIdle);
        waiter.start();
        release.countDown();
        waiter.join(TimeUnit.SECONDS.toMillis(10));

        assertFalse(waiter.isAlive());
        assertEquals(1, adder.pending());
    }

    @Test
    @DisplayName("awaitIdle returns at once when the worker was never started")
    void awaitIdleNotStarted() {
        adder = new SubmoduleAdder(git.runtime());
        adder.queue(request("first"));

        assertTimeoutPreemptively(Duration.ofSeconds(5), adder::awaitIdle);
    }

    @Test
    @DisplayName("stop and join return promptly when idle")
    void stopWhenIdle() {
        adder = new SubmoduleAdder(git.runtime());
        adder.start();
        adder.start();

        assertTrue(adder.isRunning());
        adder.stop();
        adder.join();

        assertFalse(adder.isRunning());
        assertTrue(git.invocations().isEmpty());
    }

    @Test
    @DisplayName("records processed submodules and the queue depth")
    void metrics() {
        var registry = new SimpleMeterRegistry();
        adder = new SubmoduleAdder(git.runtime(), new GitMetrics(registry));
        adder.start();

        adder.queue(request("cmake_common"));
        adder.queue(request("uibase"));
        adder.awaitIdle();

        var success = registry.find("depforge.submodules.processed").tag("result", "success").counter();
        assertNotNull(success);
        assertEquals(2.0, success.count());

        var gauge = registry.find("depforge.submodules.queued").gauge();
        assertNotNull(gauge);
        assertEquals(0.0, gauge.value());
    }
}
