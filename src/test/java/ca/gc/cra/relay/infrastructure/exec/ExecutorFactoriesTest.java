package ca.gc.cra.relay.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void namesWorkerThreadsWithPrefix() throws Exception {
    ExecutorService executor = ExecutorFactories.newStagePool(2, "relay-test", null);
    Set<String> names = ConcurrentHashMap.newKeySet();
    Set<Boolean> daemon = ConcurrentHashMap.newKeySet();
    CountDownLatch done = new CountDownLatch(2);
    CountDownLatch bothRunning = new CountDownLatch(2);
    try {
      for (int i = 0; i < 2; i++) {
        executor.execute(() -> {
          names.add(Thread.currentThread().getName());
          daemon.add(Thread.currentThread().isDaemon());
          bothRunning.countDown();
          try {
            bothRunning.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
          }
          done.countDown();
        });
      }
      assertTrue(done.await(5, TimeUnit.SECONDS));
    } finally {
      ExecutorFactories.shutdownAndAwait(executor);
    }

    assertEquals(Set.of("relay-test-0", "relay-test-1"), names);
    assertEquals(Set.of(false), daemon);
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService executor = ExecutorFactories.newStagePool(1, " ", null);
    String[] name = new String[1];
    try {
      executor.submit(() -> name[0] = Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
    } finally {
      ExecutorFactories.shutdownAndAwait(executor);
    }
    assertEquals("relay-stage-0", name[0]);
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newStagePool(0, "relay-test", null));
  }

  @Test
  void shutdownAndAwaitWaitsForRunningTasksAndRestoresInterrupt() throws Exception {
    ExecutorService executor = ExecutorFactories.newStagePool(1, "relay-slow", null);
    CountDownLatch started = new CountDownLatch(1);
    AtomicBoolean finished = new AtomicBoolean();
    executor.execute(() -> {
      started.countDown();
      try {
        Thread.sleep(200);
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
      finished.set(true);
    });
    assertTrue(started.await(5, TimeUnit.SECONDS));

    Thread.currentThread().interrupt();
    ExecutorFactories.shutdownAndAwait(executor);

    assertTrue(Thread.interrupted(), "interrupt flag should be restored");
    assertTrue(finished.get());
    assertTrue(executor.isTerminated());
    assertFalse(Thread.currentThread().isInterrupted());
  }
}
