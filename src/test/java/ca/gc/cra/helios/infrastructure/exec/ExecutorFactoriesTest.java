package ca.gc.cra.helios.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workersAreNamedDaemonThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newLookupPool(2, "lookup-test", null);
    try {
      Future<Thread> worker = pool.submit(Thread::currentThread);
      Thread thread = worker.get(5, TimeUnit.SECONDS);

      assertTrue(thread.isDaemon());
      assertTrue(thread.getName().startsWith("lookup-test-"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void blankPrefixUsesDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newLookupPool(1, " ", null);
    try {
      String name = pool.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("helios-lookup-"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newLookupPool(0, "x", null));
  }
}
