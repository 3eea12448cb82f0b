package com.mk.fx.qa.pingit.persistence;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.mk.fx.qa.pingit.cfg.PersistenceCfg;
import com.mk.fx.qa.pingit.model.ProbeResult;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PersistenceWriterTest {

  @TempDir Path dir;

  private static PersistenceCfg cfg(int capacity) {
    var cfg = new PersistenceCfg();
    cfg.setQueueCapacity(capacity);
    cfg.setBatchSize(50);
    cfg.setFlushInterval(Duration.ofMillis(20));
    cfg.setMaxRetries(2);
    cfg.setRetryBackoff(Duration.ofMillis(1));
    cfg.setShutdownGrace(Duration.ofSeconds(2));
    return cfg;
  }

  private static PingRecord ping(String name, int second) {
    return new PingRecord(
        "h", ProbeResult.success(name, Instant.EPOCH.plusSeconds(second), 1.0));
  }

  private static void awaitCondition(BooleanSupplier condition)
      throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!condition.getAsBoolean()) {
      assertTrue(System.nanoTime() < deadline, "condition not met in time");
      Thread.sleep(10);
    }
  }

  @Test
  void submit_overflowDropsOldestWithoutBlocking() {
    var writer = new PersistenceWriter(mock(PingRepository.class), cfg(3));

    long before = System.nanoTime();
    for (int i = 0; i < 5; i++) {
      writer.submit(ping("gw", i));
    }

    assertTrue(System.nanoTime() - before < Duration.ofSeconds(1).toNanos());
    assertEquals(2, writer.droppedCount());
    assertEquals(
        List.of(ping("gw", 2), ping("gw", 3), ping("gw", 4)), writer.pendingSnapshot());
  }

  @Test
  void worker_storesQueuedWritesInOrder() throws Exception {
    var repository = SqliteTestSupport.repository(dir);
    var writer = new PersistenceWriter(repository, cfg(1_000));
    writer.start();
    try {
      for (int i = 0; i < 120; i++) {
        writer.submit(ping("gw", i));
      }
      awaitCondition(() -> writer.writtenCount() == 120);
    } finally {
      writer.shutdown();
    }

    var history = repository.history("gw", 0, 500);
    assertEquals(120, history.size());
    assertEquals(Instant.EPOCH.plusSeconds(119), history.get(0).result().timestamp());
    assertEquals(0, writer.droppedCount());
  }

  @Test
  void failingBatch_retriedThenDropped() throws Exception {
    var repository = mock(PingRepository.class);
    doThrow(new PersistenceException("disk full", null)).when(repository).writeBatch(anyList());
    var writer = new PersistenceWriter(repository, cfg(100));
    writer.start();
    try {
      writer.submit(ping("gw", 0));
      awaitCondition(() -> writer.failedBatchCount() == 1);
    } finally {
      writer.shutdown();
    }

    verify(repository, times(3)).writeBatch(anyList());
    assertEquals(1, writer.droppedCount());
    assertEquals(0, writer.writtenCount());
  }

  @Test
  void shutdown_flushesPendingWrites() throws Exception {
    var repository = SqliteTestSupport.repository(dir);
    var writer = new PersistenceWriter(repository, cfg(1_000));
    writer.start();
    assertTrue(writer.isRunning());
    for (int i = 0; i < 10; i++) {
      writer.submit(ping("gw", i));
    }

    writer.shutdown();

    assertFalse(writer.isRunning());
    assertEquals(10, repository.history("gw", 0, 100).size());
    writer.submit(ping("gw", 99));
    assertEquals(1, writer.droppedCount());
  }

  @Test
  void shutdown_discardsWhatIsLeftWhenGraceRunsOut() throws Exception {
    var repository = mock(PingRepository.class);
    doAnswer(
            invocation -> {
              Thread.sleep(100);
              return null;
            })
        .when(repository)
        .writeBatch(anyList());
    var cfg = cfg(1_000);
    cfg.setBatchSize(1);
    cfg.setShutdownGrace(Duration.ofMillis(200));
    var writer = new PersistenceWriter(repository, cfg);
    writer.start();
    for (int i = 0; i < 50; i++) {
      writer.submit(ping("gw", i));
    }

    long before = System.nanoTime();
    writer.shutdown();
    long elapsed = System.nanoTime() - before;

    assertTrue(elapsed < Duration.ofSeconds(1).toNanos(), "shutdown took " + elapsed + "ns");
    awaitCondition(() -> writer.writtenCount() + writer.droppedCount() == 50);
    assertFalse(writer.isRunning());
    assertTrue(writer.droppedCount() > 0);
    assertTrue(writer.writtenCount() < 50);
  }
}
