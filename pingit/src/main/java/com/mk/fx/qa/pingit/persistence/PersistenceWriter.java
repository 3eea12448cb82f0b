package com.mk.fx.qa.pingit.persistence;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.pingit.cfg.PersistenceCfg;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Asynchronous writer between the probers and {@link PingRepository}.
 *
 * <p>Producers call {@link #submit(PendingWrite)}, which never blocks: a full queue evicts its
 * oldest entry. A single worker thread takes batches off the queue and stores each in one
 * transaction, retrying failed batches with linear backoff before dropping them. Queue order is
 * write order, so results of one target are stored in the order they were produced.
 */
@Slf4j
@Component
public class PersistenceWriter {

  private static final long DROP_WARN_EVERY = 1_000;

  private final PingRepository repository;
  private final PersistenceCfg cfg;
  private final BlockingQueue<PendingWrite> queue;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong written = new AtomicLong();
  private final AtomicLong failedBatches = new AtomicLong();

  private volatile boolean stopping;
  private volatile long drainDeadlineNanos = Long.MAX_VALUE;
  private volatile Thread worker;

  public PersistenceWriter(PingRepository repository, PersistenceCfg cfg) {
    this.repository = repository;
    this.cfg = cfg;
    this.queue = new ArrayBlockingQueue<>(cfg.getQueueCapacity());
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    Thread thread = new Thread(this::runLoop, "pingit-persistence-writer");
    thread.setDaemon(true);
    worker = thread;
    thread.start();
    log.info(
        "Persistence writer started: capacity={} batchSize={} flushInterval={} maxRetries={}",
        cfg.getQueueCapacity(),
        cfg.getBatchSize(),
        cfg.getFlushInterval(),
        cfg.getMaxRetries());
  }

  /**
   * Queues a write. When the queue is full the oldest pending write is discarded to make room.
   * Writes submitted after shutdown are discarded.
   */
  public void submit(PendingWrite write) {
    if (stopping) {
      countDropped(write);
      return;
    }
    while (!queue.offer(write)) {
      PendingWrite evicted = queue.poll();
      if (evicted != null) {
        countDropped(evicted);
      }
    }
  }

  private void countDropped(PendingWrite write) {
    long total = dropped.incrementAndGet();
    if (total == 1 || total % DROP_WARN_EVERY == 0) {
      log.warn(
          "Persistence queue backpressure: dropped write for {} ({} dropped so far)",
          write.targetName(),
          total);
    }
  }

  private void runLoop() {
    List<PendingWrite> batch = new ArrayList<>(cfg.getBatchSize());
    try {
      while (!stopping) {
        PendingWrite first = queue.poll(cfg.getFlushInterval().toNanos(), TimeUnit.NANOSECONDS);
        if (first == null) {
          continue;
        }
        batch.add(first);
        fillBatch(batch);
        writeWithRetry(batch);
        batch.clear();
      }
      while (!queue.isEmpty() && System.nanoTime() < drainDeadlineNanos) {
        queue.drainTo(batch, cfg.getBatchSize());
        writeWithRetry(batch);
        batch.clear();
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Persistence writer interrupted with {} writes in flight", batch.size());
    } finally {
      int remaining = queue.size() + batch.size();
      queue.clear();
      if (remaining > 0) {
        dropped.addAndGet(remaining);
        log.warn("Persistence writer discarded {} pending writes on shutdown", remaining);
      }
      log.info(
          "Persistence writer stopped: written={} dropped={} failedBatches={}",
          written.get(),
          dropped.get(),
          failedBatches.get());
    }
  }

  /** Tops the batch up until it is full or the flush interval has passed. */
  private void fillBatch(List<PendingWrite> batch) throws InterruptedException {
    long deadline = System.nanoTime() + cfg.getFlushInterval().toNanos();
    while (batch.size() < cfg.getBatchSize() && !stopping) {
      queue.drainTo(batch, cfg.getBatchSize() - batch.size());
      long remaining = deadline - System.nanoTime();
      if (batch.size() >= cfg.getBatchSize() || remaining <= 0) {
        return;
      }
      PendingWrite next = queue.poll(remaining, TimeUnit.NANOSECONDS);
      if (next == null) {
        return;
      }
      batch.add(next);
    }
  }

  private void writeWithRetry(List<PendingWrite> batch) throws InterruptedException {
    int attempts = cfg.getMaxRetries() + 1;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        repository.writeBatch(batch);
        written.addAndGet(batch.size());
        return;
      } catch (RuntimeException ex) {
        if (attempt == attempts) {
          failedBatches.incrementAndGet();
          dropped.addAndGet(batch.size());
          log.error(
              "Dropping batch of {} writes after {} attempts: {}",
              batch.size(),
              attempts,
              ex.getMessage(),
              ex);
          return;
        }
        Duration backoff = cfg.getRetryBackoff().multipliedBy(attempt);
        log.warn(
            "Batch of {} writes failed (attempt {}/{}), retrying in {}ms: {}",
            batch.size(),
            attempt,
            attempts,
            backoff.toMillis(),
            ex.getMessage());
        TimeUnit.MILLISECONDS.sleep(backoff.toMillis());
      }
    }
  }

  /**
   * Stops accepting writes and lets the worker store what is queued within the shutdown grace
   * period. Whatever is still queued afterwards is discarded.
   */
  @PreDestroy
  public void shutdown() {
    Duration grace = cfg.getShutdownGrace();
    drainDeadlineNanos = System.nanoTime() + grace.toNanos();
    stopping = true;
    Thread thread = worker;
    if (thread == null) {
      return;
    }
    log.info("Persistence writer draining {} pending writes (grace {})", queue.size(), grace);
    try {
      thread.join(grace.plus(cfg.getFlushInterval()).toMillis());
      if (thread.isAlive()) {
        log.warn("Persistence writer did not finish within {}, interrupting", grace);
        thread.interrupt();
        thread.join(cfg.getFlushInterval().toMillis());
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      thread.interrupt();
    }
  }

  public boolean isRunning() {
    Thread thread = worker;
    return thread != null && thread.isAlive() && !stopping;
  }

  public long droppedCount() {
    return dropped.get();
  }

  public long writtenCount() {
    return written.get();
  }

  public long failedBatchCount() {
    return failedBatches.get();
  }

  @VisibleForTesting
  List<PendingWrite> pendingSnapshot() {
    return List.copyOf(queue);
  }
}
