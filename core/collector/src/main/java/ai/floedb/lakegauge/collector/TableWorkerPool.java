/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.lakegauge.collector;

import ai.floedb.lakegauge.collector.model.CollectionResult;
import ai.floedb.lakegauge.collector.model.TableFailure;
import ai.floedb.lakegauge.collector.model.TableMetrics;
import ai.floedb.lakegauge.collector.model.TableRef;
import ai.floedb.lakegauge.collector.model.TableSnapshotFacts;
import ai.floedb.lakegauge.collector.spi.MetadataReader;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Measures every enumerated table with a fixed number of workers.
 *
 * <p>Workers pull table refs from a shared queue and process one table completely (metadata read,
 * then metric computation) before taking the next. Each worker publishes an immutable outcome per
 * table; the thread that called {@link #collect} is the only one that accumulates them, so the
 * result holds exactly one entry per table whatever order the workers finish in.
 *
 * <p>A failure or timeout while processing a table is recorded as a {@link TableFailure} for that
 * table and never reaches sibling workers. After {@link #requestStop()} no new table is read;
 * tables already being read finish normally and the rest are recorded as {@link
 * TableFailure.Kind#STOPPED}.
 *
 * <p>A timed-out read is cancelled but keeps its read slot until its thread actually returns, so a
 * read that ignores interruption still counts against the worker budget.
 */
public final class TableWorkerPool {
  private static final Logger LOG = Logger.getLogger(TableWorkerPool.class);
  private static final AtomicInteger POOL_SEQ = new AtomicInteger(1);

  private final MetadataReader reader;
  private final int maxWorkers;
  private final Duration tableReadTimeout;
  private final CollectionTelemetry telemetry;
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);

  public TableWorkerPool(
      MetadataReader reader,
      int maxWorkers,
      Duration tableReadTimeout,
      CollectionTelemetry telemetry) {
    if (maxWorkers < 1) {
      throw new IllegalArgumentException("maxWorkers must be >= 1: " + maxWorkers);
    }
    if (tableReadTimeout == null || tableReadTimeout.isZero() || tableReadTimeout.isNegative()) {
      throw new IllegalArgumentException("tableReadTimeout must be positive: " + tableReadTimeout);
    }
    this.reader = Objects.requireNonNull(reader, "reader");
    this.maxWorkers = maxWorkers;
    this.tableReadTimeout = tableReadTimeout;
    this.telemetry = telemetry == null ? CollectionTelemetry.detached() : telemetry;
  }

  public void requestStop() {
    if (stopRequested.compareAndSet(false, true)) {
      LOG.info("Stop requested, no further tables will be read");
    }
  }

  public boolean stopRequested() {
    return stopRequested.get();
  }

  public CollectionResult collect(CatalogListing listing) {
    List<TableRef> tables = listing.tables();
    List<TableMetrics> metrics = new ArrayList<>(tables.size());
    List<TableFailure> failures = new ArrayList<>();
    if (tables.isEmpty()) {
      return new CollectionResult(listing.namespaces(), tables, metrics, failures);
    }

    BlockingQueue<TableRef> work = new LinkedBlockingQueue<>(tables);
    BlockingQueue<TableOutcome> outcomes = new LinkedBlockingQueue<>();
    int workerCount = Math.min(maxWorkers, tables.size());
    int poolId = POOL_SEQ.getAndIncrement();
    ExecutorService workers =
        Executors.newFixedThreadPool(workerCount, named("lakegauge-worker-" + poolId + "-"));
    ExecutorService reads = Executors.newCachedThreadPool(named("lakegauge-read-" + poolId + "-"));
    Semaphore readSlots = new Semaphore(workerCount);

    LOG.infof("Collecting %d tables with %d workers", tables.size(), workerCount);
    boolean interrupted = false;
    try {
      for (int i = 0; i < workerCount; i++) {
        workers.execute(() -> drain(work, outcomes, reads, readSlots));
      }

      int received = 0;
      while (received < tables.size()) {
        final TableOutcome outcome;
        try {
          outcome = outcomes.take();
        } catch (InterruptedException e) {
          interrupted = true;
          requestStop();
          continue;
        }
        received++;
        if (outcome.succeeded()) {
          metrics.add(outcome.metrics());
        } else {
          failures.add(outcome.failure());
        }
      }
    } finally {
      workers.shutdown();
      reads.shutdownNow();
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    return new CollectionResult(listing.namespaces(), tables, metrics, failures);
  }

  private void drain(
      BlockingQueue<TableRef> work,
      BlockingQueue<TableOutcome> outcomes,
      ExecutorService reads,
      Semaphore readSlots) {
    TableRef table;
    while ((table = work.poll()) != null) {
      TableOutcome outcome;
      try {
        outcome =
            stopRequested.get()
                ? failed(table, TableFailure.Kind.STOPPED, "collection stopped", System.nanoTime())
                : process(table, reads, readSlots);
      } catch (Throwable t) {
        // every dequeued table must produce exactly one outcome
        outcome =
            failed(table, TableFailure.Kind.METADATA_UNREADABLE, describe(t), System.nanoTime());
      }
      outcomes.add(outcome);
    }
  }

  private TableOutcome process(TableRef table, ExecutorService reads, Semaphore readSlots) {
    long started = System.nanoTime();
    try {
      if (!readSlots.tryAcquire(tableReadTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return failed(
            table,
            TableFailure.Kind.TIMEOUT,
            "no read slot freed by earlier timed-out reads within " + tableReadTimeout,
            started);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      requestStop();
      return failed(table, TableFailure.Kind.STOPPED, "worker interrupted", started);
    }
    // whoever claims first owns the slot: the read task when it starts, or the canceller
    AtomicBoolean claimed = new AtomicBoolean(false);
    final Future<TableSnapshotFacts> read;
    try {
      read =
          reads.submit(
              () -> {
                if (!claimed.compareAndSet(false, true)) {
                  return null;
                }
                try {
                  return reader.read(table);
                } finally {
                  readSlots.release();
                }
              });
    } catch (RuntimeException e) {
      readSlots.release();
      throw e;
    }
    try {
      TableSnapshotFacts facts = read.get(tableReadTimeout.toMillis(), TimeUnit.MILLISECONDS);
      TableMetrics computed = MetricComputer.compute(facts);
      telemetry.tableCollected(System.nanoTime() - started);
      LOG.debugf(
          "Measured %s: partitions=%d files=%d bytes=%d records=%d",
          table,
          computed.partitionCount(),
          computed.fileCount(),
          computed.totalBytes(),
          computed.totalRecords());
      return TableOutcome.measured(computed);
    } catch (TimeoutException e) {
      abandon(read, claimed, readSlots);
      return failed(
          table,
          TableFailure.Kind.TIMEOUT,
          "metadata read timed out after " + tableReadTimeout,
          started);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      return failed(table, TableFailure.Kind.METADATA_UNREADABLE, describe(cause), started);
    } catch (ArithmeticException e) {
      return failed(
          table,
          TableFailure.Kind.METADATA_UNREADABLE,
          "table totals overflow a 64-bit counter",
          started);
    } catch (InterruptedException e) {
      abandon(read, claimed, readSlots);
      Thread.currentThread().interrupt();
      requestStop();
      return failed(table, TableFailure.Kind.STOPPED, "worker interrupted", started);
    }
  }

  private static void abandon(Future<?> read, AtomicBoolean claimed, Semaphore readSlots) {
    read.cancel(true);
    if (claimed.compareAndSet(false, true)) {
      readSlots.release();
    }
  }

  private TableOutcome failed(TableRef table, TableFailure.Kind kind, String reason, long started) {
    telemetry.tableFailed(kind, System.nanoTime() - started);
    if (kind == TableFailure.Kind.STOPPED) {
      LOG.debugf("Skipped %s: %s", table, reason);
    } else {
      LOG.warnf("Could not measure %s (%s): %s", table, kind, reason);
    }
    return TableOutcome.failed(new TableFailure(table, kind, reason));
  }

  static String describe(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String message = root.getMessage();
    String top = t.getMessage();
    if (root == t || top == null || top.isBlank()) {
      return root.getClass().getSimpleName() + ": " + message;
    }
    return top + " (" + root.getClass().getSimpleName() + ": " + message + ")";
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread thread = new Thread(r, prefix + seq.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    };
  }
}
