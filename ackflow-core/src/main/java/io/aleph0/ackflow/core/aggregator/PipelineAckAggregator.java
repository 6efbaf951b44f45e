/*-
 * =================================LICENSE_START==================================
 * ackflow-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.ackflow.core.aggregator;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.ackflow.core.AckMode;
import io.aleph0.ackflow.core.Measureable;
import io.aleph0.ackflow.core.PipelineAckHandler;

/**
 * The pipeline-wide acknowledgement aggregator. It receives acknowledgement counts from the broker
 * and reports from the client ackers, and invokes the {@link PipelineAckHandler} exactly once per
 * broker acknowledgement, once all of the reports that make up that acknowledgement have arrived.
 *
 * <p>
 * A single worker thread owns all aggregation state. The worker models the following states:
 *
 * <pre>
 *                 broker ack              acked sum == count
 *     IDLE ──────────────────► COLLECTING ──────────────────► FLUSH ─┐
 *      ▲ │                                                           │
 *      │ └─► dropped-only report ─► FLUSH ──┐                        │
 *      └────────────────────────────────────┴────────────────────────┘
 * </pre>
 *
 * <p>
 * While collecting, the worker accepts both normal and dropped-only reports, in arrival order,
 * until their acknowledged counts add up to exactly the broker's count. Overshooting the count is
 * an accounting bug, so the worker fails with an {@link AssertionError} rather than misattributing
 * acknowledgements. While idle, a dropped-only report is flushed on its own without waiting for
 * the broker.
 *
 * <p>
 * Client threads calling {@link #onEvents(List, int)} or {@link #onCounts(int, int)} block until
 * their report has been accounted for. Completion signals are released before the handler is
 * invoked, so clients never wait on the handler itself. When the aggregator is
 * {@link #close() closed}, every report that has not been accounted for yet is abandoned, and the
 * blocked client call throws {@link IllegalStateException}.
 *
 * @param <T> the event type
 */
public class PipelineAckAggregator<T>
    implements Measureable<PipelineAckAggregator.Metrics>, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineAckAggregator.class);

  private static final AtomicInteger threadSequence = new AtomicInteger(1);

  public static record Metrics(
      /**
       * The number of broker acknowledgements that were fully collected and flushed.
       */
      long cycles,

      /**
       * The number of dropped-only reports flushed on their own while idle.
       */
      long droppedFlushes,

      /**
       * The number of client reports accounted for.
       */
      long reports,

      /**
       * The number of events acknowledged by the broker and accounted for.
       */
      long acknowledged,

      /**
       * The number of events, acknowledged and dropped, accounted for.
       */
      long total,

      /**
       * The number of client reports currently waiting to be collected.
       */
      long pending) {
    public Metrics {
      if (cycles < 0)
        throw new IllegalArgumentException("cycles must be greater than or equal to 0");
      if (droppedFlushes < 0)
        throw new IllegalArgumentException("droppedFlushes must be greater than or equal to 0");
      if (reports < 0)
        throw new IllegalArgumentException("reports must be greater than or equal to 0");
      if (acknowledged < 0)
        throw new IllegalArgumentException("acknowledged must be greater than or equal to 0");
      if (total < 0)
        throw new IllegalArgumentException("total must be greater than or equal to 0");
      if (pending < 0)
        throw new IllegalArgumentException("pending must be greater than or equal to 0");
    }
  }

  public static interface LifecycleListener {
    default void onWorkerStarted(AckMode mode) {}

    default void onCycleStarted(int count) {}

    default void onReportCollected(int total, int acked) {}

    default void onCycleFlushed(int total, int acked) {}

    default void onDroppedFlushed(int total) {}

    default void onWorkerStopped() {}

    default void onWorkerFailed(Throwable cause) {}
  }

  public static <T> Builder<T> builder(PipelineAckHandler<T> handler) {
    return new Builder<>(handler);
  }

  /**
   * Creates and starts an aggregator for the given handler with default settings.
   *
   * @param <T> the event type
   * @param handler the handler configuration
   * @return the running aggregator, or empty if the handler has no populated slot
   * @throws IllegalArgumentException if more than one handler slot is populated
   */
  public static <T> Optional<PipelineAckAggregator<T>> create(PipelineAckHandler<T> handler) {
    return builder(handler).build();
  }

  public static class Builder<T> {
    private final PipelineAckHandler<T> handler;
    private ThreadFactory threadFactory = r -> {
      final Thread result =
          new Thread(r, "ackflow-aggregator-" + threadSequence.getAndIncrement());
      result.setDaemon(true);
      return result;
    };
    private final List<LifecycleListener> lifecycleListeners = new ArrayList<>();

    public Builder(PipelineAckHandler<T> handler) {
      this.handler = requireNonNull(handler, "handler");
    }

    public PipelineAckHandler<T> getHandler() {
      return handler;
    }

    public Builder<T> setThreadFactory(ThreadFactory threadFactory) {
      if (threadFactory == null)
        throw new IllegalArgumentException("threadFactory must not be null");
      this.threadFactory = threadFactory;
      return this;
    }

    public Builder<T> addLifecycleListener(LifecycleListener listener) {
      if (listener == null)
        throw new NullPointerException();
      lifecycleListeners.add(listener);
      return this;
    }

    /**
     * Builds and starts the aggregator.
     *
     * @return the running aggregator, or empty if the handler has no populated slot, in which case
     *         no worker is started
     * @throws IllegalArgumentException if more than one handler slot is populated
     */
    public Optional<PipelineAckAggregator<T>> build() {
      final AckMode mode = AckMode.of(handler);
      if (mode == AckMode.NONE)
        return Optional.empty();

      final PipelineAckAggregator<T> result =
          new PipelineAckAggregator<>(mode, handler, lifecycleListeners);
      result.start(threadFactory);

      return Optional.of(result);
    }
  }

  private static record BrokerAck(long sequence, int count) implements Sequenced {
  }

  /**
   * What the idle worker takes next. Exactly one of the two components is set.
   */
  private static record IdleInput<E>(BrokerAck ack, AckReport<E> dropped) {
  }

  /**
   * Lock for synchronizing access to the input deques and the closed flag.
   */
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Condition signaled when any input arrives or the aggregator is closed.
   */
  private final Condition changed = lock.newCondition();

  private final ArrayDeque<BrokerAck> acks = new ArrayDeque<>();
  private final ArrayDeque<AckReport<T>> events = new ArrayDeque<>();
  private final ArrayDeque<AckReport<T>> droppedEvents = new ArrayDeque<>();
  private long sequence = 0;
  private boolean closed = false;

  private final AtomicLong cyclesMetric = new AtomicLong(0);
  private final AtomicLong droppedFlushesMetric = new AtomicLong(0);
  private final AtomicLong reportsMetric = new AtomicLong(0);
  private final AtomicLong acknowledgedMetric = new AtomicLong(0);
  private final AtomicLong totalMetric = new AtomicLong(0);
  private final AtomicReference<Throwable> failureCause = new AtomicReference<>(null);
  private final List<LifecycleListener> lifecycleListeners;

  private final AckMode mode;
  private final PipelineAckHandler<T> handler;
  private Thread worker;

  private PipelineAckAggregator(AckMode mode, PipelineAckHandler<T> handler,
      List<LifecycleListener> lifecycleListeners) {
    this.mode = requireNonNull(mode);
    this.handler = requireNonNull(handler);
    this.lifecycleListeners = new CopyOnWriteArrayList<>(lifecycleListeners);
  }

  private void start(ThreadFactory threadFactory) {
    worker = threadFactory.newThread(this::work);
    if (worker == null)
      throw new IllegalStateException("thread factory returned null");
    worker.start();
  }

  public AckMode getMode() {
    return mode;
  }

  public void addLifecycleListener(LifecycleListener listener) {
    if (listener == null)
      throw new NullPointerException();
    lifecycleListeners.add(listener);
  }

  public void removeLifecycleListener(LifecycleListener listener) {
    lifecycleListeners.remove(listener);
  }

  /**
   * Hands off a broker acknowledgement to the worker. Does not wait for the resulting cycle.
   *
   * @param count the number of newly acknowledged events, across all clients
   * @throws IllegalArgumentException if count is not positive
   * @throws IllegalStateException if the aggregator is closed
   */
  public void reportBrokerAck(int count) {
    if (count <= 0)
      throw new IllegalArgumentException("count must be greater than 0");

    lock.lock();
    try {
      if (closed)
        throw new IllegalStateException("closed");
      acks.addLast(new BrokerAck(sequence++, count));
      changed.signalAll();
    } finally {
      lock.unlock();
    }

    LOGGER.atDebug().addKeyValue("count", count).log("reportBrokerAck");
  }

  /**
   * Reports a batch of events from one client. The batch contains both published and dropped
   * events, and {@code acked} is the number of them the broker acknowledged, so the number of
   * dropped events is {@code events.size() - acked}. A client may report {@code acked == 0} only if
   * it has no published events still waiting in the broker.
   *
   * <p>
   * Blocks until the report has been collected into a flushed cycle.
   *
   * @param events the events, acknowledged and dropped
   * @param acked the number of acknowledged events
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalArgumentException if acked is negative or greater than the number of events
   * @throws IllegalStateException if the aggregator is closed before the report is accounted for
   */
  public void onEvents(List<T> events, int acked) throws InterruptedException {
    if (events == null)
      throw new NullPointerException("events");
    submit(events, events.size(), acked);
  }

  /**
   * Reports a batch of events from one client by count only. See {@link #onEvents(List, int)}.
   *
   * @param total the number of events, acknowledged and dropped
   * @param acked the number of acknowledged events
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalArgumentException if total is negative, or acked is negative or greater than
   *         total
   * @throws IllegalStateException if the aggregator is closed before the report is accounted for
   */
  public void onCounts(int total, int acked) throws InterruptedException {
    submit(List.of(), total, acked);
  }

  private void submit(List<T> events, int total, int acked) throws InterruptedException {
    if (total < 0)
      throw new IllegalArgumentException("total must be greater than or equal to 0");
    if (acked < 0)
      throw new IllegalArgumentException("acked must be greater than or equal to 0");
    if (acked > total)
      throw new IllegalArgumentException("acked must be less than or equal to total");

    final AckReport<T> report;
    lock.lock();
    try {
      if (closed)
        throw new IllegalStateException("closed");
      report = new AckReport<>(sequence++, events, total, acked);
      if (report.isDroppedOnly())
        droppedEvents.addLast(report);
      else
        this.events.addLast(report);
      changed.signalAll();
    } finally {
      lock.unlock();
    }

    LOGGER.atDebug().addKeyValue("report", report).log("submit");

    report.await();
  }

  private void work() {
    LOGGER.atInfo().addKeyValue("mode", mode).log("Aggregator worker started");
    notifyLifecycleListeners(l -> l.onWorkerStarted(mode));

    Throwable failure = null;
    try {
      for (IdleInput<T> input = takeIdleInput(); input != null; input = takeIdleInput()) {
        if (input.ack() != null) {
          if (!collect(input.ack().count()))
            break;
        } else {
          flushDropped(input.dropped());
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.atInfo().log("Aggregator worker interrupted. Stopping...");
    } catch (Throwable t) {
      LOGGER.atError().setCause(t).log("Aggregator worker failed. Stopping...");
      failureCause.compareAndSet(null, t);
      failure = t;
    } finally {
      shutdown();
    }

    if (failure == null) {
      LOGGER.atInfo().log("Aggregator worker stopped");
      notifyLifecycleListeners(LifecycleListener::onWorkerStopped);
    } else {
      final Throwable cause = failure;
      notifyLifecycleListeners(l -> l.onWorkerFailed(cause));
    }
  }

  /**
   * Waits for a broker acknowledgement or a dropped-only report, whichever arrived first.
   *
   * @return the input, or {@code null} if closed
   */
  private IdleInput<T> takeIdleInput() throws InterruptedException {
    lock.lock();
    try {
      while (!closed && acks.isEmpty() && droppedEvents.isEmpty())
        changed.await();
      if (closed)
        return null;
      final BrokerAck ack = acks.peekFirst();
      final AckReport<T> dropped = droppedEvents.peekFirst();
      if (dropped == null || (ack != null && ack.sequence() < dropped.sequence()))
        return new IdleInput<>(acks.pollFirst(), null);
      return new IdleInput<>(null, droppedEvents.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for a normal or dropped-only report, whichever arrived first.
   *
   * @return the report, or {@code null} if closed
   */
  private AckReport<T> takeReport() throws InterruptedException {
    lock.lock();
    try {
      while (!closed && events.isEmpty() && droppedEvents.isEmpty())
        changed.await();
      if (closed)
        return null;
      return pollOldest(events, droppedEvents);
    } finally {
      lock.unlock();
    }
  }

  private static <E extends Sequenced> E pollOldest(ArrayDeque<E> a, ArrayDeque<E> b) {
    final E ha = a.peekFirst();
    final E hb = b.peekFirst();
    if (hb == null || (ha != null && ha.sequence() < hb.sequence()))
      return a.pollFirst();
    return b.pollFirst();
  }

  /**
   * Collects reports until their acknowledged counts add up to the given count, then flushes.
   *
   * @return {@code true} if the cycle was flushed, or {@code false} if the aggregator was closed
   *         first
   */
  private boolean collect(int count) throws InterruptedException {
    LOGGER.atDebug().addKeyValue("count", count).log("Cycle started");
    notifyLifecycleListeners(l -> l.onCycleStarted(count));

    final List<AckReport<T>> collected = new ArrayList<>();
    final List<T> cycleEvents = new ArrayList<>();
    long acked = 0;
    long total = 0;
    boolean released = false;
    try {
      while (acked < count) {
        final AckReport<T> report = takeReport();
        if (report == null)
          return false;

        collected.add(report);
        total = total + report.total();
        acked = acked + report.acked();

        if (acked > count)
          throw new AssertionError("ack count mismatch: expected " + count + ", collected " + acked);

        accumulate(cycleEvents, report);

        notifyLifecycleListeners(l -> l.onReportCollected(report.total(), report.acked()));
      }

      // Signal clients that every report covered by the broker ack has been collected.
      for (AckReport<T> report : collected)
        report.complete();
      released = true;
    } finally {
      if (!released)
        for (AckReport<T> report : collected)
          report.abandon();
    }

    cyclesMetric.incrementAndGet();
    reportsMetric.addAndGet(collected.size());
    acknowledgedMetric.addAndGet(acked);
    totalMetric.addAndGet(total);

    final int flushedTotal = Math.toIntExact(total);
    final int flushedAcked = (int) acked;
    LOGGER.atDebug().addKeyValue("count", count).addKeyValue("reports", collected.size())
        .addKeyValue("total", flushedTotal).log("Cycle flushed");

    dispatch(cycleEvents, flushedTotal);
    notifyLifecycleListeners(l -> l.onCycleFlushed(flushedTotal, flushedAcked));

    return true;
  }

  private void flushDropped(AckReport<T> report) {
    final List<T> flushed = new ArrayList<>();
    accumulate(flushed, report);

    report.complete();

    droppedFlushesMetric.incrementAndGet();
    reportsMetric.incrementAndGet();
    totalMetric.addAndGet(report.total());

    LOGGER.atDebug().addKeyValue("total", report.total()).log("Dropped report flushed");

    dispatch(flushed, report.total());
    notifyLifecycleListeners(l -> l.onDroppedFlushed(report.total()));
  }

  private void accumulate(List<T> cycleEvents, AckReport<T> report) {
    switch (mode) {
      case EVENTS:
        cycleEvents.addAll(report.events());
        break;
      case LAST_EVENTS: {
        final List<T> reported = report.events();
        if (!reported.isEmpty())
          cycleEvents.add(reported.get(reported.size() - 1));
        break;
      }
      default:
        break;
    }
  }

  private void dispatch(List<T> cycleEvents, int total) {
    switch (mode) {
      case COUNT:
        handler.ackCount().accept(total);
        break;
      case EVENTS:
        handler.ackEvents().accept(unmodifiableList(cycleEvents));
        break;
      case LAST_EVENTS:
        handler.ackLastEvents().accept(unmodifiableList(cycleEvents));
        break;
      default:
        throw new AssertionError("no handler for mode " + mode);
    }
  }

  /**
   * Marks the aggregator closed and abandons every queued report, releasing its caller.
   */
  private void shutdown() {
    final List<AckReport<T>> abandoned = new ArrayList<>();
    lock.lock();
    try {
      closed = true;
      acks.clear();
      abandoned.addAll(events);
      abandoned.addAll(droppedEvents);
      events.clear();
      droppedEvents.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }

    for (AckReport<T> report : abandoned)
      report.abandon();

    if (!abandoned.isEmpty())
      LOGGER.atWarn().addKeyValue("reports", abandoned.size())
          .log("Aggregator closed with reports outstanding. Abandoned.");
  }

  /**
   * Closes the aggregator. No more input is accepted, the worker stops as soon as it observes the
   * close, and every report not yet accounted for is abandoned. This method waits for the worker to
   * stop. If the aggregator is already closed, this method only waits and checks for failure.
   *
   * @throws InterruptedException if interrupted while waiting for the worker to stop
   * @throws ExecutionException if a handler callback failed the worker
   * @throws AssertionError if the worker stopped on an accounting mismatch
   *
   * @see #throwIfPresent()
   */
  @Override
  public void close() throws InterruptedException, ExecutionException {
    boolean closing;
    lock.lock();
    try {
      closing = !closed;
      closed = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }

    if (closing)
      LOGGER.atDebug().log("Aggregator closing");

    if (worker != Thread.currentThread())
      worker.join();

    shutdown();

    throwIfPresent();
  }

  /**
   * Checks if the worker has failed, and if so, throws the failure cause.
   *
   * @throws Error if the worker failed with an error, including an accounting mismatch
   * @throws ExecutionException if a handler callback threw an exception
   * @throws InterruptedException never under normal operation; present for symmetry with
   *         {@link #close()}
   */
  public void throwIfPresent() throws InterruptedException, ExecutionException {
    Throwable fc = failureCause.get();
    if (fc != null) {
      if (fc instanceof Error x)
        throw x;
      if (fc instanceof InterruptedException)
        throw new InterruptedException();
      if (fc instanceof Exception e)
        throw new ExecutionException(e);
      throw new AssertionError("Unexpected error", fc);
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  private void notifyLifecycleListeners(Consumer<LifecycleListener> event) {
    for (LifecycleListener listener : lifecycleListeners) {
      try {
        event.accept(listener);
      } catch (Exception e) {
        LOGGER.atError().setCause(e).log("Error notifying lifecycle listener");
      }
    }
  }

  @Override
  public Metrics checkMetrics() {
    final long cycles = cyclesMetric.get();
    final long droppedFlushes = droppedFlushesMetric.get();
    final long reports = reportsMetric.get();
    final long acknowledged = acknowledgedMetric.get();
    final long total = totalMetric.get();
    final long pending;
    lock.lock();
    try {
      pending = events.size() + droppedEvents.size();
    } finally {
      lock.unlock();
    }
    return new Metrics(cycles, droppedFlushes, reports, acknowledged, total, pending);
  }

  @Override
  public Metrics flushMetrics() {
    final Metrics metrics = checkMetrics();
    cyclesMetric.set(0);
    droppedFlushesMetric.set(0);
    reportsMetric.set(0);
    acknowledgedMetric.set(0);
    totalMetric.set(0);
    return metrics;
  }
}
