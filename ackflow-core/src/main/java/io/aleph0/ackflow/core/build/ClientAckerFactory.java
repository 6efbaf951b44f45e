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
package io.aleph0.ackflow.core.build;

import static java.util.Objects.requireNonNull;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.ackflow.core.AckMode;
import io.aleph0.ackflow.core.PipelineAckHandler;
import io.aleph0.ackflow.core.acker.BoundGapCountClientAcker;
import io.aleph0.ackflow.core.acker.ClientAcker;
import io.aleph0.ackflow.core.acker.ClientGuard;
import io.aleph0.ackflow.core.acker.CountAckCallback;
import io.aleph0.ackflow.core.acker.CountClientAcker;
import io.aleph0.ackflow.core.acker.EventAckCallback;
import io.aleph0.ackflow.core.acker.EventDataClientAcker;
import io.aleph0.ackflow.core.acker.EventSemaphore;
import io.aleph0.ackflow.core.aggregator.PipelineAckAggregator;

/**
 * Builds the {@link ClientAcker} for each client of a pipeline, wired to the pipeline-wide
 * {@link PipelineAckAggregator} according to the pipeline's {@link AckMode}.
 *
 * <p>
 * When the pipeline has a handler, every report produced by a client acker is first forwarded to
 * the aggregator, and then passed to the client's own callback if the client is still active. In
 * {@link AckMode#NONE} mode, client ackers only invoke the client's own callback.
 *
 * <p>
 * The count passed to a client's count callback is the total number of that client's events
 * covered by the report, acknowledged and dropped alike.
 *
 * @param <T> the event type
 */
public class ClientAckerFactory<T> implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClientAckerFactory.class);

  /**
   * Creates a factory for the given handler, starting an aggregator with default settings if the
   * handler has a populated slot.
   *
   * @param <T> the event type
   * @param handler the pipeline-wide handler configuration
   * @return the factory
   * @throws IllegalArgumentException if more than one handler slot is populated
   */
  public static <T> ClientAckerFactory<T> create(PipelineAckHandler<T> handler) {
    return create(PipelineAckAggregator.builder(handler));
  }

  /**
   * Creates a factory, starting an aggregator from the given builder if its handler has a populated
   * slot.
   *
   * @param <T> the event type
   * @param aggregator the aggregator configuration
   * @return the factory
   * @throws IllegalArgumentException if more than one handler slot is populated
   */
  public static <T> ClientAckerFactory<T> create(PipelineAckAggregator.Builder<T> aggregator) {
    final AckMode mode = AckMode.of(aggregator.getHandler());
    final PipelineAckAggregator<T> result = aggregator.build().orElse(null);
    LOGGER.atDebug().addKeyValue("mode", mode).log("Created client acker factory");
    return new ClientAckerFactory<>(mode, result);
  }

  private final AckMode mode;
  private final PipelineAckAggregator<T> aggregator;

  private ClientAckerFactory(AckMode mode, PipelineAckAggregator<T> aggregator) {
    this.mode = requireNonNull(mode);
    if (mode != AckMode.NONE && aggregator == null)
      throw new IllegalArgumentException("aggregator required for mode " + mode);
    this.aggregator = aggregator;
  }

  public AckMode getMode() {
    return mode;
  }

  public Optional<PipelineAckAggregator<T>> aggregator() {
    return Optional.ofNullable(aggregator);
  }

  /**
   * Creates the acker for a client without a callback of its own. Its reports only feed the
   * pipeline-wide aggregator.
   *
   * @param canDrop whether the client's events may be dropped before reaching the broker
   * @param semaphore the pipeline's in-flight event bound, required if {@code canDrop}
   * @return the acker
   */
  public ClientAcker<T> createPipelineAcker(boolean canDrop, EventSemaphore semaphore) {
    switch (mode) {
      case NONE:
        return ClientAcker.nop();
      case COUNT:
        return newCountAcker(canDrop, semaphore, aggregator::onCounts);
      case EVENTS:
      case LAST_EVENTS:
        return newEventAcker(canDrop, semaphore, aggregator::onEvents);
      default:
        throw new AssertionError("unknown mode " + mode);
    }
  }

  /**
   * Creates the acker for a client that wants to know how many of its events were acknowledged.
   *
   * @param canDrop whether the client's events may be dropped before reaching the broker
   * @param semaphore the pipeline's in-flight event bound, required if {@code canDrop}
   * @param fn the client's callback
   * @return the acker, which must be closed when the client closes
   */
  public ClientGuard<T> createCountAcker(boolean canDrop, EventSemaphore semaphore,
      IntConsumer fn) {
    requireNonNull(fn, "fn");
    final ClientGuard<T> guard = new ClientGuard<>();
    switch (mode) {
      case NONE:
        return guard.lift(newCountAcker(canDrop, semaphore, (total, acked) -> {
          if (guard.isActive())
            fn.accept(total);
        }));
      case COUNT:
        return guard.lift(newCountAcker(canDrop, semaphore, (total, acked) -> {
          aggregator.onCounts(total, acked);
          if (guard.isActive())
            fn.accept(total);
        }));
      case EVENTS:
      case LAST_EVENTS:
        return guard.lift(newEventAcker(canDrop, semaphore, (events, acked) -> {
          aggregator.onEvents(events, acked);
          if (guard.isActive())
            fn.accept(events.size());
        }));
      default:
        throw new AssertionError("unknown mode " + mode);
    }
  }

  /**
   * Creates the acker for a client that wants the events that were acknowledged.
   *
   * @param canDrop whether the client's events may be dropped before reaching the broker
   * @param semaphore the pipeline's in-flight event bound, required if {@code canDrop}
   * @param fn the client's callback
   * @return the acker, which must be closed when the client closes
   */
  public ClientGuard<T> createEventAcker(boolean canDrop, EventSemaphore semaphore,
      Consumer<List<T>> fn) {
    requireNonNull(fn, "fn");
    final ClientGuard<T> guard = new ClientGuard<>();
    switch (mode) {
      case NONE:
        return guard.lift(newEventAcker(canDrop, semaphore, (events, acked) -> {
          if (guard.isActive())
            fn.accept(events);
        }));
      case COUNT:
        return guard.lift(newEventAcker(canDrop, semaphore, (events, acked) -> {
          aggregator.onCounts(events.size(), acked);
          if (guard.isActive())
            fn.accept(events);
        }));
      case EVENTS:
      case LAST_EVENTS:
        return guard.lift(newEventAcker(canDrop, semaphore, (events, acked) -> {
          aggregator.onEvents(events, acked);
          if (guard.isActive())
            fn.accept(events);
        }));
      default:
        throw new AssertionError("unknown mode " + mode);
    }
  }

  private ClientAcker<T> newCountAcker(boolean canDrop, EventSemaphore semaphore,
      CountAckCallback callback) {
    if (canDrop)
      return new BoundGapCountClientAcker<>(semaphore, callback);
    return new CountClientAcker<>(callback);
  }

  private ClientAcker<T> newEventAcker(boolean canDrop, EventSemaphore semaphore,
      EventAckCallback<T> callback) {
    return new EventDataClientAcker<>(counter -> newCountAcker(canDrop, semaphore, counter),
        callback);
  }

  /**
   * Hands off a broker acknowledgement to the aggregator, if there is one.
   *
   * @param count the number of newly acknowledged events, across all clients
   */
  public void reportBrokerAck(int count) {
    if (aggregator != null)
      aggregator.reportBrokerAck(count);
  }

  @Override
  public void close() throws InterruptedException, ExecutionException {
    if (aggregator != null)
      aggregator.close();
  }
}
