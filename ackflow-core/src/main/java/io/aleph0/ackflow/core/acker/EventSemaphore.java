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
package io.aleph0.ackflow.core.acker;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import io.aleph0.ackflow.core.Measureable;

/**
 * Bounds the number of events that have been handed to the pipeline but not yet reported by a
 * client acker. One instance is shared by every droppable client acker in a pipeline, and is
 * injected into each at construction time.
 */
public class EventSemaphore implements Measureable<EventSemaphore.Metrics> {
  public static record Metrics(
      /**
       * The number of permits acquired, one per event.
       */
      long acquired,

      /**
       * The number of permits released.
       */
      long released,

      /**
       * The number of times an acquire had to wait for a permit.
       */
      long stalls,

      /**
       * The number of events currently in flight.
       */
      long inFlight) {
    public Metrics {
      if (acquired < 0)
        throw new IllegalArgumentException("acquired must be greater than or equal to 0");
      if (released < 0)
        throw new IllegalArgumentException("released must be greater than or equal to 0");
      if (stalls < 0)
        throw new IllegalArgumentException("stalls must be greater than or equal to 0");
      if (inFlight < 0)
        throw new IllegalArgumentException("inFlight must be greater than or equal to 0");
    }
  }

  private final AtomicLong acquiredMetric = new AtomicLong(0);
  private final AtomicLong releasedMetric = new AtomicLong(0);
  private final AtomicLong stallsMetric = new AtomicLong(0);
  private final int capacity;
  private final Semaphore permits;

  public EventSemaphore(int capacity) {
    if (capacity <= 0)
      throw new IllegalArgumentException("capacity must be greater than 0");
    this.capacity = capacity;
    this.permits = new Semaphore(capacity);
  }

  public int getCapacity() {
    return capacity;
  }

  /**
   * Acquires one permit, waiting if the pipeline is full.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void acquire() throws InterruptedException {
    if (!permits.tryAcquire()) {
      stallsMetric.incrementAndGet();
      permits.acquire();
    }
    acquiredMetric.incrementAndGet();
  }

  /**
   * Releases the given number of permits.
   *
   * @param n the number of events reported
   * @throws IllegalArgumentException if n is negative
   */
  public void release(int n) {
    if (n < 0)
      throw new IllegalArgumentException("n must be greater than or equal to 0");
    if (n == 0)
      return;
    permits.release(n);
    releasedMetric.addAndGet(n);
  }

  public int available() {
    return permits.availablePermits();
  }

  @Override
  public Metrics checkMetrics() {
    final long acquired = acquiredMetric.get();
    final long released = releasedMetric.get();
    final long stalls = stallsMetric.get();
    final long inFlight = Math.max(0, capacity - permits.availablePermits());
    return new Metrics(acquired, released, stalls, inFlight);
  }

  @Override
  public Metrics flushMetrics() {
    final Metrics metrics = checkMetrics();
    acquiredMetric.set(0);
    releasedMetric.set(0);
    stallsMetric.set(0);
    return metrics;
  }
}
