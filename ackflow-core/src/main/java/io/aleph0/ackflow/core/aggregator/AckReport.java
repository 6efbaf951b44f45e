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

import static java.util.Objects.requireNonNull;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * One client contribution to an aggregation cycle. The submitting thread parks on
 * {@link #await()} until the worker either accounts for the report or abandons it at shutdown.
 *
 * @param <T> the event type
 */
final class AckReport<T> implements Sequenced {
  private final long sequence;
  private final List<T> events;
  private final int total;
  private final int acked;
  private final CountDownLatch completion = new CountDownLatch(1);
  private volatile boolean abandoned = false;

  AckReport(long sequence, List<T> events, int total, int acked) {
    this.sequence = sequence;
    this.events = requireNonNull(events);
    this.total = total;
    this.acked = acked;
  }

  @Override
  public long sequence() {
    return sequence;
  }

  public List<T> events() {
    return events;
  }

  public int total() {
    return total;
  }

  public int acked() {
    return acked;
  }

  /**
   * A report with no acknowledged events only carries dropped events. It consumes no broker credit.
   */
  public boolean isDroppedOnly() {
    return acked == 0;
  }

  void complete() {
    completion.countDown();
  }

  void abandon() {
    abandoned = true;
    completion.countDown();
  }

  /**
   * Waits until the worker has accounted for this report.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the aggregator closed before accounting for this report
   */
  void await() throws InterruptedException {
    completion.await();
    if (abandoned)
      throw new IllegalStateException("closed");
  }

  @Override
  public String toString() {
    return "AckReport[sequence=" + sequence + ", total=" + total + ", acked=" + acked + "]";
  }
}
