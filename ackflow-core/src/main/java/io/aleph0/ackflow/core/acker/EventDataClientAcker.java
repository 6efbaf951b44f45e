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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A {@link ClientAcker} that retains the client's events so that reports can carry the events
 * themselves rather than just counts. Counting is delegated to an inner acker, built from the given
 * factory, which decides how many events each report covers. The events covered by a report are
 * always the oldest retained ones, since published and dropped events are reported in publish
 * order.
 *
 * @param <T> the event type
 */
public class EventDataClientAcker<T> implements ClientAcker<T> {
  /**
   * Lock for synchronizing access to the retained events.
   */
  private final ReentrantLock lock = new ReentrantLock();

  private final ArrayDeque<T> events = new ArrayDeque<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final EventAckCallback<T> callback;
  private final ClientAcker<T> acker;

  /**
   * @param counter builds the inner counting acker around the given count callback
   * @param callback receives the events covered by each report
   */
  public EventDataClientAcker(Function<CountAckCallback, ClientAcker<T>> counter,
      EventAckCallback<T> callback) {
    requireNonNull(counter, "counter");
    this.callback = requireNonNull(callback, "callback");
    this.acker = requireNonNull(counter.apply(this::onCounts), "acker");
  }

  @Override
  public boolean addEvent(T event, boolean published) throws InterruptedException {
    if (event == null)
      throw new NullPointerException("event");
    if (closed.get())
      return false;

    // Retain first. The inner acker may report a dropped event before it returns.
    lock.lock();
    try {
      events.addLast(event);
    } finally {
      lock.unlock();
    }

    final boolean result = acker.addEvent(event, published);
    if (!result) {
      lock.lock();
      try {
        events.pollLast();
      } finally {
        lock.unlock();
      }
    }

    return result;
  }

  @Override
  public void ackEvents(int n) throws InterruptedException {
    acker.ackEvents(n);
  }

  private void onCounts(int total, int acked) throws InterruptedException {
    final List<T> covered = new ArrayList<>(total);
    lock.lock();
    try {
      if (total > events.size())
        throw new IllegalStateException(
            "report covers " + total + " events, but only " + events.size() + " retained");
      for (int i = 0; i < total; i++)
        covered.add(events.pollFirst());
    } finally {
      lock.unlock();
    }

    callback.onAck(unmodifiableList(covered), acked);
  }

  @Override
  public void close() {
    closed.set(true);
    acker.close();
  }
}
