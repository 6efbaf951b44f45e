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

import static java.util.Objects.requireNonNull;
import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A counting {@link ClientAcker} for clients whose events may be dropped by the output before they
 * reach the broker. Dropped events are never acknowledged by the broker, so they are reported
 * together with the published events they follow.
 *
 * <p>
 * Internally, the acker keeps an ordered list of gaps. Each gap is a run of published events
 * followed by a run of dropped events:
 *
 * <pre>
 *     [ P P P d d ] [ P d ] [ P P ]
 *       gap 1         gap 2   gap 3
 * </pre>
 *
 * <p>
 * When the broker acknowledges {@code n} events, the acker consumes {@code n} published events from
 * the head of the list. Every gap whose published events are all acknowledged is retired along
 * with its dropped events, and the report covers both. A dropped event registered while nothing is
 * outstanding is reported immediately as a dropped-only report, with zero acknowledged events.
 *
 * <p>
 * Reports are delivered on the calling thread, after the gap list lock has been released, and one
 * at a time. A dropped event registered while a report is being delivered waits for that delivery
 * to finish, so it can never overtake the events of the report ahead of it.
 *
 * @param <T> the event type
 */
public class GapCountClientAcker<T> implements ClientAcker<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(GapCountClientAcker.class);

  private static class Gap {
    private int published;
    private int dropped;

    public Gap(int published) {
      this.published = published;
    }
  }

  /**
   * Lock for synchronizing access to the gap list.
   */
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Held from the moment a report is computed until its callback returns, so that reports leave
   * this acker in the order they were computed. Always acquired before {@link #lock}.
   */
  private final ReentrantLock reportLock = new ReentrantLock();

  private final ArrayDeque<Gap> gaps = new ArrayDeque<>();

  /**
   * The number of published events registered but not yet acknowledged.
   */
  private int outstanding = 0;

  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CountAckCallback callback;

  public GapCountClientAcker(CountAckCallback callback) {
    this.callback = requireNonNull(callback, "callback");
  }

  @Override
  public boolean addEvent(T event, boolean published) throws InterruptedException {
    if (closed.get())
      return false;

    if (published) {
      lock.lock();
      try {
        final Gap last = gaps.peekLast();
        if (last == null || last.dropped > 0)
          gaps.addLast(new Gap(1));
        else
          last.published = last.published + 1;
        outstanding = outstanding + 1;
      } finally {
        lock.unlock();
      }
      return true;
    }

    // A drop may have to be reported on its own, so it waits for any report in flight.
    reportLock.lockInterruptibly();
    try {
      boolean reportDropped = false;
      lock.lock();
      try {
        final Gap last = gaps.peekLast();
        if (last == null)
          reportDropped = true;
        else
          last.dropped = last.dropped + 1;
      } finally {
        lock.unlock();
      }

      if (reportDropped) {
        LOGGER.atDebug().log("Dropped event with nothing outstanding. Reporting immediately...");
        callback.onAck(1, 0);
      }
    } finally {
      reportLock.unlock();
    }

    return true;
  }

  @Override
  public void ackEvents(int n) throws InterruptedException {
    if (n < 0)
      throw new IllegalArgumentException("n must be greater than or equal to 0");

    reportLock.lockInterruptibly();
    try {
      int total = 0;
      int acked = 0;
      lock.lock();
      try {
        if (n > outstanding)
          throw new IllegalStateException(
              "acknowledged " + n + " events, but only " + outstanding + " outstanding");

        int remaining = n;
        while (remaining > 0) {
          final Gap head = gaps.peekFirst();
          final int taken = Math.min(remaining, head.published);
          head.published = head.published - taken;
          remaining = remaining - taken;
          acked = acked + taken;
          total = total + taken;
          if (head.published == 0) {
            total = total + head.dropped;
            gaps.pollFirst();
          }
        }
        outstanding = outstanding - acked;
      } finally {
        lock.unlock();
      }

      if (total == 0)
        return;

      LOGGER.atDebug().addKeyValue("total", total).addKeyValue("acked", acked).log("ackEvents");

      callback.onAck(total, acked);
    } finally {
      reportLock.unlock();
    }
  }

  @Override
  public void close() {
    closed.set(true);
  }
}
