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

/**
 * A {@link GapCountClientAcker} that takes one permit from the pipeline's {@link EventSemaphore}
 * for every registered event, and gives back all permits covered by a report before passing the
 * report on.
 *
 * @param <T> the event type
 */
public class BoundGapCountClientAcker<T> implements ClientAcker<T> {
  private final EventSemaphore semaphore;
  private final GapCountClientAcker<T> acker;

  public BoundGapCountClientAcker(EventSemaphore semaphore, CountAckCallback callback) {
    this.semaphore = requireNonNull(semaphore, "semaphore");
    requireNonNull(callback, "callback");
    this.acker = new GapCountClientAcker<>((total, acked) -> {
      semaphore.release(total);
      callback.onAck(total, acked);
    });
  }

  @Override
  public boolean addEvent(T event, boolean published) throws InterruptedException {
    semaphore.acquire();
    final boolean result = acker.addEvent(event, published);
    if (!result)
      semaphore.release(1);
    return result;
  }

  @Override
  public void ackEvents(int n) throws InterruptedException {
    acker.ackEvents(n);
  }

  @Override
  public void close() {
    acker.close();
  }
}
