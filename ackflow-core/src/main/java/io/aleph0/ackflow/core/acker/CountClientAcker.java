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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A counting {@link ClientAcker} for clients whose events are never dropped. Every broker
 * acknowledgement of {@code n} events is reported as {@code n} total, {@code n} acknowledged.
 *
 * @param <T> the event type
 */
public class CountClientAcker<T> implements ClientAcker<T> {
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final CountAckCallback callback;

  public CountClientAcker(CountAckCallback callback) {
    this.callback = requireNonNull(callback, "callback");
  }

  @Override
  public boolean addEvent(T event, boolean published) {
    return !closed.get();
  }

  @Override
  public void ackEvents(int n) throws InterruptedException {
    if (n < 0)
      throw new IllegalArgumentException("n must be greater than or equal to 0");
    if (n == 0)
      return;
    callback.onAck(n, n);
  }

  @Override
  public void close() {
    closed.set(true);
  }
}
