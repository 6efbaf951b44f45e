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
 * Guards a client's own acknowledgement callback against being invoked after the client has been
 * closed. The guard is created first, so that the callbacks built around it can check
 * {@link #isActive()}, and is then {@link #lift(ClientAcker) lifted} onto the acker that invokes
 * those callbacks.
 *
 * <p>
 * Closing the guard only silences the client's callback. Acknowledgements for events the client
 * already published keep flowing to the inner acker, and on to the pipeline-wide aggregator, so
 * that accounting for other clients stays correct.
 *
 * @param <T> the event type
 */
public class ClientGuard<T> implements ClientAcker<T> {
  private final AtomicBoolean active = new AtomicBoolean(true);
  private volatile ClientAcker<T> acker = ClientAcker.nop();

  /**
   * Returns {@code true} until the client is closed, and {@code false} forever after.
   */
  public boolean isActive() {
    return active.get();
  }

  /**
   * Marks the client inactive. Idempotent.
   */
  public void deactivate() {
    active.set(false);
  }

  /**
   * Sets the acker this guard delegates to.
   *
   * @param acker the inner acker
   * @return this guard
   */
  public ClientGuard<T> lift(ClientAcker<T> acker) {
    this.acker = requireNonNull(acker, "acker");
    return this;
  }

  @Override
  public boolean addEvent(T event, boolean published) throws InterruptedException {
    return acker.addEvent(event, published);
  }

  @Override
  public void ackEvents(int n) throws InterruptedException {
    acker.ackEvents(n);
  }

  @Override
  public void close() {
    deactivate();
    acker.close();
  }
}
