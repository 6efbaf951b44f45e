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

/**
 * Tracks the events one client has handed to the pipeline and turns the broker's acknowledgements
 * for that client into reports. Events must be added in publish order, from one thread at a time.
 *
 * @param <T> the event type
 */
public interface ClientAcker<T> {
  /**
   * Returns a {@link ClientAcker} that tracks nothing and reports nothing.
   */
  public static <T> ClientAcker<T> nop() {
    return new NopClientAcker<>();
  }

  /**
   * Registers the next event published by the client.
   *
   * @param event the event
   * @param published {@code true} if the event was handed to the broker, or {@code false} if it was
   *        dropped and will never be acknowledged by the broker
   * @return {@code true} if the event was registered, or {@code false} if the acker is closed
   * @throws InterruptedException if interrupted while waiting for room in the pipeline
   */
  public boolean addEvent(T event, boolean published) throws InterruptedException;

  /**
   * Acknowledges the next {@code n} published events of this client.
   *
   * @param n the number of published events acknowledged by the broker
   * @throws InterruptedException if interrupted while handing off the resulting report
   * @throws IllegalArgumentException if n is negative
   * @throws IllegalStateException if more events are acknowledged than are outstanding
   */
  public void ackEvents(int n) throws InterruptedException;

  /**
   * Stops accepting new events. Acknowledgements for events already registered are still
   * reported.
   */
  public void close();
}
