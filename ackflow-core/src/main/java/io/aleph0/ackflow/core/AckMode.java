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
package io.aleph0.ackflow.core;

/**
 * The shape in which the pipeline-wide acknowledgement handler is notified. Exactly one mode is
 * active for the lifetime of an aggregator, and it is derived from which slot of the
 * {@link PipelineAckHandler} is populated.
 */
public enum AckMode {
  /**
   * No pipeline-wide handler. Client ackers run standalone.
   */
  NONE,

  /**
   * The handler receives the total number of events covered by each broker acknowledgement.
   */
  COUNT,

  /**
   * The handler receives every acknowledged or dropped event covered by each broker
   * acknowledgement, in the order the reports were collected.
   */
  EVENTS,

  /**
   * The handler receives only the last event of each non-empty report collected for a broker
   * acknowledgement.
   */
  LAST_EVENTS;

  /**
   * Selects the mode for the given handler configuration.
   * 
   * @param handler the handler configuration
   * @return the mode, {@link #NONE} if no slot is populated
   * @throws NullPointerException if handler is {@code null}
   * @throws IllegalArgumentException if more than one slot is populated
   */
  public static AckMode of(PipelineAckHandler<?> handler) {
    if (handler == null)
      throw new NullPointerException("handler");

    AckMode result = NONE;
    if (handler.ackCount() != null)
      result = COUNT;
    if (handler.ackEvents() != null) {
      if (result != NONE)
        throw new IllegalArgumentException("only one callback can be set");
      result = EVENTS;
    }
    if (handler.ackLastEvents() != null) {
      if (result != NONE)
        throw new IllegalArgumentException("only one callback can be set");
      result = LAST_EVENTS;
    }

    return result;
  }
}
