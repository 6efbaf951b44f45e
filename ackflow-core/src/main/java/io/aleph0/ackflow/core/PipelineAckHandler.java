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

import java.util.List;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * The pipeline-wide acknowledgement handler configuration. Each slot is optional, but at most one
 * of them may be populated for the configuration to be usable. See {@link AckMode#of}.
 * 
 * <p>
 * Callbacks are invoked from the aggregator's worker thread, one at a time. Any exception thrown
 * by a callback stops the aggregator.
 * 
 * @param <T> the event type
 */
public record PipelineAckHandler<T>(
    /**
     * Receives the total number of events, acknowledged and dropped, covered by one broker
     * acknowledgement.
     */
    IntConsumer ackCount,

    /**
     * Receives all events covered by one broker acknowledgement.
     */
    Consumer<List<T>> ackEvents,

    /**
     * Receives the last event of each report covered by one broker acknowledgement.
     */
    Consumer<List<T>> ackLastEvents) {

  public static <T> PipelineAckHandler<T> none() {
    return new PipelineAckHandler<>(null, null, null);
  }

  public static <T> PipelineAckHandler<T> ofCount(IntConsumer ackCount) {
    if (ackCount == null)
      throw new NullPointerException("ackCount");
    return new PipelineAckHandler<>(ackCount, null, null);
  }

  public static <T> PipelineAckHandler<T> ofEvents(Consumer<List<T>> ackEvents) {
    if (ackEvents == null)
      throw new NullPointerException("ackEvents");
    return new PipelineAckHandler<>(null, ackEvents, null);
  }

  public static <T> PipelineAckHandler<T> ofLastEvents(Consumer<List<T>> ackLastEvents) {
    if (ackLastEvents == null)
      throw new NullPointerException("ackLastEvents");
    return new PipelineAckHandler<>(null, null, ackLastEvents);
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /**
   * Collects handler slots one at a time. The builder does not validate the combination; that
   * happens when an aggregator is built from the resulting configuration.
   */
  public static class Builder<T> {
    private IntConsumer ackCount;
    private Consumer<List<T>> ackEvents;
    private Consumer<List<T>> ackLastEvents;

    public Builder<T> setAckCount(IntConsumer ackCount) {
      this.ackCount = ackCount;
      return this;
    }

    public Builder<T> setAckEvents(Consumer<List<T>> ackEvents) {
      this.ackEvents = ackEvents;
      return this;
    }

    public Builder<T> setAckLastEvents(Consumer<List<T>> ackLastEvents) {
      this.ackLastEvents = ackLastEvents;
      return this;
    }

    public PipelineAckHandler<T> build() {
      return new PipelineAckHandler<>(ackCount, ackEvents, ackLastEvents);
    }
  }
}
