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

import java.util.List;

/**
 * Receives one acknowledgement report for a client, with the events themselves.
 */
@FunctionalInterface
public interface EventAckCallback<T> {
  /**
   * @param events the client's events covered, acknowledged and dropped, in publish order
   * @param acked the number of those events acknowledged by the broker
   * @throws InterruptedException if interrupted while handing off the report
   */
  public void onAck(List<T> events, int acked) throws InterruptedException;
}
