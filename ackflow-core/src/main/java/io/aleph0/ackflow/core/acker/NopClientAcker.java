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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An implementation of {@link ClientAcker} that does not report anything. This is used for clients
 * without an acknowledgement callback of their own in pipelines without a pipeline-wide handler,
 * where nobody is listening for acknowledgements at all.
 *
 * @param <T> the event type
 */
public class NopClientAcker<T> implements ClientAcker<T> {
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Override
  public boolean addEvent(T event, boolean published) {
    return !closed.get();
  }

  @Override
  public void ackEvents(int n) {
    if (n < 0)
      throw new IllegalArgumentException("n must be greater than or equal to 0");
  }

  @Override
  public void close() {
    closed.set(true);
  }
}
