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
package io.aleph0.ackflow.core.build;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import io.aleph0.ackflow.core.AckMode;
import io.aleph0.ackflow.core.PipelineAckHandler;
import io.aleph0.ackflow.core.acker.ClientAcker;
import io.aleph0.ackflow.core.acker.ClientGuard;
import io.aleph0.ackflow.core.acker.EventSemaphore;

@Timeout(10)
class ClientAckerFactoryTest {
  private ExecutorService clients;
  private BlockingQueue<Integer> pipelineCounts;
  private BlockingQueue<List<String>> pipelineEvents;

  @BeforeEach
  void setupBeforeEach() {
    clients = Executors.newCachedThreadPool();
    pipelineCounts = new LinkedBlockingQueue<>();
    pipelineEvents = new LinkedBlockingQueue<>();
  }

  @AfterEach
  void cleanupAfterEach() {
    clients.shutdownNow();
  }

  @Test
  void givenNoHandler_whenCreateAckers_thenOnlyClientCallbacksInvoked() throws Exception {
    try (ClientAckerFactory<String> factory = ClientAckerFactory.create(PipelineAckHandler.none())) {
      assertThat(factory.getMode()).isEqualTo(AckMode.NONE);
      assertThat(factory.aggregator()).isEmpty();

      final BlockingQueue<Integer> clientCounts = new LinkedBlockingQueue<>();
      final ClientGuard<String> acker = factory.createCountAcker(false, null, clientCounts::add);

      acker.addEvent("a", true);
      acker.addEvent("b", true);
      factory.reportBrokerAck(2);
      acker.ackEvents(2);

      assertThat(clientCounts).containsExactly(2);

      final ClientAcker<String> pipeline = factory.createPipelineAcker(false, null);
      assertThat(pipeline.addEvent("c", true)).isTrue();
      pipeline.ackEvents(1);
    }
  }

  @Test
  void givenCountHandler_whenTwoClientsShareBrokerAck_thenPipelineSeesOneBatch()
      throws Exception {
    try (ClientAckerFactory<String> factory =
        ClientAckerFactory.create(PipelineAckHandler.ofCount(pipelineCounts::add))) {
      // Arrange
      final BlockingQueue<Integer> countsA = new LinkedBlockingQueue<>();
      final BlockingQueue<Integer> countsB = new LinkedBlockingQueue<>();
      final ClientGuard<String> a = factory.createCountAcker(false, null, countsA::add);
      final ClientGuard<String> b = factory.createCountAcker(false, null, countsB::add);
      a.addEvent("a1", true);
      b.addEvent("b1", true);
      a.addEvent("a2", true);

      // Act
      factory.reportBrokerAck(3);
      final Future<?> ackA = clients.submit(() -> {
        a.ackEvents(2);
        return null;
      });
      b.ackEvents(1);
      ackA.get();

      // Assert
      assertThat(pipelineCounts.poll(1, TimeUnit.SECONDS)).isEqualTo(3);
      assertThat(countsA).containsExactly(2);
      assertThat(countsB).containsExactly(1);
    }
  }

  @Test
  void givenClosedClient_whenItsEventsAcked_thenPipelineCountedButClientSilent()
      throws Exception {
    try (ClientAckerFactory<String> factory =
        ClientAckerFactory.create(PipelineAckHandler.ofCount(pipelineCounts::add))) {
      final BlockingQueue<Integer> clientCounts = new LinkedBlockingQueue<>();
      final ClientGuard<String> acker = factory.createCountAcker(false, null, clientCounts::add);
      acker.addEvent("a", true);

      acker.close();
      factory.reportBrokerAck(1);
      acker.ackEvents(1);

      assertThat(pipelineCounts.poll(1, TimeUnit.SECONDS)).isEqualTo(1);
      assertThat(clientCounts).isEmpty();
      assertThat(acker.isActive()).isFalse();
    }
  }

  @Test
  void givenEventsHandler_whenDroppableClientDropsAndPublishes_thenEventsFlowInOrder()
      throws Exception {
    try (ClientAckerFactory<String> factory =
        ClientAckerFactory.create(PipelineAckHandler.ofEvents(pipelineEvents::add))) {
      // Arrange
      final EventSemaphore semaphore = new EventSemaphore(8);
      final BlockingQueue<List<String>> clientEvents = new LinkedBlockingQueue<>();
      final ClientGuard<String> acker =
          factory.createEventAcker(true, semaphore, clientEvents::add);

      // Act
      acker.addEvent("x", false);
      acker.addEvent("a", true);
      acker.addEvent("y", false);
      factory.reportBrokerAck(1);
      acker.ackEvents(1);

      // Assert
      assertThat(pipelineEvents.poll(1, TimeUnit.SECONDS)).containsExactly("x");
      assertThat(pipelineEvents.poll(1, TimeUnit.SECONDS)).containsExactly("a", "y");
      assertThat(clientEvents).containsExactly(List.of("x"), List.of("a", "y"));
      assertThat(semaphore.available()).isEqualTo(8);
    }
  }

  @Test
  void givenLastEventsHandler_whenPipelineAckerUsed_thenLastEventPerReportDelivered()
      throws Exception {
    try (ClientAckerFactory<String> factory =
        ClientAckerFactory.create(PipelineAckHandler.ofLastEvents(pipelineEvents::add))) {
      final ClientAcker<String> acker = factory.createPipelineAcker(false, null);
      acker.addEvent("a", true);
      acker.addEvent("b", true);

      factory.reportBrokerAck(2);
      acker.ackEvents(2);

      assertThat(pipelineEvents.poll(1, TimeUnit.SECONDS)).containsExactly("b");
    }
  }

  @Test
  void givenEventsHandler_whenCountClientAcked_thenClientGetsTotalAndPipelineGetsEvents()
      throws Exception {
    try (ClientAckerFactory<String> factory =
        ClientAckerFactory.create(PipelineAckHandler.ofEvents(pipelineEvents::add))) {
      final EventSemaphore semaphore = new EventSemaphore(4);
      final BlockingQueue<Integer> clientCounts = new LinkedBlockingQueue<>();
      final ClientGuard<String> acker =
          factory.createCountAcker(true, semaphore, clientCounts::add);
      acker.addEvent("a", true);
      acker.addEvent("x", false);

      factory.reportBrokerAck(1);
      acker.ackEvents(1);

      assertThat(pipelineEvents.poll(1, TimeUnit.SECONDS)).containsExactly("a", "x");
      assertThat(clientCounts).containsExactly(2);
    }
  }
}
