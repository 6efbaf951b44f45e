package io.aleph0.ackflow.core.acker;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BoundGapCountClientAckerTest {
  @Test
  void givenEvents_whenReported_thenPermitsReturnedBeforeCallback() throws Exception {
    // Arrange
    final EventSemaphore semaphore = new EventSemaphore(4);
    final List<Integer> availableAtCallback = new ArrayList<>();
    final BoundGapCountClientAcker<String> acker = new BoundGapCountClientAcker<>(semaphore,
        (total, acked) -> availableAtCallback.add(semaphore.available()));

    // Act
    acker.addEvent("a", true);
    acker.addEvent("x", false);
    acker.addEvent("b", true);

    // Assert
    assertThat(semaphore.available()).isEqualTo(1);

    // Act
    acker.ackEvents(2);

    // Assert
    assertThat(availableAtCallback).containsExactly(4);
    assertThat(semaphore.available()).isEqualTo(4);
  }

  @Test
  void givenDroppedWithNothingOutstanding_whenAdded_thenPermitReturnedImmediately()
      throws Exception {
    final EventSemaphore semaphore = new EventSemaphore(1);
    final BoundGapCountClientAcker<String> acker =
        new BoundGapCountClientAcker<>(semaphore, (total, acked) -> {
        });

    acker.addEvent("x", false);
    acker.addEvent("y", false);

    assertThat(semaphore.available()).isEqualTo(1);
  }

  @Test
  void givenClosed_whenAddEvent_thenPermitNotKept() throws Exception {
    final EventSemaphore semaphore = new EventSemaphore(2);
    final BoundGapCountClientAcker<String> acker =
        new BoundGapCountClientAcker<>(semaphore, (total, acked) -> {
        });

    acker.close();

    assertThat(acker.addEvent("a", true)).isFalse();
    assertThat(semaphore.available()).isEqualTo(2);
  }
}
