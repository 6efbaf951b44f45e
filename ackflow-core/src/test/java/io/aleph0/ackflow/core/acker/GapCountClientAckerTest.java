package io.aleph0.ackflow.core.acker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GapCountClientAckerTest {
  static record Report(int total, int acked) {
  }

  private List<Report> reports;
  private GapCountClientAcker<String> acker;

  @BeforeEach
  void setupBeforeEach() {
    reports = new ArrayList<>();
    acker = new GapCountClientAcker<>((total, acked) -> reports.add(new Report(total, acked)));
  }

  @Test
  void givenPublishedEvents_whenAckEvents_thenReportsAckedCount() throws Exception {
    acker.addEvent("a", true);
    acker.addEvent("b", true);
    acker.addEvent("c", true);

    acker.ackEvents(2);
    acker.ackEvents(1);

    assertThat(reports).containsExactly(new Report(2, 2), new Report(1, 1));
  }

  @Test
  void givenNothingOutstanding_whenDropped_thenReportedImmediately() throws Exception {
    acker.addEvent("a", false);

    assertThat(reports).containsExactly(new Report(1, 0));
  }

  @Test
  void givenDroppedAfterPublished_whenPublishedAcked_thenDroppedReportedWithThem()
      throws Exception {
    // Arrange
    acker.addEvent("a", true);
    acker.addEvent("b", true);
    acker.addEvent("x", false);
    acker.addEvent("y", false);
    acker.addEvent("c", true);

    // Act
    acker.ackEvents(1);

    // Assert
    assertThat(reports).containsExactly(new Report(1, 1));

    // Act
    acker.ackEvents(2);

    // Assert
    assertThat(reports).containsExactly(new Report(1, 1), new Report(4, 2));
  }

  @Test
  void givenTrailingDropped_whenAllPublishedAcked_thenTrailingDroppedIncluded() throws Exception {
    acker.addEvent("a", true);
    acker.addEvent("x", false);

    acker.ackEvents(1);

    assertThat(reports).containsExactly(new Report(2, 1));

    acker.addEvent("y", false);

    assertThat(reports).containsExactly(new Report(2, 1), new Report(1, 0));
  }

  @Test
  void givenTooFewOutstanding_whenAckEvents_thenThrowsIllegalStateException() throws Exception {
    acker.addEvent("a", true);

    assertThatThrownBy(() -> acker.ackEvents(2)).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> acker.ackEvents(-1)).isInstanceOf(IllegalArgumentException.class);

    acker.ackEvents(1);

    assertThat(reports).containsExactly(new Report(1, 1));
  }

  @Test
  void givenZero_whenAckEvents_thenNothingReported() throws Exception {
    acker.addEvent("a", true);

    acker.ackEvents(0);

    assertThat(reports).isEmpty();
  }

  @Test
  void givenClosed_whenAddEvent_thenFalseButOutstandingStillReported() throws Exception {
    acker.addEvent("a", true);

    acker.close();

    assertThat(acker.addEvent("b", true)).isFalse();

    acker.ackEvents(1);

    assertThat(reports).containsExactly(new Report(1, 1));
  }
}
