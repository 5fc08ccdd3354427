package io.tenderbridge.backend.tender;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class TenderStateMachineTest {

  private static final Map<TenderStatus, Set<TenderStatus>> EXPECTED =
      Map.of(
          TenderStatus.DRAFT, EnumSet.of(TenderStatus.PUBLISHED, TenderStatus.CANCELLED),
          TenderStatus.PUBLISHED, EnumSet.of(TenderStatus.OPEN, TenderStatus.CANCELLED),
          TenderStatus.OPEN,
              EnumSet.of(TenderStatus.EVALUATION, TenderStatus.CLOSED, TenderStatus.CANCELLED),
          TenderStatus.EVALUATION,
              EnumSet.of(TenderStatus.AWARDED, TenderStatus.OPEN, TenderStatus.CANCELLED),
          TenderStatus.CLOSED, EnumSet.of(TenderStatus.EVALUATION, TenderStatus.CANCELLED),
          TenderStatus.AWARDED, EnumSet.noneOf(TenderStatus.class),
          TenderStatus.CANCELLED, EnumSet.noneOf(TenderStatus.class));

  @Test
  void validateTransition_matchesTableForEveryPair() {
    for (var from : TenderStatus.values()) {
      for (var to : TenderStatus.values()) {
        var result = TenderStateMachine.validateTransition(from, to, "reason");

        if (from == to) {
          assertThat(result.valid()).as("%s -> %s", from, to).isTrue();
          assertThat(result.unchanged()).isTrue();
        } else if (EXPECTED.get(from).contains(to)) {
          assertThat(result.valid()).as("%s -> %s", from, to).isTrue();
          assertThat(result.unchanged()).isFalse();
        } else {
          assertThat(result.valid()).as("%s -> %s", from, to).isFalse();
          assertThat(result.message())
              .contains("Allowed: " + TenderStateMachine.allowedValues(from));
        }
      }
    }
  }

  @ParameterizedTest
  @EnumSource(
      value = TenderStatus.class,
      names = {"DRAFT", "PUBLISHED", "OPEN", "EVALUATION", "CLOSED"})
  void cancel_withoutReason_isRejected(TenderStatus from) {
    assertThat(TenderStateMachine.validateTransition(from, TenderStatus.CANCELLED, null).valid())
        .isFalse();
    var blank = TenderStateMachine.validateTransition(from, TenderStatus.CANCELLED, "   ");
    assertThat(blank.valid()).isFalse();
    assertThat(blank.message()).isEqualTo("Cancellation requires a reason");
  }

  @Test
  void cancel_fromCancelled_withoutReason_isUnchanged() {
    var result =
        TenderStateMachine.validateTransition(TenderStatus.CANCELLED, TenderStatus.CANCELLED, null);

    assertThat(result.valid()).isTrue();
    assertThat(result.unchanged()).isTrue();
  }

  @Test
  void cancel_fromAwarded_isRejectedEvenWithReason() {
    var result =
        TenderStateMachine.validateTransition(
            TenderStatus.AWARDED, TenderStatus.CANCELLED, "too late");

    assertThat(result.valid()).isFalse();
    assertThat(result.message()).contains("Allowed: []");
  }

  @Test
  void rejectedMessage_listsAllowedTargets() {
    var result =
        TenderStateMachine.validateTransition(TenderStatus.DRAFT, TenderStatus.OPEN, null);

    assertThat(result.message())
        .isEqualTo("Cannot transition from 'draft' to 'open'. Allowed: [published, cancelled]");
  }

  @Test
  void derivedPredicates() {
    assertThat(TenderStateMachine.canReceiveBids(TenderStatus.OPEN)).isTrue();
    assertThat(TenderStateMachine.canReceiveBids(TenderStatus.PUBLISHED)).isFalse();
    assertThat(TenderStateMachine.canEdit(TenderStatus.DRAFT)).isTrue();
    assertThat(TenderStateMachine.canEdit(TenderStatus.PUBLISHED)).isTrue();
    assertThat(TenderStateMachine.canEdit(TenderStatus.OPEN)).isFalse();
    assertThat(TenderStateMachine.canAward(TenderStatus.EVALUATION)).isTrue();
    assertThat(TenderStateMachine.canAward(TenderStatus.CLOSED)).isFalse();
    assertThat(TenderStateMachine.isTerminal(TenderStatus.AWARDED)).isTrue();
    assertThat(TenderStateMachine.isTerminal(TenderStatus.CANCELLED)).isTrue();
    assertThat(TenderStateMachine.isTerminal(TenderStatus.EVALUATION)).isFalse();
    assertThat(TenderStateMachine.canEvaluateBids(TenderStatus.CLOSED)).isTrue();
    assertThat(TenderStateMachine.canEvaluateBids(TenderStatus.EVALUATION)).isTrue();
    assertThat(TenderStateMachine.canEvaluateBids(TenderStatus.OPEN)).isFalse();
    assertThat(TenderStateMachine.canReceiveQuestions(TenderStatus.PUBLISHED)).isTrue();
    assertThat(TenderStateMachine.canReceiveQuestions(TenderStatus.OPEN)).isTrue();
    assertThat(TenderStateMachine.canReceiveQuestions(TenderStatus.DRAFT)).isFalse();
    assertThat(TenderStateMachine.canReceiveQuestions(TenderStatus.CLOSED)).isFalse();
  }
}
