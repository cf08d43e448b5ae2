package com.example.draft.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SnakeOrderTest {

  @Test
  void oddRoundsRunForwardAndEvenRoundsReverse() {
    assertThat(SnakeOrder.getParticipantForPick(1, 12)).isZero();
    assertThat(SnakeOrder.getParticipantForPick(12, 12)).isEqualTo(11);
    assertThat(SnakeOrder.getParticipantForPick(13, 12)).isEqualTo(11);
    assertThat(SnakeOrder.getParticipantForPick(24, 12)).isZero();
    assertThat(SnakeOrder.getParticipantForPick(25, 12)).isZero();
  }

  @Test
  void roundAndPickInRoundFollowPickNumber() {
    assertThat(SnakeOrder.getRoundForPick(1, 12)).isEqualTo(1);
    assertThat(SnakeOrder.getRoundForPick(12, 12)).isEqualTo(1);
    assertThat(SnakeOrder.getRoundForPick(13, 12)).isEqualTo(2);
    assertThat(SnakeOrder.getRoundForPick(216, 12)).isEqualTo(18);
    assertThat(SnakeOrder.getPickInRound(13, 12)).isEqualTo(1);
    assertThat(SnakeOrder.getPickInRound(24, 12)).isEqualTo(12);
  }

  @Test
  void everyParticipantPicksOncePerRound() {
    for (int round = 1; round <= 18; round++) {
      final List<Integer> seen = new ArrayList<>();
      for (int slot = 1; slot <= 12; slot++) {
        seen.add(SnakeOrder.getParticipantForPick((round - 1) * 12 + slot, 12));
      }
      assertThat(seen).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
    }
  }

  @Test
  void formatsAndParsesPickLabels() {
    assertThat(SnakeOrder.formatPickNumber(1, 12)).isEqualTo("1.01");
    assertThat(SnakeOrder.formatPickNumber(13, 12)).isEqualTo("2.01");
    assertThat(SnakeOrder.formatPickNumber(216, 12)).isEqualTo("18.12");
    assertThat(SnakeOrder.parsePickNumber("2.01", 12)).isEqualTo(13);
    assertThat(SnakeOrder.parsePickNumber("18.12", 12)).isEqualTo(216);
  }

  @Test
  void parseRejectsMalformedLabels() {
    assertThatThrownBy(() -> SnakeOrder.parsePickNumber("2", 12))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnakeOrder.parsePickNumber("x.01", 12))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnakeOrder.parsePickNumber("1.13", 12))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnakeOrder.parsePickNumber(null, 12))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void listsPickNumbersForParticipant() {
    assertThat(SnakeOrder.getPickNumbersForParticipant(0, 12, 4)).containsExactly(1, 24, 25, 48);
    assertThat(SnakeOrder.getPickNumbersForParticipant(11, 12, 3)).containsExactly(12, 13, 36);
  }

  @Test
  void picksUntilTurnCountsFromCurrentPick() {
    assertThat(SnakeOrder.getPicksUntilTurn(1, 0, 12, 18)).isZero();
    assertThat(SnakeOrder.getPicksUntilTurn(2, 0, 12, 18)).isEqualTo(22);
    assertThat(SnakeOrder.getPicksUntilTurn(5, 3, 12, 18)).isEqualTo(16);
  }

  @Test
  void picksUntilTurnReturnsSentinelWhenNoPicksRemain() {
    assertThat(SnakeOrder.getPicksUntilTurn(217, 0, 12, 18))
        .isEqualTo(SnakeOrder.NO_REMAINING_PICK);
    assertThat(SnakeOrder.getPicksUntilTurn(206, 11, 12, 18))
        .isEqualTo(SnakeOrder.NO_REMAINING_PICK);
    assertThat(SnakeOrder.getPicksUntilTurn(216, 0, 12, 18)).isZero();
  }

  @Test
  void rejectsInvalidArguments() {
    assertThatThrownBy(() -> SnakeOrder.getRoundForPick(0, 12))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnakeOrder.getRoundForPick(1, 0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnakeOrder.getPickNumbersForParticipant(12, 12, 18))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
