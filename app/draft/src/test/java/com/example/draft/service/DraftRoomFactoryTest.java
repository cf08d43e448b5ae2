package com.example.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.draft.DraftFixtures;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftStatus;
import com.example.draft.model.Participant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DraftRoomFactoryTest {

  private final DraftRoomFactory factory = new DraftRoomFactory(DraftFixtures.properties());

  @Test
  void offlineRoomHasOneHumanAndElevenBots() {
    final DraftRoom room = factory.offlineRoom("offline");

    assertThat(room.status()).isEqualTo(DraftStatus.PENDING);
    assertThat(room.pickTimeSeconds()).isEqualTo(30);
    assertThat(room.gracePeriodSeconds()).isEqualTo(5);
    assertThat(room.participants()).extracting(Participant::index).containsExactly(
        0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
    assertThat(room.participants().get(0))
        .isEqualTo(new Participant("you", "You", 0, false));
    assertThat(room.participants().get(5))
        .isEqualTo(new Participant("cpu-5", "CPU Team 5", 5, true));
  }

  @Test
  void rejectsDuplicateParticipants() {
    assertThatThrownBy(() -> factory.newRoom("r", "League", List.of("a", "a")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unique");
  }

  @Test
  void rejectsHumanIdsInBotNamespace() {
    assertThatThrownBy(() -> factory.newRoom("r", "League", List.of("alice", "cpu-1")))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cpu-1");
  }

  @Test
  void onlyConfiguredIdsAreOfflineRooms() {
    assertThat(factory.isOfflineRoomId("offline")).isTrue();
    assertThat(factory.isOfflineRoomId("something-else")).isFalse();
  }
}
