package com.example.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.draft.api.InvalidDraftRequestException;
import com.example.draft.api.request.UpdateAutodraftConfigRequest;
import com.example.draft.api.response.AutodraftConfigResponse;
import com.example.draft.model.AutodraftConfig;
import com.example.draft.model.Position;
import com.example.draft.repository.InMemoryAutodraftConfigRepository;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AutodraftConfigServiceTest {

  private final InMemoryAutodraftConfigRepository repository =
      new InMemoryAutodraftConfigRepository();
  private final AutodraftConfigService service = new AutodraftConfigService(repository);

  @Test
  void getReturnsDefaultsForNewUser() {
    final AutodraftConfigResponse response = service.get("user-1");

    assertThat(response.enabled()).isFalse();
    assertThat(response.positionLimits())
        .containsEntry("QB", 4)
        .containsEntry("RB", 10)
        .containsEntry("WR", 11)
        .containsEntry("TE", 5);
    assertThat(response.customRankings()).isEmpty();
  }

  @Test
  void updateMergesLimitsAndDedupesRankings() {
    final AutodraftConfigResponse response =
        service.update(
            "user-1",
            new UpdateAutodraftConfigRequest(
                true, Map.of("qb", 2), Arrays.asList("p-003", "p-001", "p-003", null, " ")));

    assertThat(response.enabled()).isTrue();
    assertThat(response.positionLimits()).containsEntry("QB", 2).containsEntry("RB", 10);
    assertThat(response.customRankings()).containsExactly("p-003", "p-001");
    final AutodraftConfig stored = repository.find("user-1").orElseThrow();
    assertThat(stored.limitFor(Position.QB)).isEqualTo(2);
    assertThat(stored.customRankings()).containsExactly("p-003", "p-001");
  }

  @Test
  void updateRejectsInvalidInput() {
    assertThatThrownBy(
            () -> service.update("user-1", new UpdateAutodraftConfigRequest(null, null, null)))
        .isInstanceOf(InvalidDraftRequestException.class);
    assertThatThrownBy(
            () ->
                service.update(
                    "user-1", new UpdateAutodraftConfigRequest(true, Map.of("K", 1), null)))
        .isInstanceOf(InvalidDraftRequestException.class);
    assertThatThrownBy(
            () ->
                service.update(
                    "user-1", new UpdateAutodraftConfigRequest(true, Map.of("RB", -1), null)))
        .isInstanceOf(InvalidDraftRequestException.class);
    assertThatThrownBy(
            () -> service.update(" ", new UpdateAutodraftConfigRequest(true, null, List.of())))
        .isInstanceOf(InvalidDraftRequestException.class);
  }
}
