package com.example.draft.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.draft.DraftFixtures;
import com.example.draft.config.DraftNatsProperties;
import com.example.draft.model.DraftPick;
import com.example.draft.model.Participant;
import com.example.draft.model.PickSource;
import com.example.draft.model.Position;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class NatsDraftEventPublisherTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final JetStream jetStream = Mockito.mock(JetStream.class);
  private final DraftNatsProperties properties =
      new DraftNatsProperties("draft.events", "draft-events", Duration.ofMinutes(2));
  private final NatsDraftEventPublisher publisher =
      new NatsDraftEventPublisher(jetStream, objectMapper, properties, DraftFixtures.CLOCK);

  @Test
  void publishesPickMadeWithDeterministicMessageId() throws Exception {
    publisher.publishPickMade("room-1", pick());

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("draft.events"), headers.capture(), body.capture());
    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isEqualTo("room-1:pick:13");
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("event_type").asText()).isEqualTo("PICK_MADE");
    assertThat(json.get("room_id").asText()).isEqualTo("room-1");
    assertThat(json.get("pick_number").asInt()).isEqualTo(13);
    assertThat(json.get("participant_index").asInt()).isEqualTo(11);
    assertThat(json.get("player_id").asText()).isEqualTo("p-013");
    assertThat(json.get("autopick").asBoolean()).isTrue();
    assertThat(json.get("source").asText()).isEqualTo("queue");
    assertThat(json.get("occurred_at").asText()).isEqualTo("2026-09-01T12:00:00Z");
    assertThat(json.get("trace_id").asText()).isNotBlank();
  }

  @Test
  void publishesDraftCompleted() throws Exception {
    publisher.publishDraftCompleted("room-1", 216);

    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream).publish(eq("draft.events"), headers.capture(), body.capture());
    assertThat(headers.getValue().getFirst("Nats-Msg-Id")).isEqualTo("room-1:completed");
    final JsonNode json = objectMapper.readTree(body.getValue());
    assertThat(json.get("event_type").asText()).isEqualTo("DRAFT_COMPLETED");
    assertThat(json.get("pick_number").asInt()).isEqualTo(216);
  }

  @Test
  void throwsWhenRoomIdMissing() {
    assertThatThrownBy(() -> publisher.publishDraftCompleted(" ", 216))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> publisher.publishPickMade("room-1", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void wrapsIOException() throws Exception {
    when(jetStream.publish(any(String.class), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("boom"));

    assertThatThrownBy(() -> publisher.publishPickMade("room-1", pick()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failed to publish");
  }

  @Test
  void noopPublisherDoesNothing() {
    final NoopDraftEventPublisher noop = new NoopDraftEventPublisher();

    noop.publishPickMade("room-1", pick());
    noop.publishDraftCompleted("room-1", 216);
  }

  private static DraftPick pick() {
    return DraftPick.autopick(
        13,
        12,
        new Participant("cpu-11", "CPU Team 11", 11, true),
        DraftFixtures.player("p-013", Position.TE, 13),
        DraftFixtures.CLOCK.instant(),
        PickSource.QUEUE);
  }
}
