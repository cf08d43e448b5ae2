/*
 * どこで: Draft サービス層
 * 何を: 指名確定/ドラフト完了を JSON ペイロードで JetStream へ publish する
 * なぜ: 複数インスタンスが同じ指名を通知しても Nats-Msg-Id で重複排除させるため
 */
package com.example.draft.service;

import com.example.common.TraceIds;
import com.example.common.event.DraftEventPayload;
import com.example.draft.config.DraftNatsProperties;
import com.example.draft.model.DraftPick;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsDraftEventPublisher implements DraftEventPublisher {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final JetStream jetStream;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "JetStream/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  private final DraftNatsProperties properties;
  private final Clock clock;

  public NatsDraftEventPublisher(
      JetStream jetStream, ObjectMapper objectMapper, DraftNatsProperties properties, Clock clock) {
    this.jetStream = jetStream;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public void publishPickMade(String roomId, DraftPick pick) {
    requireRoomId(roomId);
    if (pick == null || pick.playerId() == null || pick.playerId().isBlank()) {
      throw new IllegalArgumentException("pick with playerId is required");
    }
    final String eventId = roomId + ":pick:" + pick.pickNumber();
    publish(
        eventId,
        new DraftEventPayload(
            eventId,
            PICK_MADE,
            Instant.now(clock).toString(),
            roomId,
            pick.pickNumber(),
            pick.participantIndex(),
            pick.playerId(),
            pick.autopick(),
            pick.source() == null ? null : pick.source().value(),
            TraceIds.currentOrNew()));
  }

  @Override
  public void publishDraftCompleted(String roomId, int totalPicks) {
    requireRoomId(roomId);
    final String eventId = roomId + ":completed";
    publish(
        eventId,
        new DraftEventPayload(
            eventId,
            DRAFT_COMPLETED,
            Instant.now(clock).toString(),
            roomId,
            totalPicks,
            -1,
            null,
            false,
            null,
            TraceIds.currentOrNew()));
  }

  private void publish(String eventId, DraftEventPayload payload) {
    final Headers headers = new Headers();
    headers.add("Nats-Msg-Id", eventId);
    try {
      jetStream.publish(properties.subject(), headers, objectMapper.writeValueAsBytes(payload));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode draft event", ex);
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to publish draft event", ex);
    }
  }

  private void requireRoomId(String roomId) {
    if (roomId == null || roomId.isBlank()) {
      throw new IllegalArgumentException("roomId is required");
    }
  }
}
