/*
 * どこで: common のイベント payload 定義
 * 何を: ドラフト進行イベント (指名確定/ドラフト完了) の共通レコードを提供する
 * なぜ: publish 側と購読側で同一のペイロード形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DraftEventPayload(
    String eventId,
    String eventType,
    String occurredAt,
    String roomId,
    int pickNumber,
    int participantIndex,
    String playerId,
    boolean autopick,
    String source,
    String traceId) {}
