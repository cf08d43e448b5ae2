/*
 * どこで: Draft サービス層
 * 何を: 設定値から 12 チーム分の参加者を持つ新規ルームを組み立てる
 * なぜ: オフライン用の既定ルームと API からの作成で同じ既定値を使うため
 */
package com.example.draft.service;

import com.example.draft.config.DraftProperties;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftStatus;
import com.example.draft.model.Participant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class DraftRoomFactory {

  public static final String OFFLINE_USER_ID = "you";

  /** CPU 参加者の id 接頭辞。人間の id には使えない。 */
  public static final String BOT_ID_PREFIX = "cpu-";

  private final DraftProperties properties;

  public DraftRoomFactory(DraftProperties properties) {
    this.properties = properties;
  }

  /** index 0 に人間 "You"、残りを CPU チームで埋めたルーム。 */
  public DraftRoom offlineRoom(String roomId) {
    return newRoom(roomId, "Offline Draft", List.of(OFFLINE_USER_ID), List.of("You"));
  }

  /** draft.offline-room-ids に列挙された id だけがオフラインルームとして作成される。 */
  public boolean isOfflineRoomId(String roomId) {
    return properties.offlineRoomIds().contains(roomId);
  }

  public DraftRoom newRoom(String roomId, String name, List<String> humanUserIds) {
    return newRoom(roomId, name, humanUserIds, humanUserIds);
  }

  private DraftRoom newRoom(
      String roomId, String name, List<String> humanUserIds, List<String> humanNames) {
    final int teamCount = properties.teamCount();
    if (humanUserIds.size() > teamCount) {
      throw new IllegalArgumentException(
          "too many participants: " + humanUserIds.size() + " > " + teamCount);
    }
    if (humanUserIds.stream().distinct().count() != humanUserIds.size()) {
      throw new IllegalArgumentException("participant ids must be unique");
    }
    for (String userId : humanUserIds) {
      if (userId.startsWith(BOT_ID_PREFIX)) {
        throw new IllegalArgumentException(
            "participant id must not start with " + BOT_ID_PREFIX + ": " + userId);
      }
    }
    final List<Participant> participants = new ArrayList<>(teamCount);
    for (int i = 0; i < teamCount; i++) {
      if (i < humanUserIds.size()) {
        participants.add(new Participant(humanUserIds.get(i), humanNames.get(i), i, false));
      } else {
        participants.add(new Participant(BOT_ID_PREFIX + i, "CPU Team " + i, i, true));
      }
    }
    return new DraftRoom(
        roomId,
        name,
        teamCount,
        properties.rosterSize(),
        (int) properties.pickTime().toSeconds(),
        (int) properties.gracePeriod().toSeconds(),
        DraftStatus.PENDING,
        participants,
        null,
        null);
  }
}
