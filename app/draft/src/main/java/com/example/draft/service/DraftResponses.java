package com.example.draft.service;

import com.example.draft.api.response.BoardResponse;
import com.example.draft.api.response.BoardRoundPayload;
import com.example.draft.api.response.BoardSlotPayload;
import com.example.draft.api.response.DraftRoomResponse;
import com.example.draft.api.response.DraftStateResponse;
import com.example.draft.api.response.ParticipantPayload;
import com.example.draft.api.response.PickResponse;
import com.example.draft.api.response.PlayerResponse;
import com.example.draft.api.response.RosterResponse;
import com.example.draft.api.response.TimerPayload;
import com.example.draft.engine.SnakeOrder;
import com.example.draft.engine.TimerDisplay;
import com.example.draft.model.DraftPick;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftSnapshot;
import com.example.draft.model.Participant;
import com.example.draft.model.Roster;
import com.example.draft.model.TimerState;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** モデル → API レスポンスの変換。 */
final class DraftResponses {

  private DraftResponses() {}

  static DraftRoomResponse room(DraftRoom room) {
    return new DraftRoomResponse(
        room.roomId(),
        room.name(),
        room.status().value(),
        room.teamCount(),
        room.rosterSize(),
        room.pickTimeSeconds(),
        room.gracePeriodSeconds(),
        room.participants().stream()
            .map(p -> new ParticipantPayload(p.id(), p.name(), p.index(), p.bot()))
            .toList());
  }

  static DraftStateResponse state(DraftRoom room, DraftSnapshot snapshot, int yourIndex) {
    final int picksUntilYourTurn =
        snapshot.complete() || yourIndex < 0
            ? SnakeOrder.NO_REMAINING_PICK
            : SnakeOrder.getPicksUntilTurn(
                snapshot.currentPickNumber(), yourIndex, room.teamCount(), room.rosterSize());
    return new DraftStateResponse(
        snapshot.roomId(),
        snapshot.status().value(),
        snapshot.currentPickNumber(),
        snapshot.complete()
            ? null
            : SnakeOrder.formatPickNumber(snapshot.currentPickNumber(), room.teamCount()),
        snapshot.currentRound(),
        snapshot.currentParticipantIndex(),
        yourIndex,
        snapshot.localUsersTurn(),
        picksUntilYourTurn,
        snapshot.pickCounts(),
        snapshot.totalPicks(),
        snapshot.complete(),
        timer(snapshot.timer(), room.pickTimeSeconds()));
  }

  static TimerPayload timer(TimerState timer, int totalSeconds) {
    return new TimerPayload(
        timer.secondsRemaining(),
        TimerDisplay.formatTimer(timer.secondsRemaining()),
        TimerDisplay.urgency(timer.secondsRemaining()).name(),
        TimerDisplay.progress(timer.secondsRemaining(), totalSeconds),
        timer.running(),
        timer.paused(),
        timer.inGracePeriod(),
        timer.expired());
  }

  static PickResponse pick(DraftPick pick, int teamCount) {
    return new PickResponse(
        pick.pickNumber(),
        SnakeOrder.formatPickNumber(pick.pickNumber(), teamCount),
        pick.round(),
        pick.pickInRound(),
        pick.participantIndex(),
        pick.participantId(),
        pick.playerId(),
        pick.playerName(),
        pick.position() == null ? null : pick.position().name(),
        pick.pickedAt() == null ? null : pick.pickedAt().toString(),
        pick.autopick(),
        pick.source() == null ? null : pick.source().value());
  }

  static PlayerResponse player(DraftPlayer player) {
    return new PlayerResponse(
        player.id(),
        player.name(),
        player.position().name(),
        player.team(),
        player.byeWeek(),
        player.adp(),
        player.projectedPoints());
  }

  static RosterResponse roster(Participant participant, Roster roster, int teamCount) {
    final Map<String, Integer> counts = new LinkedHashMap<>();
    roster.positionCounts().forEach((position, count) -> counts.put(position.name(), count));
    return new RosterResponse(
        participant.index(),
        participant.id(),
        participant.name(),
        roster.picks().stream().map(pick -> pick(pick, teamCount)).toList(),
        counts);
  }

  /** 全ラウンド x 全枠を並べ、確定済みの枠にだけ pick を埋める。 */
  static BoardResponse board(DraftRoom room, List<DraftPick> picks) {
    final int teamCount = room.teamCount();
    final Map<Integer, DraftPick> byNumber = new HashMap<>();
    for (DraftPick pick : picks) {
      byNumber.put(pick.pickNumber(), pick);
    }
    final List<BoardRoundPayload> rounds = new ArrayList<>(room.rosterSize());
    for (int round = 1; round <= room.rosterSize(); round++) {
      final List<BoardSlotPayload> slots = new ArrayList<>(teamCount);
      for (int slot = 1; slot <= teamCount; slot++) {
        final int pickNumber = (round - 1) * teamCount + slot;
        final DraftPick pick = byNumber.get(pickNumber);
        slots.add(
            new BoardSlotPayload(
                pickNumber,
                SnakeOrder.formatPickNumber(pickNumber, teamCount),
                SnakeOrder.getParticipantForPick(pickNumber, teamCount),
                pick == null ? null : pick(pick, teamCount)));
      }
      rounds.add(new BoardRoundPayload(round, slots));
    }
    return new BoardResponse(room.roomId(), teamCount, room.rosterSize(), rounds);
  }
}
