package com.example.draft.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 1 参加者分の指名一覧。保存はせず、常に指名履歴から再計算する。
 */
public record Roster(int participantIndex, List<DraftPick> picks) {

  public Roster {
    picks = List.copyOf(picks);
  }

  public static Roster of(List<DraftPick> allPicks, int participantIndex) {
    return new Roster(
        participantIndex,
        allPicks.stream().filter(p -> p.participantIndex() == participantIndex).toList());
  }

  public int count(Position position) {
    return (int) picks.stream().filter(p -> p.position() == position).count();
  }

  public Map<Position, Integer> positionCounts() {
    final Map<Position, Integer> counts = new EnumMap<>(Position.class);
    for (DraftPick pick : picks) {
      if (pick.position() != null) {
        counts.merge(pick.position(), 1, Integer::sum);
      }
    }
    return counts;
  }

  public int size() {
    return picks.size();
  }
}
