/*
 * どこで: Draft ドメインモデル
 * 何を: 参加者ごとの自動指名設定 (有効/ポジション上限/独自ランキング) を保持する
 * なぜ: 自動指名の優先順位と上限判定を参加者単位で切り替えるため
 */
package com.example.draft.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record AutodraftConfig(
    boolean enabled, Map<Position, Integer> positionLimits, List<String> customRankings) {

  public static final Map<Position, Integer> DEFAULT_POSITION_LIMITS =
      Map.of(Position.QB, 4, Position.RB, 10, Position.WR, 11, Position.TE, 5);

  public AutodraftConfig {
    final Map<Position, Integer> limits = new EnumMap<>(Position.class);
    limits.putAll(DEFAULT_POSITION_LIMITS);
    if (positionLimits != null) {
      limits.putAll(positionLimits);
    }
    positionLimits = Map.copyOf(limits);
    customRankings = customRankings == null ? List.of() : List.copyOf(customRankings);
  }

  public static AutodraftConfig defaults() {
    return new AutodraftConfig(false, DEFAULT_POSITION_LIMITS, List.of());
  }

  public int limitFor(Position position) {
    return positionLimits.getOrDefault(position, Integer.MAX_VALUE);
  }
}
