/*
 * どこで: Draft エンジン
 * 何を: queue → custom ranking → ADP の優先順で自動指名する選手を 1 人決める
 * なぜ: 手番を逃した参加者の指名を決定的に再現できる形で代行するため
 */
package com.example.draft.engine;

import com.example.draft.model.AutodraftConfig;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.PickSource;
import com.example.draft.model.Position;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AutodraftSelector {

  static final Comparator<DraftPlayer> BY_ADP =
      Comparator.comparingDouble(DraftPlayer::adp).thenComparing(DraftPlayer::id);

  private AutodraftSelector() {}

  /**
   * 役割: ポジション上限内の候補から優先順位に従って 1 人を選ぶ。
   * 動作: 候補が空なら empty。queue、custom ranking の順に先頭一致を返し、どちらも外れたら ADP 最小を返す。
   * 前提: 入力はいずれも変更しない。rosterCounts に無いポジションは 0 件として扱う。
   */
  public static Optional<AutodraftSelection> select(
      Collection<DraftPlayer> available,
      Map<Position, Integer> rosterCounts,
      List<String> queue,
      AutodraftConfig config) {
    final Map<String, DraftPlayer> candidates = legalCandidates(available, rosterCounts, config);
    if (candidates.isEmpty()) {
      return Optional.empty();
    }
    final Optional<DraftPlayer> fromQueue = firstMatch(queue, candidates);
    if (fromQueue.isPresent()) {
      return Optional.of(new AutodraftSelection(fromQueue.get(), PickSource.QUEUE));
    }
    final Optional<DraftPlayer> fromRankings = firstMatch(config.customRankings(), candidates);
    if (fromRankings.isPresent()) {
      return Optional.of(new AutodraftSelection(fromRankings.get(), PickSource.CUSTOM_RANKING));
    }
    return candidates.values().stream()
        .sorted(BY_ADP)
        .findFirst()
        .map(player -> new AutodraftSelection(player, PickSource.ADP));
  }

  /** ポジション上限を無視した ADP 最上位。上限で全滅したときの救済に使う。 */
  public static Optional<AutodraftSelection> bestAvailable(Collection<DraftPlayer> available) {
    return available.stream()
        .sorted(BY_ADP)
        .findFirst()
        .map(player -> new AutodraftSelection(player, PickSource.ADP));
  }

  private static Map<String, DraftPlayer> legalCandidates(
      Collection<DraftPlayer> available,
      Map<Position, Integer> rosterCounts,
      AutodraftConfig config) {
    final Map<String, DraftPlayer> candidates = new HashMap<>();
    for (DraftPlayer player : available) {
      if (player.position() == null) {
        continue;
      }
      if (rosterCounts.getOrDefault(player.position(), 0) < config.limitFor(player.position())) {
        candidates.put(player.id(), player);
      }
    }
    return candidates;
  }

  private static Optional<DraftPlayer> firstMatch(
      List<String> orderedIds, Map<String, DraftPlayer> candidates) {
    if (orderedIds == null) {
      return Optional.empty();
    }
    for (String id : orderedIds) {
      final DraftPlayer player = candidates.get(id);
      if (player != null) {
        return Optional.of(player);
      }
    }
    return Optional.empty();
  }
}
