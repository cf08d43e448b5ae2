/*
 * どこで: Draft 永続化境界
 * 何を: ルーム/指名履歴の読み書きと変更通知の契約を定義する
 * なぜ: 指名番号の重複判定を保存層の原子的操作に一本化するため
 */
package com.example.draft.repository;

import com.example.draft.model.DraftPick;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftStatus;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

public interface DraftAdapter {

  Optional<DraftRoom> getRoom(String roomId);

  Subscription subscribeToRoom(String roomId, Consumer<DraftRoom> onChange);

  /** onChange には確定済み指名の全件 (指名番号順) が渡される。 */
  Subscription subscribeToPicks(String roomId, Consumer<List<DraftPick>> onChange);

  List<DraftPick> getPicks(String roomId);

  /**
   * 役割: 1 指名を原子的に追記する。
   * 動作: 指名番号が現在件数 + 1 でない、または選手が取得済みなら PickConflictException を送出する。
   * 前提: 成功時のみ購読者へ通知する。
   */
  DraftPick addPick(String roomId, DraftPick pick);

  List<DraftPlayer> getAvailablePlayers(String roomId);

  DraftRoom updateRoomStatus(String roomId, DraftStatus status);

  DraftRoom createRoom(DraftRoom room, List<DraftPlayer> catalog);
}
