/*
 * どこで: Draft 設定
 * 何を: ルーム既定値/保存先/再同期ワーカー/オフラインルームの設定を保持する
 * なぜ: 持ち時間や保存先を環境ごとに切り替え、テストで上書きしやすくするため
 */
package com.example.draft.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "draft")
public record DraftProperties(
    int teamCount,
    int rosterSize,
    Duration pickTime,
    Duration gracePeriod,
    String store,
    Duration syncInterval,
    boolean syncEnabled,
    String catalogLocation,
    List<String> offlineRoomIds) {

  public DraftProperties {
    offlineRoomIds = offlineRoomIds == null ? List.of() : List.copyOf(offlineRoomIds);
  }
}
