/*
 * どこで: Draft ワーカー
 * 何を: 開いている全ルームを定期的に保存層から読み直す
 * なぜ: pub/sub 通知の取りこぼしや時間切れ後の書き込み失敗でドラフトが止まらないようにするため
 */
package com.example.draft.worker;

import com.example.draft.service.DraftMetrics;
import com.example.draft.service.DraftRoomService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "draft.sync-enabled", havingValue = "true", matchIfMissing = true)
public class DraftSyncWorker {

  private static final Logger logger = LoggerFactory.getLogger(DraftSyncWorker.class);

  private final DraftRoomService draftRoomService;
  private final DraftMetrics metrics;

  public DraftSyncWorker(DraftRoomService draftRoomService, DraftMetrics metrics) {
    this.draftRoomService = draftRoomService;
    this.metrics = metrics;
  }

  @Scheduled(fixedDelayString = "${draft.sync-interval}")
  public void run() {
    for (String roomId : draftRoomService.openRoomIds()) {
      try {
        draftRoomService.resync(roomId);
      } catch (RuntimeException ex) {
        logger.warn("draft sync failed roomId={}", roomId, ex);
        metrics.recordDependencyError("sync_loop");
      }
    }
  }
}
