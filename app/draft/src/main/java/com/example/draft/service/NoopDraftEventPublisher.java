/*
 * どこで: Draft サービス層
 * 何を: NATS 無効時のダミー publisher を提供する
 * なぜ: ローカル/オフライン起動で NATS なしでもエンジンを動かせるようにするため
 */
package com.example.draft.service;

import com.example.draft.model.DraftPick;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class NoopDraftEventPublisher implements DraftEventPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NoopDraftEventPublisher.class);

  @Override
  public void publishPickMade(String roomId, DraftPick pick) {
    logger.debug("skip pick event roomId={} pickNumber={}", roomId, pick.pickNumber());
  }

  @Override
  public void publishDraftCompleted(String roomId, int totalPicks) {
    logger.debug("skip completion event roomId={} totalPicks={}", roomId, totalPicks);
  }
}
