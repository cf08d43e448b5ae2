package com.example.draft.service;

import com.example.draft.model.DraftPick;

/** 指名確定/ドラフト完了イベントの送出先。 */
public interface DraftEventPublisher {

  String PICK_MADE = "PICK_MADE";
  String DRAFT_COMPLETED = "DRAFT_COMPLETED";

  void publishPickMade(String roomId, DraftPick pick);

  void publishDraftCompleted(String roomId, int totalPicks);
}
