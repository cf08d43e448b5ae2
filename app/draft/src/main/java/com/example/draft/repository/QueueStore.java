package com.example.draft.repository;

import java.util.List;

/** ユーザー単位の queue 保存先。ドラフトルームとは独立して保持する。 */
public interface QueueStore {

  List<String> load(String userId);

  void save(String userId, List<String> playerIds);
}
