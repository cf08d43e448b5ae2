package com.example.draft.repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "draft.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryQueueStore implements QueueStore {

  private final Map<String, List<String>> queues = new ConcurrentHashMap<>();

  @Override
  public List<String> load(String userId) {
    return queues.getOrDefault(userId, List.of());
  }

  @Override
  public void save(String userId, List<String> playerIds) {
    queues.put(userId, List.copyOf(playerIds));
  }
}
