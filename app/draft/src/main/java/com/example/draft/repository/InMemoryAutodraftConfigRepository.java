package com.example.draft.repository;

import com.example.draft.model.AutodraftConfig;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "draft.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryAutodraftConfigRepository implements AutodraftConfigRepository {

  private final Map<String, AutodraftConfig> configs = new ConcurrentHashMap<>();

  @Override
  public Optional<AutodraftConfig> find(String userId) {
    return Optional.ofNullable(configs.get(userId));
  }

  @Override
  public void save(String userId, AutodraftConfig config) {
    configs.put(userId, config);
  }
}
