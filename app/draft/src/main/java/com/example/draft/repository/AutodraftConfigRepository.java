package com.example.draft.repository;

import com.example.draft.model.AutodraftConfig;
import java.util.Optional;

public interface AutodraftConfigRepository {

  Optional<AutodraftConfig> find(String userId);

  void save(String userId, AutodraftConfig config);
}
