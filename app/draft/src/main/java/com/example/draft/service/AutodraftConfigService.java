package com.example.draft.service;

import com.example.draft.api.InvalidDraftRequestException;
import com.example.draft.api.request.UpdateAutodraftConfigRequest;
import com.example.draft.api.response.AutodraftConfigResponse;
import com.example.draft.model.AutodraftConfig;
import com.example.draft.model.Position;
import com.example.draft.repository.AutodraftConfigRepository;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AutodraftConfigService {

  private static final Logger logger = LoggerFactory.getLogger(AutodraftConfigService.class);

  private final AutodraftConfigRepository repository;

  public AutodraftConfigService(AutodraftConfigRepository repository) {
    this.repository = repository;
  }

  public AutodraftConfigResponse get(String userId) {
    requireUserId(userId);
    return toResponse(userId, repository.find(userId).orElseGet(AutodraftConfig::defaults));
  }

  /**
   * 役割: 自動指名設定を置き換える。
   * 動作: 指定のないポジション上限は既定値、custom rankings の重複は先頭側だけを残す。
   * 前提: 上限値は 0 以上、ポジションキーは QB/RB/WR/TE のいずれか。
   */
  public AutodraftConfigResponse update(String userId, UpdateAutodraftConfigRequest request) {
    requireUserId(userId);
    if (request == null || request.enabled() == null) {
      throw new InvalidDraftRequestException("enabled is required");
    }
    final Map<Position, Integer> limits = new EnumMap<>(Position.class);
    if (request.positionLimits() != null) {
      for (Map.Entry<String, Integer> entry : request.positionLimits().entrySet()) {
        final Position position = parsePosition(entry.getKey());
        final Integer limit = entry.getValue();
        if (limit == null || limit < 0) {
          throw new InvalidDraftRequestException("position limit must be >= 0: " + position);
        }
        limits.put(position, limit);
      }
    }
    final List<String> rankings =
        request.customRankings() == null
            ? List.of()
            : request.customRankings().stream()
                .filter(id -> id != null && !id.isBlank())
                .distinct()
                .toList();
    final AutodraftConfig config = new AutodraftConfig(request.enabled(), limits, rankings);
    repository.save(userId, config);
    logger.info(
        "autodraft config updated userId={} enabled={} rankings={}",
        userId,
        config.enabled(),
        rankings.size());
    return toResponse(userId, config);
  }

  private Position parsePosition(String value) {
    try {
      return Position.fromValue(value);
    } catch (IllegalArgumentException ex) {
      throw new InvalidDraftRequestException(ex.getMessage());
    }
  }

  private AutodraftConfigResponse toResponse(String userId, AutodraftConfig config) {
    final Map<String, Integer> limits = new LinkedHashMap<>();
    for (Position position : Position.values()) {
      limits.put(position.name(), config.limitFor(position));
    }
    return new AutodraftConfigResponse(
        userId, config.enabled(), limits, config.customRankings());
  }

  private void requireUserId(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidDraftRequestException("userId is required");
    }
  }
}
