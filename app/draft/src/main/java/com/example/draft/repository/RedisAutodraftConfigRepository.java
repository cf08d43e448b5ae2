package com.example.draft.repository;

import com.example.draft.model.AutodraftConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "draft.store", havingValue = "redis")
public class RedisAutodraftConfigRepository implements AutodraftConfigRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper;

  public RedisAutodraftConfigRepository(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<AutodraftConfig> find(String userId) {
    final String json = redisTemplate.opsForValue().get(configKey(userId));
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json, AutodraftConfig.class));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to decode autodraft config userId=" + userId, ex);
    }
  }

  @Override
  public void save(String userId, AutodraftConfig config) {
    try {
      redisTemplate.opsForValue().set(configKey(userId), objectMapper.writeValueAsString(config));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode autodraft config userId=" + userId, ex);
    }
  }

  static String configKey(String userId) {
    return "draft:autodraft:" + userId;
  }
}
