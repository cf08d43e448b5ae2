package com.example.draft.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

/** ユーザー単位の queue を JSON 配列として 1 キーに保存する。 */
@Repository
@ConditionalOnProperty(name = "draft.store", havingValue = "redis")
public class RedisQueueStore implements QueueStore {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final ObjectMapper objectMapper;

  public RedisQueueStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<String> load(String userId) {
    final String json = redisTemplate.opsForValue().get(queueKey(userId));
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, new TypeReference<List<String>>() {});
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to decode queue userId=" + userId, ex);
    }
  }

  @Override
  public void save(String userId, List<String> playerIds) {
    try {
      redisTemplate.opsForValue().set(queueKey(userId), objectMapper.writeValueAsString(playerIds));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode queue userId=" + userId, ex);
    }
  }

  static String queueKey(String userId) {
    return "draft:queue:" + userId;
  }
}
