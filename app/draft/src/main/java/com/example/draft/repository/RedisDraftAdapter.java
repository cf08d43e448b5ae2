/*
 * どこで: Draft 永続化境界 (本番用)
 * 何を: ルーム/指名履歴を Redis に保存し、指名の追記を Lua で原子的に行う
 * なぜ: 複数インスタンスが同じ指名番号へ同時に書き込んでも 1 件だけを確定させるため
 */
package com.example.draft.repository;

import com.example.draft.model.DraftPick;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.DraftRoom;
import com.example.draft.model.DraftStatus;
import com.example.draft.model.Participant;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "draft.store", havingValue = "redis")
public class RedisDraftAdapter implements DraftAdapter {

  private static final Logger logger = LoggerFactory.getLogger(RedisDraftAdapter.class);

  static final String RESULT_OK = "ok";
  static final String RESULT_CONFLICT = "conflict";
  static final String RESULT_PLAYER_TAKEN = "player_taken";
  static final String MESSAGE_PICKS = "picks";
  static final String MESSAGE_ROOM = "room";

  private static final String FIELD_NAME = "name";
  private static final String FIELD_TEAM_COUNT = "team_count";
  private static final String FIELD_ROSTER_SIZE = "roster_size";
  private static final String FIELD_PICK_TIME_SECONDS = "pick_time_seconds";
  private static final String FIELD_GRACE_PERIOD_SECONDS = "grace_period_seconds";
  private static final String FIELD_STATUS = "status";
  private static final String FIELD_PARTICIPANTS = "participants";
  private static final String FIELD_STARTED_AT = "started_at";
  private static final String FIELD_COMPLETED_AT = "completed_at";

  // KEYS[1]=picks list, KEYS[2]=picked set / ARGV[1]=pickNumber, ARGV[2]=playerId,
  // ARGV[3]=pick json, ARGV[4]=channel
  static final RedisScript<String> ADD_PICK_SCRIPT =
      new DefaultRedisScript<>(
          """
          local count = redis.call('LLEN', KEYS[1])
          if tonumber(ARGV[1]) ~= count + 1 then
            return 'conflict'
          end
          if redis.call('SISMEMBER', KEYS[2], ARGV[2]) == 1 then
            return 'player_taken'
          end
          redis.call('RPUSH', KEYS[1], ARGV[3])
          redis.call('SADD', KEYS[2], ARGV[2])
          redis.call('PUBLISH', ARGV[4], 'picks')
          return 'ok'
          """,
          String.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "リスナーコンテナは Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RedisMessageListenerContainer listenerContainer;

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public RedisDraftAdapter(
      StringRedisTemplate redisTemplate,
      RedisMessageListenerContainer listenerContainer,
      ObjectMapper objectMapper,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.listenerContainer = listenerContainer;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public Optional<DraftRoom> getRoom(String roomId) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(roomKey(roomId));
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    final Map<String, String> fields = normalizeFields(raw);
    return Optional.of(
        new DraftRoom(
            roomId,
            fields.get(FIELD_NAME),
            Integer.parseInt(fields.get(FIELD_TEAM_COUNT)),
            Integer.parseInt(fields.get(FIELD_ROSTER_SIZE)),
            Integer.parseInt(fields.get(FIELD_PICK_TIME_SECONDS)),
            Integer.parseInt(fields.get(FIELD_GRACE_PERIOD_SECONDS)),
            DraftStatus.fromValue(fields.get(FIELD_STATUS)),
            readJson(fields.get(FIELD_PARTICIPANTS), new TypeReference<List<Participant>>() {}),
            parseInstant(fields.get(FIELD_STARTED_AT)),
            parseInstant(fields.get(FIELD_COMPLETED_AT))));
  }

  @Override
  public Subscription subscribeToRoom(String roomId, Consumer<DraftRoom> onChange) {
    return subscribe(
        roomId, MESSAGE_ROOM, () -> getRoom(roomId).ifPresent(onChange), "room_subscription");
  }

  @Override
  public Subscription subscribeToPicks(String roomId, Consumer<List<DraftPick>> onChange) {
    return subscribe(
        roomId, MESSAGE_PICKS, () -> onChange.accept(getPicks(roomId)), "picks_subscription");
  }

  @Override
  public List<DraftPick> getPicks(String roomId) {
    final List<String> raw = redisTemplate.opsForList().range(picksKey(roomId), 0, -1);
    if (raw == null || raw.isEmpty()) {
      return List.of();
    }
    final List<DraftPick> picks = new ArrayList<>(raw.size());
    for (String json : raw) {
      picks.add(readJson(json, new TypeReference<DraftPick>() {}));
    }
    return List.copyOf(picks);
  }

  @Override
  public DraftPick addPick(String roomId, DraftPick pick) {
    final String result =
        redisTemplate.execute(
            ADD_PICK_SCRIPT,
            List.of(picksKey(roomId), pickedKey(roomId)),
            String.valueOf(pick.pickNumber()),
            pick.playerId(),
            writeJson(pick),
            channel(roomId));
    if (RESULT_OK.equals(result)) {
      return pick;
    }
    if (RESULT_PLAYER_TAKEN.equals(result)) {
      throw new PickConflictException(
          roomId, pick.pickNumber(), "player already drafted: " + pick.playerId());
    }
    if (RESULT_CONFLICT.equals(result)) {
      throw new PickConflictException(
          roomId, pick.pickNumber(), "pick number " + pick.pickNumber() + " is not next");
    }
    throw new IllegalStateException("unexpected add pick script result: " + result);
  }

  @Override
  public List<DraftPlayer> getAvailablePlayers(String roomId) {
    final String catalogJson = redisTemplate.opsForValue().get(catalogKey(roomId));
    if (catalogJson == null || catalogJson.isBlank()) {
      return List.of();
    }
    final List<DraftPlayer> catalog =
        readJson(catalogJson, new TypeReference<List<DraftPlayer>>() {});
    final Set<String> picked = redisTemplate.opsForSet().members(pickedKey(roomId));
    if (picked == null || picked.isEmpty()) {
      return catalog;
    }
    return catalog.stream().filter(p -> !picked.contains(p.id())).toList();
  }

  @Override
  public DraftRoom updateRoomStatus(String roomId, DraftStatus status) {
    final DraftRoom current =
        getRoom(roomId)
            .orElseThrow(() -> new IllegalArgumentException("draft room not found: " + roomId));
    final DraftRoom updated = current.withStatus(status, Instant.now(clock));
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_STATUS, status.value());
    putInstant(fields, FIELD_STARTED_AT, updated.startedAt());
    putInstant(fields, FIELD_COMPLETED_AT, updated.completedAt());
    redisTemplate.opsForHash().putAll(roomKey(roomId), fields);
    redisTemplate.convertAndSend(channel(roomId), MESSAGE_ROOM);
    return updated;
  }

  @Override
  public DraftRoom createRoom(DraftRoom room, List<DraftPlayer> catalog) {
    final String roomKey = roomKey(room.roomId());
    final Map<String, String> fields = new HashMap<>();
    fields.put(FIELD_NAME, room.name());
    fields.put(FIELD_TEAM_COUNT, String.valueOf(room.teamCount()));
    fields.put(FIELD_ROSTER_SIZE, String.valueOf(room.rosterSize()));
    fields.put(FIELD_PICK_TIME_SECONDS, String.valueOf(room.pickTimeSeconds()));
    fields.put(FIELD_GRACE_PERIOD_SECONDS, String.valueOf(room.gracePeriodSeconds()));
    fields.put(FIELD_STATUS, room.status().value());
    fields.put(FIELD_PARTICIPANTS, writeJson(room.participants()));
    putInstant(fields, FIELD_STARTED_AT, room.startedAt());
    putInstant(fields, FIELD_COMPLETED_AT, room.completedAt());
    final Boolean created =
        redisTemplate.opsForHash().putIfAbsent(roomKey, FIELD_NAME, room.name());
    if (!Boolean.TRUE.equals(created)) {
      throw new IllegalStateException("draft room already exists: " + room.roomId());
    }
    redisTemplate.opsForHash().putAll(roomKey, fields);
    redisTemplate.opsForValue().set(catalogKey(room.roomId()), writeJson(catalog));
    logger.info("draft room created roomId={} players={}", room.roomId(), catalog.size());
    return room;
  }

  static String roomKey(String roomId) {
    return "draft:room:" + roomId;
  }

  static String picksKey(String roomId) {
    return "draft:picks:" + roomId;
  }

  static String pickedKey(String roomId) {
    return "draft:picked:" + roomId;
  }

  static String catalogKey(String roomId) {
    return "draft:catalog:" + roomId;
  }

  static String channel(String roomId) {
    return "draft:events:" + roomId;
  }

  private Subscription subscribe(
      String roomId, String messageType, Runnable onMessage, String errorType) {
    final ChannelTopic topic = new ChannelTopic(channel(roomId));
    final MessageListener listener =
        (message, pattern) -> {
          final String body = new String(message.getBody(), StandardCharsets.UTF_8);
          if (!messageType.equals(body)) {
            return;
          }
          try {
            onMessage.run();
          } catch (RuntimeException ex) {
            logger.warn(
                "draft change notification failed roomId={} type={}", roomId, errorType, ex);
          }
        };
    listenerContainer.addMessageListener(listener, topic);
    return () -> listenerContainer.removeMessageListener(listener, topic);
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to encode draft value", ex);
    }
  }

  private <T> T readJson(String json, TypeReference<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to decode draft value", ex);
    }
  }

  private Map<String, String> normalizeFields(Map<Object, Object> raw) {
    final Map<String, String> map = new HashMap<>();
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return map;
  }

  private void putInstant(Map<String, String> fields, String field, Instant value) {
    if (value != null) {
      fields.put(field, value.toString());
    }
  }

  private Instant parseInstant(String value) {
    return value == null || value.isBlank() ? null : Instant.parse(value);
  }
}
