/*
 * どこで: Draft 永続化境界
 * 何を: 選手カタログ (JSON) を読み込み、ルーム作成時の初期在庫として提供する
 * なぜ: 外部カタログの形式をエンジンのモデルから切り離すため
 */
package com.example.draft.repository;

import com.example.draft.config.DraftProperties;
import com.example.draft.model.DraftPlayer;
import com.example.draft.model.Position;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

@Component
public class PlayerCatalog {

  private static final Logger logger = LoggerFactory.getLogger(PlayerCatalog.class);

  private final List<DraftPlayer> players;

  @Autowired
  public PlayerCatalog(ObjectMapper objectMapper, DraftProperties properties) {
    this(load(objectMapper, properties.catalogLocation()));
  }

  public PlayerCatalog(List<DraftPlayer> players) {
    this.players = List.copyOf(players);
  }

  public List<DraftPlayer> players() {
    return players;
  }

  private static List<DraftPlayer> load(ObjectMapper objectMapper, String location) {
    final Resource resource = new DefaultResourceLoader().getResource(location);
    try (InputStream in = resource.getInputStream()) {
      final List<CatalogEntry> entries =
          objectMapper.readValue(in, new TypeReference<List<CatalogEntry>>() {});
      final List<DraftPlayer> players = entries.stream().map(CatalogEntry::toPlayer).toList();
      logger.info("player catalog loaded location={} players={}", location, players.size());
      return players;
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to load player catalog: " + location, ex);
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record CatalogEntry(
      String id,
      String name,
      String position,
      String team,
      int byeWeek,
      double adp,
      double projectedPoints) {

    DraftPlayer toPlayer() {
      return new DraftPlayer(
          id, name, Position.fromValue(position), team, byeWeek, adp, projectedPoints);
    }
  }
}
