/*
 * どこで: Draft 設定
 * 何を: 指名イベント publish 先の subject/stream を保持する
 * なぜ: 運用環境ごとに publish 先を切り替えるため
 */
package com.example.draft.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "draft.nats")
public record DraftNatsProperties(String subject, String stream, Duration duplicateWindow) {}
