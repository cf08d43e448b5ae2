package com.example.draft.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** NATS 接続設定。enabled=false でローカル起動時は Noop publisher に切り替わる。 */
@ConfigurationProperties(prefix = "nats")
public record NatsProperties(boolean enabled, String url, Integer connectionTimeout) {}
