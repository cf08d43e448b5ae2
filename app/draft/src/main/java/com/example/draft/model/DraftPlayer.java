/*
 * どこで: Draft ドメインモデル
 * 何を: 外部カタログから受け取る選手エントリを表現する
 * なぜ: エンジンはカタログを書き換えず、消費済み id のみを追跡するため
 */
package com.example.draft.model;

public record DraftPlayer(
    String id,
    String name,
    Position position,
    String team,
    int byeWeek,
    double adp,
    double projectedPoints) {}
