/*
 * どこで: Draft API レスポンス DTO
 * 何を: 呼び出しユーザー視点のドラフト進行状態を定義する
 * なぜ: 手番表示とタイマー表示に必要な値を 1 回の取得で返すため
 */
package com.example.draft.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はレスポンス組み立て専用であり、防御的コピーを行わないため")
public record DraftStateResponse(
    String roomId,
    String status,
    int currentPickNumber,
    String currentPickLabel,
    int currentRound,
    int currentParticipantIndex,
    int yourParticipantIndex,
    boolean yourTurn,
    int picksUntilYourTurn,
    List<Integer> pickCounts,
    int totalPicks,
    boolean complete,
    TimerPayload timer) {}
