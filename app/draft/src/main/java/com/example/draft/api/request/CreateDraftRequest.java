/*
 * どこで: Draft API リクエスト DTO
 * 何を: ルーム作成 API の入力を定義する
 * なぜ: 人間参加者の並び順 (= 参加者 index) を受け取るため
 */
package com.example.draft.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record CreateDraftRequest(@NotBlank String name, List<String> participantUserIds) {}
