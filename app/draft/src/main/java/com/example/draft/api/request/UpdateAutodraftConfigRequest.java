/*
 * どこで: Draft API リクエスト DTO
 * 何を: 自動指名設定の更新入力を定義する
 * なぜ: ポジション上限を "QB" 等の文字列キーで受け取り、サービス層で検証するため
 */
package com.example.draft.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record UpdateAutodraftConfigRequest(
    @NotNull Boolean enabled,
    Map<String, Integer> positionLimits,
    List<String> customRankings) {}
