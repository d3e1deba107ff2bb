/*
 * どこで: Arena API リクエスト DTO
 * 何を: 挑戦 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.chatgames.arena.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ChallengeRequest(
    @NotBlank String targetUserId, @NotBlank String kind, String category, String grid) {}
