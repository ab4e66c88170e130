/*
 * どこで: Pairing API リクエスト DTO
 * 何を: 生成 API の入力を定義する
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.debateleague.pairing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GeneratePairingsRequest(@NotNull LocalDate eventDate) {}
