/*
 * どこで: Pairing API レスポンス DTO
 * 何を: 生成 API の成功応答を定義する
 * なぜ: 実行 ID と確定した全対戦をまとめて返すため
 */
package com.debateleague.pairing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record PairingRunResponse(
    String runId, String format, String eventDate, List<PairingPayload> pairings) {}
