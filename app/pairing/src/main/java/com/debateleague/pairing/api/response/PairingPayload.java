/*
 * どこで: Pairing API レスポンス DTO
 * 何を: 1 対戦分の割当結果を表現する
 * なぜ: 生成結果テーブルと同じ列構成でクライアントへ返すため
 */
package com.debateleague.pairing.api.response;

import com.debateleague.pairing.model.GeneratedPairingRow;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PairingPayload(
    int round, String sideA, String sideB, String adjudicators, String venue, int penalty) {

  public static PairingPayload from(GeneratedPairingRow row) {
    return new PairingPayload(
        row.roundNumber(),
        row.sideA(),
        row.sideB(),
        row.adjudicators(),
        row.venue(),
        row.penalty());
  }
}
