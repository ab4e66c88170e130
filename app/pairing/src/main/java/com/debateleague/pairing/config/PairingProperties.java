/*
 * どこで: Pairing 設定
 * 何を: 探索回数/ペナルティ重み/出力ラベルを保持する
 * なぜ: エンジン全体へ同じ不変設定値をコンストラクタ経由で渡すため
 */
package com.debateleague.pairing.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pairing")
public record PairingProperties(
    @Min(1) int searchIterations,
    @Min(0) int tierMismatchPenalty,
    @Min(0) int rematchPenalty,
    @Min(0) int readjudicationWeight,
    @Min(0) int panelSizePenalty,
    @NotEmpty String noOpponentLabel,
    @NotEmpty String fallbackMarker,
    @NotEmpty String unitKeyDelimiter,
    @NotEmpty String adjudicatorDelimiter,
    @NotEmpty String conflictDelimiter) {

  public static PairingProperties defaults() {
    return new PairingProperties(500, 100, 15, 10, 25, "BYE", "(solo)", " & ", ", ", ",");
  }

  public PairingProperties withSearchIterations(int iterations) {
    return new PairingProperties(
        iterations,
        tierMismatchPenalty,
        rematchPenalty,
        readjudicationWeight,
        panelSizePenalty,
        noOpponentLabel,
        fallbackMarker,
        unitKeyDelimiter,
        adjudicatorDelimiter,
        conflictDelimiter);
  }
}
