/*
 * どこで: Pairing ドメインモデル
 * 何を: 生成結果テーブルの 1 行を表現する
 * なぜ: 表示層へ渡す列構成を固定するため
 */
package com.debateleague.pairing.model;

public record GeneratedPairingRow(
    int roundNumber, String sideA, String sideB, String adjudicators, String venue, int penalty) {}
