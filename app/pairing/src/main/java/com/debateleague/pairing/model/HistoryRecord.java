/*
 * どこで: Pairing ドメインモデル
 * 何を: History フィードの 1 行を表現する
 * なぜ: 過去対戦の読み込みと今回結果の書き込みで同じ構造を使うため
 */
package com.debateleague.pairing.model;

import java.time.LocalDate;

// パネル対戦は「競技者 x 審査員」ごとに 1 行。BYE は side=BYE で審査員/会場なし
public record HistoryRecord(
    LocalDate eventDate,
    EventFormat format,
    int roundNumber,
    String competitorName,
    boolean fallbackUnit,
    Side side,
    String opponentUnit,
    String adjudicatorName,
    String venueName) {}
