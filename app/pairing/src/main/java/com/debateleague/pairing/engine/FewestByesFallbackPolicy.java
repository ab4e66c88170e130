package com.debateleague.pairing.engine;

import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/*
 * どこで: Pairing エンジン
 * 何を: BYE 回数が最も少ないメンバーの History を引き継ぐ既定ポリシー
 * なぜ: BYE の公平性を単独代替 Unit でも保つため (同数なら名前順で先頭)
 */
@Component
public class FewestByesFallbackPolicy implements FallbackHistoryPolicy {

  @Override
  public String chooseMember(List<String> members, HistoryView view) {
    return members.stream()
        .min(
            Comparator.comparingInt((String name) -> view.competitor(name).byeCount())
                .thenComparing(Comparator.naturalOrder()))
        .orElseThrow(() -> new IllegalArgumentException("unit without members"));
  }
}
