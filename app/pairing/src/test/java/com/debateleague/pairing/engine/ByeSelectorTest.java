package com.debateleague.pairing.engine;

import static com.debateleague.pairing.engine.EngineFixtures.DAY_ONE;
import static com.debateleague.pairing.engine.EngineFixtures.bye;
import static com.debateleague.pairing.engine.EngineFixtures.singles;
import static org.assertj.core.api.Assertions.assertThat;

import com.debateleague.pairing.model.HistoryRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ByeSelectorTest {

  private final UnitFormation unitFormation = EngineFixtures.unitFormation();

  @Test
  void evenPoolHasNoBye() {
    final List<Unit> pool =
        new ArrayList<>(unitFormation.formSingles(singles("a", "b"), HistoryView.empty()));

    assertThat(new ByeSelector(new Random(1)).select(pool, null)).isEmpty();
    assertThat(pool).hasSize(2);
  }

  @Test
  void neverPicksCompetitorWithMostSitOuts() {
    final List<HistoryRecord> rows =
        List.of(
            bye(DAY_ONE, "x"), bye(DAY_ONE.plusWeeks(1), "x"), bye(DAY_ONE.plusWeeks(2), "x"));
    final HistoryView view = new HistoryAggregator().aggregate(rows);

    for (int seed = 0; seed < 50; seed++) {
      final List<Unit> pool =
          new ArrayList<>(unitFormation.formSingles(singles("v", "w", "x", "y", "z"), view));

      final Optional<Unit> chosen = new ByeSelector(new Random(seed)).select(pool, null);

      assertThat(chosen).isPresent();
      assertThat(chosen.get().key()).isNotEqualTo("x");
      assertThat(pool).hasSize(4).doesNotContain(chosen.get());
    }
  }

  @Test
  void honorsExclusion() {
    final HistoryView view =
        new HistoryAggregator()
            .aggregate(List.of(bye(DAY_ONE, "a"), bye(DAY_ONE, "b"), bye(DAY_ONE, "d")));

    for (int seed = 0; seed < 20; seed++) {
      final List<Unit> pool =
          new ArrayList<>(unitFormation.formSingles(singles("a", "b", "c"), view));

      final Unit chosen = new ByeSelector(new Random(seed)).select(pool, "c").orElseThrow();

      assertThat(chosen.key()).isIn("a", "b");
    }
  }

  @Test
  void waivesExclusionWhenOnlyExcludedUnitRemains() {
    final List<Unit> pool =
        new ArrayList<>(unitFormation.formSingles(singles("solo"), HistoryView.empty()));

    final Optional<Unit> chosen = new ByeSelector(new Random(3)).select(pool, "solo");

    assertThat(chosen).map(Unit::key).contains("solo");
    assertThat(pool).isEmpty();
  }
}
