package com.debateleague.pairing.engine;

import static com.debateleague.pairing.engine.EngineFixtures.DAY_ONE;
import static com.debateleague.pairing.engine.EngineFixtures.adjudicators;
import static com.debateleague.pairing.engine.EngineFixtures.bye;
import static com.debateleague.pairing.engine.EngineFixtures.singles;
import static com.debateleague.pairing.engine.EngineFixtures.venues;
import static org.assertj.core.api.Assertions.assertThat;

import com.debateleague.pairing.model.Competitor;
import com.debateleague.pairing.model.HistoryRecord;
import com.debateleague.pairing.model.Side;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class TwoRoundOrchestratorTest {

  private static final List<Competitor> SEVEN = singles("t", "u", "v", "w", "x", "y", "z");

  @Test
  void secondRoundByeDiffersFromFirst() {
    for (int seed = 0; seed < 30; seed++) {
      final TwoRoundOrchestrator orchestrator =
          new TwoRoundOrchestrator(EngineFixtures.roundPlanner(new Random(seed)));

      final List<RoundResult> rounds =
          orchestrator.run(SEVEN, adjudicators(3), venues(3), HistoryView.empty());

      assertThat(rounds).hasSize(2);
      assertThat(rounds.get(0).byeKey()).isNotNull();
      assertThat(rounds.get(1).byeKey()).isNotNull().isNotEqualTo(rounds.get(0).byeKey());
    }
  }

  @Test
  void exclusionHoldsEvenWhenRoundOneByeHasFewestSitOuts() {
    final List<HistoryRecord> rows = new ArrayList<>();
    for (String name : List.of("t", "u", "v", "w", "x", "z")) {
      for (int week = 0; week < 3; week++) {
        rows.add(bye(DAY_ONE.plusWeeks(week), name));
      }
    }
    final HistoryView view = new HistoryAggregator().aggregate(rows);

    for (int seed = 0; seed < 10; seed++) {
      final List<RoundResult> rounds =
          new TwoRoundOrchestrator(EngineFixtures.roundPlanner(new Random(seed)))
              .run(SEVEN, adjudicators(3), venues(3), view);

      assertThat(rounds.get(0).byeKey()).isEqualTo("y");
      assertThat(rounds.get(1).byeKey()).isNotEqualTo("y");
    }
  }

  @Test
  void soleCompetitorSitsOutBothRounds() {
    final List<RoundResult> rounds =
        new TwoRoundOrchestrator(EngineFixtures.roundPlanner(new Random(1)))
            .run(singles("y"), List.of(), List.of(), HistoryView.empty());

    assertThat(rounds).extracting(RoundResult::byeKey).containsExactly("y", "y");
    assertThat(rounds.get(1).pairings()).singleElement().matches(Pairing::isBye);
  }

  @Test
  void everyCompetitorAppearsOncePerRound() {
    final List<RoundResult> rounds =
        new TwoRoundOrchestrator(EngineFixtures.roundPlanner(new Random(8)))
            .run(SEVEN, adjudicators(4), venues(3), HistoryView.empty());

    for (RoundResult round : rounds) {
      final List<String> names = new ArrayList<>();
      round.pairings().forEach(p -> names.addAll(p.competitorNames()));
      assertThat(names).containsExactlyInAnyOrder("t", "u", "v", "w", "x", "y", "z");
      assertThat(round.pairings()).hasSize(4);
      assertThat(round.pairings()).filteredOn(Pairing::isBye).hasSize(1);
    }
    assertThat(rounds.get(0).pairings()).allMatch(p -> p.roundNumber() == 1);
    assertThat(rounds.get(1).pairings()).allMatch(p -> p.roundNumber() == 2);
  }

  @Test
  void simulationFoldsRoundOneIntoCopyOnly() {
    final UnitFormation unitFormation = EngineFixtures.unitFormation();
    final HistoryView original = HistoryView.empty();
    final List<Unit> units = unitFormation.formSingles(singles("a", "b", "c"), original);
    final Pairing match = new Pairing(1, units.get(0), units.get(1), 0);
    match.addAdjudicator("judge-1", 0);
    match.addAdjudicator("judge-2", 0);
    match.assignVenue("room-1");
    final Pairing sitOut = Pairing.bye(1, units.get(2));
    final TwoRoundOrchestrator orchestrator =
        new TwoRoundOrchestrator(EngineFixtures.roundPlanner(new Random()));

    final HistoryView simulated = orchestrator.simulate(original, List.of(match, sitOut));

    assertThat(simulated.competitor("a").sideCount(Side.PROPOSITION)).isEqualTo(1);
    assertThat(simulated.competitor("b").sideCount(Side.OPPOSITION)).isEqualTo(1);
    assertThat(simulated.competitor("a").opponentCount("b")).isEqualTo(1);
    assertThat(simulated.competitor("b").opponentCount("a")).isEqualTo(1);
    assertThat(simulated.competitor("a").adjudicatorCount("judge-2")).isEqualTo(1);
    assertThat(simulated.competitor("c").byeCount()).isEqualTo(1);
    assertThat(simulated.adjudicator("judge-2").venueCount("room-1")).isEqualTo(1);
    assertThat(original.isEmpty()).isTrue();
    assertThat(units.get(2).history().byeCount()).isZero();
  }
}
