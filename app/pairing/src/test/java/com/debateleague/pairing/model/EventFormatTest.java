package com.debateleague.pairing.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class EventFormatTest {

  @Test
  void fromValueParsesTeam() {
    assertThat(EventFormat.fromValue("team")).isEqualTo(EventFormat.TEAM);
    assertThat(EventFormat.fromValue("TEAM")).isEqualTo(EventFormat.TEAM);
  }

  @Test
  void fromValueParsesSingle() {
    assertThat(EventFormat.fromValue("single")).isEqualTo(EventFormat.SINGLE);
  }

  @Test
  void roundsPerEventDifferByFormat() {
    assertThat(EventFormat.TEAM.roundsPerEvent()).isEqualTo(1);
    assertThat(EventFormat.SINGLE.roundsPerEvent()).isEqualTo(2);
  }

  @Test
  void fromValueThrowsWhenUnsupported() {
    assertThatThrownBy(() -> EventFormat.fromValue("relay"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("unsupported format");
  }

  @Test
  void sideOppositeSwapsDebatingSides() {
    assertThat(Side.PROPOSITION.opposite()).isEqualTo(Side.OPPOSITION);
    assertThat(Side.OPPOSITION.opposite()).isEqualTo(Side.PROPOSITION);
    assertThat(Side.BYE.opposite()).isEqualTo(Side.BYE);
  }
}
