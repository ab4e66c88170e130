package com.debateleague.pairing.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.debateleague.pairing.config.PairingProperties;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

class RosterRepositoryTest {

  private final RosterRepository repository =
      new RosterRepository(
          Mockito.mock(NamedParameterJdbcTemplate.class), PairingProperties.defaults());

  @Test
  void parseConflictsTrimsAndDropsEmptyEntries() {
    assertThat(repository.parseConflicts(" ann, ,ben ,,cy"))
        .containsExactly("ann", "ben", "cy");
  }

  @Test
  void parseConflictsReturnsEmptyForBlank() {
    assertThat(repository.parseConflicts(null)).isEmpty();
    assertThat(repository.parseConflicts("   ")).isEmpty();
  }
}
