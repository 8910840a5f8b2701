package com.sessionradar.ingester.session;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class PseudoSessionRuleTest {
  private final PseudoSessionRule rule = new PseudoSessionRule(List.of("_atis", " "));

  @Test
  void matchesControllerSuffixIgnoringCase() {
    assertThat(rule.isPseudo(ParticipantCategory.CONTROLLER, "opkc_atis")).isTrue();
    assertThat(rule.isPseudo(ParticipantCategory.CONTROLLER, "OPKC_TWR")).isFalse();
    assertThat(rule.suffixes()).containsExactly("_ATIS");
  }

  @Test
  void neverAppliesToPilots() {
    assertThat(rule.isPseudo(ParticipantCategory.PILOT, "TEST_ATIS")).isFalse();
  }
}
