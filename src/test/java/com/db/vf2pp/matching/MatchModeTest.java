package com.db.vf2pp.matching;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MatchModeTest {

    @Test
    void modeNamesAreParsedLeniently() {
        assertThat(MatchMode.fromName("")).isEqualTo(MatchMode.ISOMORPHISM);
        assertThat(MatchMode.fromName(null)).isEqualTo(MatchMode.ISOMORPHISM);
        assertThat(MatchMode.fromName(" Subgraph ")).isEqualTo(MatchMode.INDUCED_SUBGRAPH);
        assertThat(MatchMode.fromName("induced-subgraph")).isEqualTo(MatchMode.INDUCED_SUBGRAPH);
        assertThat(MatchMode.fromName("mono")).isEqualTo(MatchMode.MONOMORPHISM);
        assertThatThrownBy(() -> MatchMode.fromName("homomorphism"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("homomorphism");
    }

    @Test
    void onlyMonomorphismIgnoresNonEdges() {
        assertThat(MatchMode.ISOMORPHISM.isExact()).isTrue();
        assertThat(MatchMode.INDUCED_SUBGRAPH.isExact()).isFalse();
        assertThat(MatchMode.INDUCED_SUBGRAPH.preservesNonEdges()).isTrue();
        assertThat(MatchMode.MONOMORPHISM.preservesNonEdges()).isFalse();
    }
}
