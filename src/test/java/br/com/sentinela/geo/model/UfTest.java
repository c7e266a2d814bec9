package br.com.sentinela.geo.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UfTest {

    @Test
    void hasAllTwentySevenFederativeUnits() {
        assertThat(Uf.values()).hasSize(27);
    }

    @Test
    void findsBySiglaIgnoringCase() {
        assertThat(Uf.fromSigla("sp")).isEqualTo(Uf.SP);
        assertThat(Uf.fromSigla(" RN ")).isEqualTo(Uf.RN);
        assertThat(Uf.fromSigla("XX")).isNull();
        assertThat(Uf.fromSigla(null)).isNull();
    }

    @Test
    void commonWordsRequireUpperCase() {
        assertThat(Uf.PA.exigeCaixaAlta()).isTrue();
        assertThat(Uf.SE.exigeCaixaAlta()).isTrue();
        assertThat(Uf.SP.exigeCaixaAlta()).isFalse();
    }
}
