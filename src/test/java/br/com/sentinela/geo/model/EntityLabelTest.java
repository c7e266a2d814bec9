package br.com.sentinela.geo.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntityLabelTest {

    @Test
    void mapsLabelsFromDifferentNerEngines() {
        assertThat(EntityLabel.fromNerLabel("PER")).isEqualTo(EntityLabel.PERSON);
        assertThat(EntityLabel.fromNerLabel("person")).isEqualTo(EntityLabel.PERSON);
        assertThat(EntityLabel.fromNerLabel("LOC")).isEqualTo(EntityLabel.LOCATION);
        assertThat(EntityLabel.fromNerLabel(" gpe ")).isEqualTo(EntityLabel.LOCATION);
        assertThat(EntityLabel.fromNerLabel("CITY")).isEqualTo(EntityLabel.LOCATION);
    }

    @Test
    void unknownLabelsAreIgnored() {
        assertThat(EntityLabel.fromNerLabel("ORG")).isNull();
        assertThat(EntityLabel.fromNerLabel(null)).isNull();
    }
}
