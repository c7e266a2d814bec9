package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CityRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static br.com.sentinela.geo.support.TestCatalog.city;
import static org.assertj.core.api.Assertions.assertThat;

class CatalogRecordCleanerTest {

    private final CatalogRecordCleaner cleaner = new CatalogRecordCleaner();

    @Test
    void discardsRecordsWithoutIdOrName() {
        List<CityRecord> cleaned = cleaner.clean(List.of(
                city(" ", "Sem Código", "SP", null, null, false),
                city("3509502", "  ", "SP", null, null, false),
                city(null, "Nulo", "SP", null, null, false),
                city("3509502", "Campinas", "SP", null, null, false)));

        assertThat(cleaned).extracting(CityRecord::getName).containsExactly("Campinas");
    }

    @Test
    void firstDuplicateWins() {
        List<CityRecord> cleaned = cleaner.clean(List.of(
                city("3509502", "Campinas", "SP", null, null, false),
                city(" 3509502 ", "Campinas Duplicada", "SP", null, null, false)));

        assertThat(cleaned).hasSize(1);
        assertThat(cleaned.get(0).getName()).isEqualTo("Campinas");
    }

    @Test
    void sortsByNumericIbgeId() {
        List<CityRecord> cleaned = cleaner.clean(List.of(
                city("5103353", "Mirassol d'Oeste", "MT", null, null, false),
                city("1100015", "Alta Floresta D'Oeste", "RO", null, null, false),
                city("3509502", "Campinas", "SP", null, null, false)));

        assertThat(cleaned).extracting(CityRecord::getIbgeId).containsExactly("1100015", "3509502", "5103353");
    }

    @Test
    void completesStateAndRegionFromUf() {
        CityRecord record = cleaner.clean(List.of(city("3509502", " Campinas ", "sp", null, null, false))).get(0);

        assertThat(record.getName()).isEqualTo("Campinas");
        assertThat(record.getUf()).isEqualTo("SP");
        assertThat(record.getState()).isEqualTo("São Paulo");
        assertThat(record.getRegion()).isEqualTo("Sudeste");
    }

    @Test
    void generatesAlternateNamesWithoutApostrophe() {
        CityRecord record = cleaner.clean(List.of(city("5103353", "Mirassol d'Oeste", "MT", null, null, false))).get(0);

        assertThat(record.getAltNames()).containsExactlyInAnyOrder("Mirassol dOeste", "Mirassol d Oeste");
    }

    @Test
    void hyphenatedNameGetsSpacedAlternative() {
        CityRecord record = cleaner.clean(List.of(city("3515103", "Embu-Guaçu", "SP", null, null, false))).get(0);

        assertThat(record.getAltNames()).containsExactly("Embu Guaçu");
    }
}
