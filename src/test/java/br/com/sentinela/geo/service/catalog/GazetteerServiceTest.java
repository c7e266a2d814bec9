package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CatalogDataset;
import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.model.CityRecord;
import br.com.sentinela.geo.support.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GazetteerServiceTest {

    @TempDir
    Path tempDir;

    private CatalogStorage storage;
    private GazetteerService service;

    @BeforeEach
    void setUp() {
        storage = new CatalogStorage(tempDir.toString());
        service = new GazetteerService();
        ReflectionTestUtils.setField(service, "catalogStorage", storage);
        ReflectionTestUtils.setField(service, "catalogVersion", "v1");
    }

    private void writeCatalog(String version, List<CityRecord> records) {
        storage.write(CatalogDataset.builder()
                .metadata(CatalogMetadata.builder()
                        .version(version)
                        .source("ibge")
                        .primarySource("ibge")
                        .downloadedAt(Instant.parse("2024-03-01T10:00:00Z"))
                        .recordCount(records.size())
                        .checksum(CatalogStorage.computeChecksum(records))
                        .build())
                .records(records)
                .build());
    }

    @Test
    void failsBeforeLoading() {
        assertThat(service.isLoaded()).isFalse();
        assertThat(service.getMetadata()).isNull();
        assertThatThrownBy(() -> service.getGazetteer()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void loadsConfiguredVersion() {
        writeCatalog("v1", TestCatalog.records());

        CatalogMetadata metadata = service.load();

        assertThat(service.isLoaded()).isTrue();
        assertThat(metadata.getVersion()).isEqualTo("v1");
        assertThat(service.getGazetteer().size()).isEqualTo(11);
        assertThat(service.getGazetteer().contains("Campinas")).isTrue();
    }

    @Test
    void reloadSwapsGazetteer() {
        writeCatalog("v1", TestCatalog.records());
        writeCatalog("v2", TestCatalog.records().subList(0, 2));
        service.load();
        var previous = service.getGazetteer();

        service.load("v2");

        assertThat(service.getGazetteer()).isNotSameAs(previous);
        assertThat(service.getGazetteer().size()).isEqualTo(2);
        assertThat(previous.size()).isEqualTo(11);
        assertThat(service.getMetadata().getVersion()).isEqualTo("v2");
    }

    @Test
    void missingCatalogKeepsCurrentGazetteer() {
        writeCatalog("v1", TestCatalog.records());
        service.load();

        assertThatThrownBy(() -> service.load("v9")).isInstanceOf(CatalogIntegrityException.class);
        assertThat(service.getMetadata().getVersion()).isEqualTo("v1");
    }

    @Test
    void loadedCatalogCarriesItsVersion() {
        writeCatalog("v1", TestCatalog.records());
        writeCatalog("v2", TestCatalog.records());
        service.load();

        service.load("v2");

        GazetteerService.LoadedCatalog loaded = service.getLoadedCatalog();
        assertThat(loaded.getVersion()).isEqualTo("v2");
        assertThat(loaded.getGazetteer()).isSameAs(service.getGazetteer());
    }

    @Test
    void malformedVersionIsRejectedBeforeReading() {
        writeCatalog("v1", TestCatalog.records());
        service.load();

        assertThatThrownBy(() -> service.load("latest")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.load("../v1")).isInstanceOf(IllegalArgumentException.class);
        assertThat(service.getMetadata().getVersion()).isEqualTo("v1");
    }
}
