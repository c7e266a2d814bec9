package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CatalogDataset;
import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.model.CityRecord;
import br.com.sentinela.geo.support.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogStorageTest {

    @TempDir
    Path tempDir;

    private CatalogStorage storage;

    @BeforeEach
    void setUp() {
        storage = new CatalogStorage(tempDir.resolve("data").toString());
    }

    private static CatalogDataset dataset(String version, List<CityRecord> records) {
        CatalogMetadata metadata = CatalogMetadata.builder()
                .version(version)
                .source("ibge")
                .primarySource("ibge")
                .downloadedAt(Instant.parse("2024-03-01T10:00:00Z"))
                .recordCount(records.size())
                .checksum(CatalogStorage.computeChecksum(records))
                .build();
        return CatalogDataset.builder().metadata(metadata).records(records).build();
    }

    @Test
    void writesVersionedFileAndReadsItBack() {
        CatalogDataset written = dataset("v1", new CatalogRecordCleaner().clean(TestCatalog.records()));

        Path path = storage.write(written);
        CatalogDataset read = storage.read("v1");

        assertThat(path.getFileName().toString()).isEqualTo("municipios_br_v1.json");
        assertThat(storage.exists("v1")).isTrue();
        assertThat(read.getMetadata()).isEqualTo(written.getMetadata());
        assertThat(read.getRecords()).isEqualTo(written.getRecords());
    }

    @Test
    void fileHasMetadataAndRecordsKeys() throws Exception {
        storage.write(dataset("v2", TestCatalog.records()));

        String json = Files.readString(storage.pathFor("v2"), StandardCharsets.UTF_8);

        assertThat(json).contains("\"metadata\"", "\"records\"", "\"record_count\" : 11", "\"ibge_id\"");
        try (var files = Files.list(tempDir.resolve("data"))) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("municipios_br_v2.json");
        }
    }

    @Test
    void versionMustFollowFormat() {
        assertThat(CatalogStorage.requireValidVersion("v12")).isEqualTo("v12");
        assertThatThrownBy(() -> storage.pathFor("latest")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.write(dataset("v1/../../fora", TestCatalog.records())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.exists(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tamperedFileFailsVerification() throws Exception {
        storage.write(dataset("v1", TestCatalog.records()));
        Path path = storage.pathFor("v1");
        Files.writeString(path, Files.readString(path).replace("Campinas", "Campinass"));

        assertThatThrownBy(() -> storage.read("v1"))
                .isInstanceOf(CatalogIntegrityException.class)
                .hasMessageContaining("Checksum divergente");
    }

    @Test
    void countMismatchFailsVerification() {
        List<CityRecord> records = TestCatalog.records();
        CatalogDataset wrongCount = CatalogDataset.builder()
                .metadata(CatalogMetadata.builder()
                        .version("v1")
                        .recordCount(records.size() + 1)
                        .checksum(CatalogStorage.computeChecksum(records))
                        .build())
                .records(records)
                .build();

        assertThatThrownBy(() -> storage.verify(wrongCount, storage.pathFor("v1")))
                .isInstanceOf(CatalogIntegrityException.class)
                .hasMessageContaining("Contagem divergente");
    }

    @Test
    void missingFileIsReported() {
        assertThatThrownBy(() -> storage.read("inexistente"))
                .isInstanceOf(CatalogIntegrityException.class)
                .hasMessageContaining("não encontrado");
    }

    @Test
    void checksumIsDeterministic() {
        List<CityRecord> sorted = new CatalogRecordCleaner().clean(TestCatalog.records());
        List<CityRecord> shuffled = new ArrayList<>(TestCatalog.records());
        Collections.reverse(shuffled);

        assertThat(CatalogStorage.computeChecksum(sorted))
                .isEqualTo(CatalogStorage.computeChecksum(new CatalogRecordCleaner().clean(shuffled)))
                .hasSize(64);
        assertThat(CatalogStorage.canonicalBytes(sorted)).isEqualTo(CatalogStorage.canonicalBytes(sorted));
    }
}
