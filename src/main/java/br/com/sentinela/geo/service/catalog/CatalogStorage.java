package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CatalogDataset;
import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.model.CityRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Leitura e gravação dos arquivos versionados do catálogo
 * ({@code <data-dir>/municipios_br_<versão>.json}).
 * <p>
 * O checksum é o SHA-256 da serialização compacta da lista de registros, com propriedades
 * em ordem alfabética e campos nulos omitidos. O mesmo conjunto de registros gera sempre
 * os mesmos bytes e o mesmo checksum.
 */
@Component
public class CatalogStorage {

    private static final Logger logger = LoggerFactory.getLogger(CatalogStorage.class);
    private static final String FILE_PREFIX = "municipios_br_";
    private static final Pattern VERSION_FORMAT = Pattern.compile("^v\\d+$");

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    @Value("${app.catalog.data-dir:data}")
    private String dataDir;

    public CatalogStorage() {
    }

    public CatalogStorage(String dataDir) {
        this.dataDir = dataDir;
    }

    /**
     * Versões seguem o formato {@code v<N>} e viram parte do nome do arquivo.
     *
     * @throws IllegalArgumentException se a versão não estiver no formato
     */
    public static String requireValidVersion(String version) {
        if (version == null || !VERSION_FORMAT.matcher(version).matches()) {
            throw new IllegalArgumentException("Versão de catálogo inválida: '" + version + "' (formato esperado v<N>)");
        }
        return version;
    }

    public Path pathFor(String version) {
        requireValidVersion(version);
        return Paths.get(dataDir).resolve(FILE_PREFIX + version + ".json");
    }

    public boolean exists(String version) {
        return Files.isRegularFile(pathFor(version));
    }

    /**
     * Grava o dataset em um arquivo temporário e move para o destino, substituindo o anterior.
     */
    public Path write(CatalogDataset dataset) {
        Path target = pathFor(dataset.getMetadata().getVersion());
        Path tmp = null;
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            tmp = Files.createTempFile(target.toAbsolutePath().getParent(), FILE_PREFIX, ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                CANONICAL_MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, dataset);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.info("Catálogo {} salvo em {} com {} municípios", dataset.getMetadata().getVersion(), target,
                    dataset.getRecords().size());
            return target;
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CatalogIntegrityException("Falha ao gravar o catálogo em " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lê o catálogo da versão e confere contagem e checksum.
     *
     * @throws CatalogIntegrityException se o arquivo não existe, não pode ser lido ou não confere
     */
    public CatalogDataset read(String version) {
        Path path = pathFor(version);
        if (!Files.isRegularFile(path)) {
            throw new CatalogIntegrityException("Catálogo de municípios não encontrado em " + path
                    + ". Execute o build do catálogo ou informe outra versão.");
        }
        CatalogDataset dataset;
        try {
            dataset = CANONICAL_MAPPER.readValue(path.toFile(), CatalogDataset.class);
        } catch (IOException e) {
            throw new CatalogIntegrityException("Catálogo ilegível em " + path + ": " + e.getMessage(), e);
        }
        verify(dataset, path);
        return dataset;
    }

    void verify(CatalogDataset dataset, Path path) {
        CatalogMetadata metadata = dataset.getMetadata();
        List<CityRecord> records = dataset.getRecords();
        if (metadata == null || records == null) {
            throw new CatalogIntegrityException("Catálogo sem metadata ou registros em " + path);
        }
        if (metadata.getRecordCount() != records.size()) {
            throw new CatalogIntegrityException(String.format(
                    "Contagem divergente em %s: metadata=%d, registros=%d",
                    path, metadata.getRecordCount(), records.size()));
        }
        String checksum = computeChecksum(records);
        if (!checksum.equals(metadata.getChecksum())) {
            throw new CatalogIntegrityException(String.format(
                    "Checksum divergente em %s: esperado=%s, calculado=%s", path, metadata.getChecksum(), checksum));
        }
    }

    public static String computeChecksum(List<CityRecord> records) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonicalBytes(records)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 indisponível", e);
        }
    }

    public static byte[] canonicalBytes(List<CityRecord> records) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(records).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new CatalogIntegrityException("Falha ao serializar registros do catálogo", e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Não foi possível remover o temporário {}: {}", tmp, e.getMessage());
        }
    }
}
