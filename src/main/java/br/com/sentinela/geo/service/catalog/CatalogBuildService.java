package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CatalogDataset;
import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.model.CatalogSource;
import br.com.sentinela.geo.model.CityRecord;
import br.com.sentinela.geo.service.AlertService;
import br.com.sentinela.geo.service.PipelineStatusService;
import br.com.sentinela.geo.service.PipelineStatusService.RunType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gera o catálogo versionado de municípios: baixa do provedor primário, cai para os demais
 * em caso de falha, limpa, calcula o checksum e grava o arquivo da versão.
 */
@Service
public class CatalogBuildService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogBuildService.class);

    @Autowired
    private List<MunicipalityProvider> providers;

    @Autowired
    private CatalogRecordCleaner recordCleaner;

    @Autowired
    private CatalogStorage catalogStorage;

    @Autowired
    private PipelineStatusService statusService;

    @Autowired
    private AlertService alertService;

    @Autowired
    private Clock clock;

    @Value("${app.catalog.version:v1}")
    private String defaultVersion;

    @Value("${app.catalog.primary-source:ibge}")
    private String defaultPrimarySource;

    @Value("${app.catalog.min-records:5000}")
    private int minRecords;

    @Value("${app.catalog.retry.max-attempts:3}")
    private int maxRetryAttempts;

    @Value("${app.catalog.retry.delay-ms:5000}")
    private long retryDelayMs;

    /**
     * Build com a versão e a fonte primária configuradas.
     */
    public CatalogMetadata build(boolean refresh) {
        return build(CatalogSource.fromCodigo(defaultPrimarySource), defaultVersion, refresh);
    }

    /**
     * Gera a versão do catálogo. Sem {@code refresh}, uma versão já existente é apenas
     * verificada e seus metadados devolvidos.
     *
     * @throws IllegalArgumentException  se a versão não estiver no formato {@code v<N>}
     * @throws CatalogBuildException     se todos os provedores falharem
     * @throws CatalogIntegrityException se o catálogo ficar abaixo do mínimo de registros
     *                                   ou o arquivo existente não conferir
     */
    public CatalogMetadata build(CatalogSource primary, String version, boolean refresh) {
        CatalogStorage.requireValidVersion(version);
        try {
            if (catalogStorage.exists(version) && !refresh) {
                logger.info("Catálogo {} já existe em {}; use refresh para sobrescrever", version,
                        catalogStorage.pathFor(version));
                return catalogStorage.read(version).getMetadata();
            }

            logger.info("=== INÍCIO DO BUILD DO CATÁLOGO {} (fonte primária: {}) ===", version, primary.getCodigo());
            FetchResult fetched = fetchCatalog(primary);
            List<CityRecord> records = fetched.records;

            if (records.size() < minRecords) {
                throw new CatalogIntegrityException(String.format(
                        "Catálogo %s com %d municípios, abaixo do mínimo de %d; nada foi publicado",
                        version, records.size(), minRecords));
            }

            CatalogMetadata metadata = CatalogMetadata.builder()
                    .version(version)
                    .source(fetched.source.getCodigo())
                    .primarySource(primary.getCodigo())
                    .downloadedAt(Instant.now(clock))
                    .recordCount(records.size())
                    .checksum(CatalogStorage.computeChecksum(records))
                    .build();
            catalogStorage.write(CatalogDataset.builder().metadata(metadata).records(records).build());

            statusService.registerSuccess(RunType.CATALOG_BUILD, String.format("catálogo %s: %d municípios via %s",
                    version, records.size(), fetched.source.getCodigo()));
            logger.info("=== BUILD DO CATÁLOGO {} CONCLUÍDO: {} municípios, fonte efetiva {} ===",
                    version, records.size(), fetched.source.getCodigo());
            return metadata;
        } catch (CatalogBuildException | CatalogIntegrityException e) {
            logger.error("=== ERRO NO BUILD DO CATÁLOGO {}: {} ===", version, e.getMessage(), e);
            statusService.registerFailure(RunType.CATALOG_BUILD, e.getMessage());
            alertService.sendFailureAlert("build do catálogo " + version, e.getMessage());
            throw e;
        }
    }

    /**
     * Tenta a fonte primária e, em seguida, as demais na ordem em que foram registradas.
     */
    FetchResult fetchCatalog(CatalogSource primary) {
        List<String> errors = new ArrayList<>();
        for (MunicipalityProvider provider : orderedProviders(primary)) {
            try {
                List<CityRecord> cleaned = recordCleaner.clean(fetchWithRetry(provider));
                if (cleaned.isEmpty()) {
                    throw new ProviderException("Fonte " + provider.getSource().getCodigo()
                            + " não retornou registros válidos após a limpeza");
                }
                if (provider.getSource() != primary) {
                    logger.warn("Catálogo obtido pela fonte de fallback {}", provider.getSource().getCodigo());
                }
                return new FetchResult(cleaned, provider.getSource());
            } catch (ProviderException e) {
                logger.warn("Falha ao usar a fonte {}: {}", provider.getSource().getCodigo(), e.getMessage());
                errors.add(provider.getSource().getCodigo() + ": " + e.getMessage());
            }
        }
        throw new CatalogBuildException("Não foi possível obter o catálogo de municípios (" + String.join("; ", errors) + ")");
    }

    List<CityRecord> fetchWithRetry(MunicipalityProvider provider) {
        int attempts = Math.max(1, maxRetryAttempts);
        ProviderException lastException = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (attempt > 1) {
                logger.info("Tentativa {} de {} na fonte {}", attempt, attempts, provider.getSource().getCodigo());
                try {
                    Thread.sleep(retryDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ProviderException("Interrompido aguardando nova tentativa na fonte "
                            + provider.getSource().getCodigo(), ie);
                }
            }
            try {
                return provider.fetchMunicipalities();
            } catch (ProviderException e) {
                lastException = e;
                logger.warn("Falha na tentativa {} na fonte {}: {}", attempt, provider.getSource().getCodigo(),
                        e.getMessage());
            }
        }
        throw lastException;
    }

    private List<MunicipalityProvider> orderedProviders(CatalogSource primary) {
        List<MunicipalityProvider> ordered = new ArrayList<>();
        for (MunicipalityProvider provider : providers) {
            if (provider.getSource() == primary) {
                ordered.add(provider);
            }
        }
        for (MunicipalityProvider provider : providers) {
            if (provider.getSource() != primary) {
                ordered.add(provider);
            }
        }
        return ordered;
    }

    static final class FetchResult {
        private final List<CityRecord> records;
        private final CatalogSource source;

        FetchResult(List<CityRecord> records, CatalogSource source) {
            this.records = records;
            this.source = source;
        }

        List<CityRecord> getRecords() {
            return records;
        }

        CatalogSource getSource() {
            return source;
        }
    }
}
