package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.extraction.Gazetteer;
import br.com.sentinela.geo.model.CatalogDataset;
import br.com.sentinela.geo.model.CatalogMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mantém o {@link Gazetteer} carregado do catálogo versionado. A troca de versão substitui
 * a referência inteira; quem já pegou o gazetteer anterior continua usando-o.
 */
@Service
public class GazetteerService {

    private static final Logger logger = LoggerFactory.getLogger(GazetteerService.class);

    @Autowired
    private CatalogStorage catalogStorage;

    @Value("${app.catalog.version:v1}")
    private String catalogVersion;

    private volatile LoadedCatalog current;

    public CatalogMetadata load() {
        return load(catalogVersion);
    }

    /**
     * @throws IllegalArgumentException  se a versão não estiver no formato {@code v<N>}
     * @throws CatalogIntegrityException se o arquivo não existir, não conferir ou declarar
     *                                   outra versão
     */
    public CatalogMetadata load(String version) {
        CatalogStorage.requireValidVersion(version);
        CatalogDataset dataset = catalogStorage.read(version);
        if (!version.equals(dataset.getMetadata().getVersion())) {
            throw new CatalogIntegrityException(String.format("Arquivo do catálogo %s declara a versão %s",
                    version, dataset.getMetadata().getVersion()));
        }
        Gazetteer gazetteer = new Gazetteer(dataset.getRecords());
        current = new LoadedCatalog(gazetteer, dataset.getMetadata());
        logger.info("Gazetteer carregado: catálogo {} com {} municípios (checksum {})",
                version, gazetteer.size(), dataset.getMetadata().getChecksum());
        return dataset.getMetadata();
    }

    public boolean isLoaded() {
        return current != null;
    }

    /**
     * @throws IllegalStateException se nenhum catálogo foi carregado
     */
    public Gazetteer getGazetteer() {
        LoadedCatalog loaded = current;
        if (loaded == null) {
            throw new IllegalStateException("Gazetteer não carregado; gere ou carregue o catálogo " + catalogVersion);
        }
        return loaded.gazetteer;
    }

    public CatalogMetadata getMetadata() {
        LoadedCatalog loaded = current;
        return loaded != null ? loaded.metadata : null;
    }

    /**
     * Gazetteer e metadados do mesmo carregamento, ou {@code null} se nada foi carregado.
     */
    public LoadedCatalog getLoadedCatalog() {
        return current;
    }

    public static final class LoadedCatalog {
        private final Gazetteer gazetteer;
        private final CatalogMetadata metadata;

        public LoadedCatalog(Gazetteer gazetteer, CatalogMetadata metadata) {
            this.gazetteer = gazetteer;
            this.metadata = metadata;
        }

        public Gazetteer getGazetteer() {
            return gazetteer;
        }

        public CatalogMetadata getMetadata() {
            return metadata;
        }

        public String getVersion() {
            return metadata.getVersion();
        }
    }
}
