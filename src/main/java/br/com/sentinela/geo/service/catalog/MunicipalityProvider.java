package br.com.sentinela.geo.service.catalog;

import br.com.sentinela.geo.model.CatalogSource;
import br.com.sentinela.geo.model.CityRecord;

import java.util.List;

/**
 * Fonte remota de municípios usada pelo build do catálogo.
 */
public interface MunicipalityProvider {

    CatalogSource getSource();

    /**
     * @return registros ainda não limpos, na ordem do provedor
     * @throws ProviderException em qualquer falha de acesso ou payload
     */
    List<CityRecord> fetchMunicipalities();
}
