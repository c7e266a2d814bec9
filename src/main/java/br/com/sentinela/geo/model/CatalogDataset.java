package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Conteúdo do arquivo versionado do catálogo: metadados + registros ordenados por código IBGE.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogDataset {

    CatalogMetadata metadata;

    List<CityRecord> records;
}
