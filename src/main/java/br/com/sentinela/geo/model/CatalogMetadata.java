package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Metadados gravados junto com cada versão do catálogo de municípios.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogMetadata {

    String version;

    // Fonte efetivamente usada (pode ser o fallback)
    String source;

    @JsonProperty("primary_source")
    String primarySource;

    @JsonProperty("downloaded_at")
    Instant downloadedAt;

    @JsonProperty("record_count")
    int recordCount;

    String checksum;
}
