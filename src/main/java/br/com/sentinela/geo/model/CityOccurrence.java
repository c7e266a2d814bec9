package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Resultado da resolução de um trecho em um artigo. Chave de idempotência:
 * {@code (articleUrl, start, end)}.
 */
@Value
@Builder(toBuilder = true)
public class CityOccurrence {

    @JsonProperty("article_url")
    String articleUrl;

    String surface;

    int start;

    int end;

    @JsonProperty("uf_hint")
    String ufHint;

    ResolutionStatus status;

    // Código IBGE, preenchido apenas quando status = RESOLVED
    @JsonProperty("resolved_city")
    String resolvedCity;

    @Builder.Default
    List<CityCandidate> candidates = List.of();

    double confidence;

    String phrase;

    String method;

    @JsonProperty("ner_version")
    String nerVersion;

    @JsonProperty("gazetteer_version")
    String gazetteerVersion;
}
