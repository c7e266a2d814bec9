package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Menção a pessoa em um artigo. O identificador da pessoa é atribuído pelo
 * {@code ExtractionResultWriter} no momento da gravação.
 */
@Value
@Builder
public class PersonOccurrence {

    @JsonProperty("article_url")
    String articleUrl;

    @JsonProperty("canonical_name")
    String canonicalName;

    @Builder.Default
    Set<String> aliases = Set.of();

    String surface;

    int start;

    int end;

    String phrase;

    String method;

    double confidence;
}
