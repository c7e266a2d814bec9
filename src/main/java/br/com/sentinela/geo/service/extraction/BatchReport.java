package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.ArticleResolution;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Contagens de um lote de extração. No dry run, {@code resolutions} traz o que teria sido gravado.
 */
@Value
@Builder
public class BatchReport {

    @JsonProperty("dry_run")
    boolean dryRun;

    int fetched;

    int processed;

    @JsonProperty("skipped_empty")
    int skippedEmpty;

    @JsonProperty("city_occurrences")
    int cityOccurrences;

    int resolved;

    int ambiguous;

    int foreign;

    @JsonProperty("person_occurrences")
    int personOccurrences;

    // Interrompido antes de percorrer todos os artigos
    boolean stopped;

    @Builder.Default
    List<ArticleError> errors = List.of();

    @Builder.Default
    List<ArticleResolution> resolutions = List.of();

    @Value
    public static class ArticleError {
        @JsonProperty("article_url")
        String articleUrl;
        String message;
    }
}
