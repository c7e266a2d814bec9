package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Tudo o que a resolução produziu para um artigo, antes de qualquer gravação.
 */
@Value
@Builder
public class ArticleResolution {

    @JsonProperty("article_url")
    String articleUrl;

    @JsonProperty("uf_mentions")
    Set<String> ufMentions;

    @JsonProperty("city_occurrences")
    List<CityOccurrence> cityOccurrences;

    @JsonProperty("person_occurrences")
    List<PersonOccurrence> personOccurrences;

    List<CityMention> cities;

    /**
     * Versões do NER e do gazetteer com que esta resolução foi feita.
     */
    @JsonIgnore
    PipelineVersions versions;

    public long countByStatus(ResolutionStatus status) {
        return cityOccurrences.stream().filter(o -> o.getStatus() == status).count();
    }
}
