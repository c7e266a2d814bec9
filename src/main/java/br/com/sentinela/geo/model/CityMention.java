package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Cidade resolvida agregada por artigo: quantas vezes apareceu e por quais métodos.
 */
@Value
@Builder
public class CityMention {

    @JsonProperty("ibge_id")
    String ibgeId;

    String label;

    String uf;

    int occurrences;

    List<String> sources;
}
