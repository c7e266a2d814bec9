package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Município do catálogo (gazetteer). Imutável depois de criado pelo builder do catálogo
 * e identificado entre versões pelo código IBGE.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CityRecord {

    @JsonProperty("ibge_id")
    String ibgeId;

    String name;

    String uf;

    String state;

    String region;

    // Grafias alternativas já normalizadas
    @JsonProperty("alt_names")
    @Builder.Default
    SortedSet<String> altNames = Collections.emptySortedSet();

    Double latitude;

    Double longitude;

    boolean capital;

    @JsonProperty("siafi_id")
    String siafiId;

    String ddd;

    String timezone;

    String mesoregion;

    String microregion;

    public SortedSet<String> getAltNames() {
        return altNames == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(altNames));
    }
}
