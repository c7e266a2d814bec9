package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CityCandidate {

    @JsonProperty("ibge_id")
    String ibgeId;

    String name;

    String uf;

    double score;

    public static CityCandidate of(CityRecord record, double score) {
        return CityCandidate.builder()
                .ibgeId(record.getIbgeId())
                .name(record.getName())
                .uf(record.getUf())
                .score(score)
                .build();
    }
}
