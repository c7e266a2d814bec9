package br.com.sentinela.geo.dto.brasilapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO de um município da BrasilAPI. Campos numéricos chegam ora como número, ora como texto,
 * por isso são lidos como String.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrasilApiMunicipioDTO {
    private String nome;

    @JsonProperty("codigo_ibge")
    private String codigoIbge;

    private String codigo;
    private String estado;
    private String uf;
    private String regiao;
    private Boolean capital;
    private String latitude;
    private String longitude;
    private String ddd;

    @JsonProperty("siafi_id")
    private String siafiId;

    @JsonProperty("fuso_horario")
    private String fusoHorario;

    private String timezone;
}
