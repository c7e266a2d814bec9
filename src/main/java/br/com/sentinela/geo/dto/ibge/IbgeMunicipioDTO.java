package br.com.sentinela.geo.dto.ibge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * DTO de um município da API de localidades do IBGE
 * ({@code /api/v1/localidades/municipios}).
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IbgeMunicipioDTO {
    private Long id;
    private String nome;
    private MicrorregiaoDTO microrregiao;

    // Municípios recentes vêm sem microrregião, só com a divisão regional de 2017
    @JsonProperty("regiao-imediata")
    private RegiaoImediataDTO regiaoImediata;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MicrorregiaoDTO {
        private Long id;
        private String nome;
        private MesorregiaoDTO mesorregiao;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MesorregiaoDTO {
        private Long id;
        private String nome;
        @JsonProperty("UF")
        private UfDTO uf;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegiaoImediataDTO {
        private Long id;
        private String nome;
        @JsonProperty("regiao-intermediaria")
        private RegiaoIntermediariaDTO regiaoIntermediaria;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegiaoIntermediariaDTO {
        private Long id;
        private String nome;
        @JsonProperty("UF")
        private UfDTO uf;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UfDTO {
        private Long id;
        private String sigla;
        private String nome;
        private RegiaoDTO regiao;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegiaoDTO {
        private Long id;
        private String sigla;
        private String nome;
    }
}
