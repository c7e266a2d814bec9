package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Estados terminais da resolução de uma menção a cidade.
 */
public enum ResolutionStatus {
    RESOLVED("resolved"),
    AMBIGUOUS("ambiguous"),
    FOREIGN("foreign");

    private final String codigo;

    ResolutionStatus(String codigo) {
        this.codigo = codigo;
    }

    @JsonValue
    public String getCodigo() {
        return codigo;
    }
}
