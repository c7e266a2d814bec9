package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provedores de dados de municípios suportados pelo builder do catálogo.
 */
public enum CatalogSource {
    IBGE("ibge"),
    BRASILAPI("brasilapi");

    private final String codigo;

    CatalogSource(String codigo) {
        this.codigo = codigo;
    }

    @JsonValue
    public String getCodigo() {
        return codigo;
    }

    public static CatalogSource fromCodigo(String codigo) {
        for (CatalogSource source : values()) {
            if (source.codigo.equalsIgnoreCase(codigo.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("Fonte de catálogo desconhecida: " + codigo);
    }
}
