package br.com.sentinela.geo.service.catalog;

/**
 * Nenhum provedor conseguiu entregar o catálogo. Fatal para o build.
 */
public class CatalogBuildException extends RuntimeException {

    public CatalogBuildException(String message) {
        super(message);
    }

    public CatalogBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
