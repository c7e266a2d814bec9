package br.com.sentinela.geo.service.catalog;

/**
 * Catálogo inválido: registros abaixo do mínimo, checksum ou contagem divergente,
 * arquivo ilegível. O catálogo não é publicado nem carregado.
 */
public class CatalogIntegrityException extends RuntimeException {

    public CatalogIntegrityException(String message) {
        super(message);
    }

    public CatalogIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
