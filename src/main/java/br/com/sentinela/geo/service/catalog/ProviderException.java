package br.com.sentinela.geo.service.catalog;

/**
 * Falha de um provedor de municípios (HTTP fora de 2xx, timeout, payload inválido ou vazio).
 * Dispara o fallback para o próximo provedor.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
