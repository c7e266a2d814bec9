package br.com.sentinela.geo.util;

/**
 * Constantes da aplicação que são usadas em diversos lugares do sistema.
 */
public final class AppConstants {

    private AppConstants() {
        // Construtor privado para evitar instanciação
    }

    /**
     * Cabeçalho com a chave de API dos endpoints administrativos
     */
    public static final String API_KEY_HEADER = "X-API-Key";

    /**
     * Maior lote aceito pelos endpoints de processamento
     */
    public static final int MAX_BATCH_SIZE = 5000;
}
