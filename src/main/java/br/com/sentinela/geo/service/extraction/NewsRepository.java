package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.NewsDocument;
import br.com.sentinela.geo.model.PipelineVersions;

import java.time.Instant;
import java.util.List;

/**
 * Origem das notícias pendentes de extração. Só devolve artigos cujas versões gravadas
 * estejam desatualizadas em relação às versões informadas.
 */
public interface NewsRepository {

    /**
     * Reserva até {@code batchSize} artigos pendentes; um artigo reservado não é entregue
     * a outro chamador até ser marcado como processado ou com erro.
     */
    List<NewsDocument> fetchPending(int batchSize, PipelineVersions versions);

    /**
     * Consulta os próximos pendentes sem reservá-los (usado no dry run).
     */
    List<NewsDocument> previewPending(int batchSize, PipelineVersions versions);

    void markProcessed(String articleUrl, PipelineVersions versions, Instant processedAt);

    void markError(String articleUrl, String message);

    /**
     * Devolve um artigo reservado e não processado (lote interrompido), sem contar como falha.
     */
    void release(String articleUrl);
}
