package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.NewsDocument;
import br.com.sentinela.geo.model.PipelineVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fila em memória de notícias a processar, em ordem de chegada. Um artigo retirado fica
 * "em andamento" até o ack ou a falha; artigos que falharam voltam para a fila até o
 * limite de tentativas.
 * <p>
 * Artigos já processados continuam na fila para que uma troca de versão do pipeline os
 * reentregue, até o limite de {@code app.extraction.queue.max-retained}; acima dele os
 * processados mais antigos são descartados.
 */
@Component
public class PendingNewsQueue {

    private static final Logger logger = LoggerFactory.getLogger(PendingNewsQueue.class);

    private final Map<String, QueueEntry> entries = new LinkedHashMap<>();

    @Value("${app.extraction.queue.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${app.extraction.queue.max-retained:10000}")
    private int maxRetained = 10000;

    public PendingNewsQueue() {
    }

    public PendingNewsQueue(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public PendingNewsQueue(int maxAttempts, int maxRetained) {
        this.maxAttempts = maxAttempts;
        this.maxRetained = maxRetained;
    }

    /**
     * Enfileira ou substitui o artigo de mesma URL. Um artigo substituído zera as falhas,
     * mas mantém as versões com que já foi processado se informado sem versões e com o
     * mesmo conteúdo. Conteúdo novo chegando com o artigo em andamento não é marcado pelo
     * ack do conteúdo antigo.
     */
    public synchronized void enqueue(NewsDocument document) {
        if (document == null || document.getUrl() == null || document.getUrl().isBlank()) {
            throw new IllegalArgumentException("Notícia sem URL não pode ser enfileirada");
        }
        QueueEntry existing = entries.get(document.getUrl());
        NewsDocument stored = document;
        if (existing != null && document.getNerVersion() == null && document.getGazetteerVersion() == null
                && sameContent(existing.document, document)) {
            stored = document.toBuilder()
                    .nerVersion(existing.document.getNerVersion())
                    .gazetteerVersion(existing.document.getGazetteerVersion())
                    .build();
        }
        QueueEntry entry = new QueueEntry(stored);
        entry.processed = stored != document && existing.processed;
        if (existing != null && existing.inFlight) {
            entry.inFlight = true;
            entry.dirty = existing.dirty || !sameContent(existing.document, document);
            if (entry.dirty) {
                logger.info("Notícia {} atualizada durante o processamento; será entregue de novo", document.getUrl());
            }
        }
        entries.put(document.getUrl(), entry);
        logger.debug("Notícia {} enfileirada", document.getUrl());
    }

    public synchronized List<NewsDocument> pull(int batchSize, PipelineVersions versions) {
        List<NewsDocument> batch = new ArrayList<>();
        for (QueueEntry entry : entries.values()) {
            if (batch.size() >= batchSize) {
                break;
            }
            if (isDeliverable(entry, versions)) {
                entry.inFlight = true;
                batch.add(entry.document);
            }
        }
        return batch;
    }

    public synchronized List<NewsDocument> peek(int batchSize, PipelineVersions versions) {
        List<NewsDocument> batch = new ArrayList<>();
        for (QueueEntry entry : entries.values()) {
            if (batch.size() >= batchSize) {
                break;
            }
            if (isDeliverable(entry, versions)) {
                batch.add(entry.document);
            }
        }
        return batch;
    }

    public synchronized void ack(String articleUrl, PipelineVersions versions, Instant processedAt) {
        QueueEntry entry = entries.get(articleUrl);
        if (entry == null) {
            logger.warn("Ack para notícia desconhecida {}", articleUrl);
            return;
        }
        entry.inFlight = false;
        entry.failures = 0;
        entry.lastError = null;
        if (entry.dirty) {
            entry.dirty = false;
            logger.debug("Ack de {} refere-se ao conteúdo anterior; versão nova segue pendente", articleUrl);
            return;
        }
        entry.document = entry.document.toBuilder()
                .nerVersion(versions.getNerVersion())
                .gazetteerVersion(versions.getGazetteerVersion())
                .build();
        entry.processed = true;
        logger.debug("Notícia {} processada em {}", articleUrl, processedAt);
        compact();
    }

    public synchronized void fail(String articleUrl, String message) {
        QueueEntry entry = entries.get(articleUrl);
        if (entry == null) {
            logger.warn("Falha registrada para notícia desconhecida {}: {}", articleUrl, message);
            return;
        }
        entry.inFlight = false;
        if (entry.dirty) {
            entry.dirty = false;
            logger.warn("Falha em {} refere-se ao conteúdo anterior e não é contada: {}", articleUrl, message);
            return;
        }
        entry.failures++;
        entry.lastError = message;
        if (entry.failures >= maxAttempts) {
            logger.warn("Notícia {} atingiu {} falhas e não será mais entregue: {}", articleUrl, entry.failures, message);
        }
    }

    public synchronized void release(String articleUrl) {
        QueueEntry entry = entries.get(articleUrl);
        if (entry != null) {
            entry.inFlight = false;
            entry.dirty = false;
        }
    }

    public synchronized int pendingCount(PipelineVersions versions) {
        int count = 0;
        for (QueueEntry entry : entries.values()) {
            if (isDeliverable(entry, versions)) {
                count++;
            }
        }
        return count;
    }

    public synchronized NewsDocument get(String articleUrl) {
        QueueEntry entry = entries.get(articleUrl);
        return entry != null ? entry.document : null;
    }

    public synchronized String lastError(String articleUrl) {
        QueueEntry entry = entries.get(articleUrl);
        return entry != null ? entry.lastError : null;
    }

    public synchronized int size() {
        return entries.size();
    }

    // Descarta processados (e esgotados) mais antigos enquanto a fila passar do limite
    private void compact() {
        if (entries.size() <= maxRetained) {
            return;
        }
        int removed = 0;
        Iterator<QueueEntry> it = entries.values().iterator();
        while (it.hasNext() && entries.size() > maxRetained) {
            QueueEntry entry = it.next();
            if (!entry.inFlight && (entry.processed || entry.failures >= maxAttempts)) {
                it.remove();
                removed++;
            }
        }
        logger.debug("{} notícias antigas removidas da fila ({} restantes)", removed, entries.size());
    }

    private boolean isDeliverable(QueueEntry entry, PipelineVersions versions) {
        return !entry.inFlight && entry.failures < maxAttempts && versions.isStale(entry.document);
    }

    private static boolean sameContent(NewsDocument a, NewsDocument b) {
        return a.getCombinedText().equals(b.getCombinedText());
    }

    private static final class QueueEntry {
        private NewsDocument document;
        private boolean inFlight;
        private boolean dirty;
        private boolean processed;
        private int failures;
        private String lastError;

        private QueueEntry(NewsDocument document) {
            this.document = document;
        }
    }
}
