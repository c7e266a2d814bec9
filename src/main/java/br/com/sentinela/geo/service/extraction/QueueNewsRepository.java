package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.NewsDocument;
import br.com.sentinela.geo.model.PipelineVersions;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * {@link NewsRepository} sobre a {@link PendingNewsQueue} em memória.
 */
@Component
public class QueueNewsRepository implements NewsRepository {

    @Autowired
    private PendingNewsQueue queue;

    public QueueNewsRepository() {
    }

    public QueueNewsRepository(PendingNewsQueue queue) {
        this.queue = queue;
    }

    @Override
    public List<NewsDocument> fetchPending(int batchSize, PipelineVersions versions) {
        return queue.pull(batchSize, versions);
    }

    @Override
    public List<NewsDocument> previewPending(int batchSize, PipelineVersions versions) {
        return queue.peek(batchSize, versions);
    }

    @Override
    public void markProcessed(String articleUrl, PipelineVersions versions, Instant processedAt) {
        queue.ack(articleUrl, versions, processedAt);
    }

    @Override
    public void markError(String articleUrl, String message) {
        queue.fail(articleUrl, message);
    }

    @Override
    public void release(String articleUrl) {
        queue.release(articleUrl);
    }
}
