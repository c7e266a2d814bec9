package br.com.sentinela.geo.controller;

import br.com.sentinela.geo.dto.ResolveRequestDTO;
import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.NewsDocument;
import br.com.sentinela.geo.service.catalog.GazetteerService;
import br.com.sentinela.geo.service.extraction.ExtractionBatchService;
import br.com.sentinela.geo.service.extraction.PendingNewsQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/extraction")
public class ExtractionController {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionController.class);

    @Autowired
    private PendingNewsQueue pendingNewsQueue;

    @Autowired
    private ExtractionBatchService extractionBatchService;

    @Autowired
    private GazetteerService gazetteerService;

    /**
     * Enfileira notícias para o próximo lote
     */
    @PostMapping("/enqueue")
    public ResponseEntity<Map<String, Object>> enqueue(@RequestBody List<NewsDocument> documents) {
        int accepted = 0;
        for (NewsDocument document : documents) {
            try {
                pendingNewsQueue.enqueue(document);
                accepted++;
            } catch (IllegalArgumentException e) {
                logger.warn("Notícia rejeitada: {}", e.getMessage());
            }
        }
        int pending = pendingNewsQueue.pendingCount(extractionBatchService.getPipelineVersions());
        return ResponseEntity.ok(Map.of(
                "accepted", accepted,
                "rejected", documents.size() - accepted,
                "pending", pending
        ));
    }

    /**
     * Resolve uma notícia e devolve o resultado sem gravar nada
     */
    @PostMapping("/resolve")
    public ResponseEntity<?> resolve(@RequestBody ResolveRequestDTO request) {
        if (!gazetteerService.isLoaded()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("message", "Gazetteer não carregado"));
        }
        if (request.getArticle() == null) {
            return ResponseEntity.badRequest().body(Map.of("message", "Campo 'article' obrigatório"));
        }
        ArticleResolution resolution = extractionBatchService.resolveArticle(request.getArticle(),
                request.toEntitySpans());
        return ResponseEntity.ok(resolution);
    }

    @GetMapping("/pending")
    public ResponseEntity<Map<String, Object>> pending() {
        return ResponseEntity.ok(Map.of(
                "pending", pendingNewsQueue.pendingCount(extractionBatchService.getPipelineVersions()),
                "total", pendingNewsQueue.size()
        ));
    }
}
