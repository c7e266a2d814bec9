package br.com.sentinela.geo.controller;

import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.model.CatalogSource;
import br.com.sentinela.geo.service.catalog.CatalogBuildException;
import br.com.sentinela.geo.service.catalog.CatalogBuildService;
import br.com.sentinela.geo.service.catalog.CatalogIntegrityException;
import br.com.sentinela.geo.service.catalog.GazetteerService;
import br.com.sentinela.geo.service.extraction.BatchReport;
import br.com.sentinela.geo.service.extraction.ExtractionBatchService;
import br.com.sentinela.geo.util.AppConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Ações administrativas: build do catálogo, recarga do gazetteer e lotes de extração.
 * Protegido por API key.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    @Autowired
    private CatalogBuildService catalogBuildService;

    @Autowired
    private GazetteerService gazetteerService;

    @Autowired
    private ExtractionBatchService extractionBatchService;

    @Value("${app.admin.secret-key:defaultKey}")
    private String secretKey;

    @Value("${app.catalog.version:v1}")
    private String defaultVersion;

    @Value("${app.catalog.primary-source:ibge}")
    private String defaultPrimarySource;

    /**
     * Gera (ou, sem refresh, apenas verifica) uma versão do catálogo e recarrega o gazetteer
     * se a versão gerada for a configurada.
     */
    @PostMapping("/catalog/build")
    public ResponseEntity<Map<String, Object>> buildCatalog(
            @RequestHeader(value = AppConstants.API_KEY_HEADER) String apiKey,
            @RequestParam(value = "source", required = false) String source,
            @RequestParam(value = "version", required = false) String version,
            @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {

        if (!secretKey.equals(apiKey)) {
            logger.warn("Tentativa de build do catálogo com chave de API inválida");
            return unauthorized();
        }

        CatalogSource primary;
        try {
            primary = CatalogSource.fromCodigo(source != null ? source : defaultPrimarySource);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", e.getMessage()));
        }
        String targetVersion = version != null && !version.isBlank() ? version : defaultVersion;

        logger.info("Build do catálogo {} solicitado via endpoint REST em {}", targetVersion, LocalDateTime.now());
        try {
            CatalogMetadata metadata = catalogBuildService.build(primary, targetVersion, refresh);
            if (targetVersion.equals(defaultVersion)) {
                gazetteerService.load(targetVersion);
            }
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "metadata", metadata,
                    "timestamp", LocalDateTime.now().toString()
            ));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", e.getMessage()));
        } catch (CatalogBuildException | CatalogIntegrityException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(Map.of(
                            "success", false,
                            "message", e.getMessage(),
                            "timestamp", LocalDateTime.now().toString()
                    ));
        }
    }

    @PostMapping("/gazetteer/reload")
    public ResponseEntity<Map<String, Object>> reloadGazetteer(
            @RequestHeader(value = AppConstants.API_KEY_HEADER) String apiKey,
            @RequestParam(value = "version", required = false) String version) {

        if (!secretKey.equals(apiKey)) {
            logger.warn("Tentativa de recarga do gazetteer com chave de API inválida");
            return unauthorized();
        }
        try {
            CatalogMetadata metadata = version != null && !version.isBlank()
                    ? gazetteerService.load(version)
                    : gazetteerService.load();
            return ResponseEntity.ok(Map.of("success", true, "metadata", metadata));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("success", false, "message", e.getMessage()));
        } catch (CatalogIntegrityException e) {
            logger.error("Erro ao recarregar o gazetteer: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("success", false, "message", e.getMessage()));
        }
    }

    /**
     * Processa um lote de notícias pendentes. Com {@code dryRun}, nada é gravado e a resposta
     * traz as resoluções que seriam gravadas.
     */
    @PostMapping("/extraction/process")
    public ResponseEntity<Map<String, Object>> processBatch(
            @RequestHeader(value = AppConstants.API_KEY_HEADER) String apiKey,
            @RequestParam(value = "dryRun", defaultValue = "false") boolean dryRun,
            @RequestParam(value = "batchSize", required = false) Integer batchSize,
            @RequestParam(value = "async", defaultValue = "false") boolean async) {

        if (!secretKey.equals(apiKey)) {
            logger.warn("Tentativa de processamento de lote com chave de API inválida");
            return unauthorized();
        }
        if (!gazetteerService.isLoaded()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("success", false, "message", "Gazetteer não carregado"));
        }
        if (batchSize != null && (batchSize < 1 || batchSize > AppConstants.MAX_BATCH_SIZE)) {
            return ResponseEntity.badRequest().body(Map.of("success", false,
                    "message", "batchSize deve estar entre 1 e " + AppConstants.MAX_BATCH_SIZE));
        }

        if (async) {
            logger.info("Lote de extração assíncrono solicitado via endpoint REST em {}", LocalDateTime.now());
            extractionBatchService.processNextBatchAsync(batchSize, dryRun);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                    "success", true,
                    "message", "Lote de extração iniciado em segundo plano. Acompanhe em /monitor/status",
                    "timestamp", LocalDateTime.now().toString()
            ));
        }

        BatchReport report = batchSize != null
                ? extractionBatchService.processNextBatch(batchSize, dryRun)
                : extractionBatchService.processNextBatch(dryRun);
        return ResponseEntity.ok(Map.of("success", true, "report", report));
    }

    @PostMapping("/extraction/stop")
    public ResponseEntity<Map<String, Object>> stopBatch(
            @RequestHeader(value = AppConstants.API_KEY_HEADER) String apiKey) {
        if (!secretKey.equals(apiKey)) {
            return unauthorized();
        }
        extractionBatchService.requestStop();
        return ResponseEntity.ok(Map.of("success", true, "message", "Interrupção solicitada"));
    }

    private static ResponseEntity<Map<String, Object>> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("success", false, "message", "Chave de API inválida"));
    }
}
