package br.com.sentinela.geo.controller;

import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.service.PipelineStatusService;
import br.com.sentinela.geo.service.PipelineStatusService.PipelineStatus;
import br.com.sentinela.geo.service.PipelineStatusService.RunEntry;
import br.com.sentinela.geo.service.catalog.GazetteerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Controlador para monitoramento da aplicação
 */
@RestController
@RequestMapping("/monitor")
public class MonitorController {

    @Autowired
    private PipelineStatusService statusService;

    @Autowired
    private GazetteerService gazetteerService;

    /**
     * Status atual do pipeline e do catálogo carregado
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pipeline", statusService.getCurrentStatus());
        CatalogMetadata metadata = gazetteerService.getMetadata();
        body.put("gazetteerLoaded", metadata != null);
        if (metadata != null) {
            body.put("catalog", metadata);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/history")
    public ResponseEntity<List<RunEntry>> getHistory() {
        return ResponseEntity.ok(statusService.getHistory());
    }

    @GetMapping("/health")
    public ResponseEntity<String> healthCheck() {
        PipelineStatus status = statusService.getCurrentStatus();

        if (!gazetteerService.isLoaded()) {
            return ResponseEntity.status(503).body("ALERTA - Gazetteer não carregado");
        }
        if (status.isHealthy()) {
            return ResponseEntity.ok("OK - Sistema saudável");
        }
        return ResponseEntity
                .status(500)
                .body("ALERTA - " + status.getConsecutiveFailures()
                        + " falhas consecutivas. Última falha: "
                        + (status.getLastErrorMessage() != null ? status.getLastErrorMessage() : "N/A"));
    }
}
