package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.service.catalog.GazetteerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Worker agendado que processa um lote por ciclo, quando habilitado.
 */
@Component
public class ExtractionWorker {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionWorker.class);

    @Autowired
    private ExtractionBatchService batchService;

    @Autowired
    private GazetteerService gazetteerService;

    @Value("${app.extraction.worker.enabled:false}")
    private boolean enabled;

    @Scheduled(fixedDelayString = "${app.extraction.worker.interval-ms:60000}",
            initialDelayString = "${app.extraction.worker.interval-ms:60000}")
    public void runScheduledBatch() {
        if (!enabled) {
            return;
        }
        if (!gazetteerService.isLoaded()) {
            logger.warn("Worker de extração aguardando o carregamento do gazetteer");
            return;
        }
        try {
            batchService.processNextBatch(false);
        } catch (RuntimeException e) {
            logger.error("=== ERRO NO LOTE AGENDADO DE EXTRAÇÃO: {} ===", e.getMessage(), e);
        }
    }
}
