package br.com.sentinela.geo.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Alertas de falha do build do catálogo e dos lotes de extração. Por enquanto só registra em log.
 */
@Service
public class AlertService {

    private static final Logger logger = LoggerFactory.getLogger(AlertService.class);

    @Value("${app.alert.email.enabled:false}")
    private boolean emailAlertsEnabled;

    @Value("${app.alert.email.to:}")
    private String alertEmailTo;

    /**
     * @param operation operação que falhou ("build do catálogo", "lote de extração")
     */
    public void sendFailureAlert(String operation, String message) {
        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        logger.error("ALERTA: Falha em {} em {}\n\n{}", operation, timestamp, message);

        if (emailAlertsEnabled) {
            logger.info("Alertas por email configurados para {}, mas o envio de email não está implementado", alertEmailTo);
        }
    }
}
