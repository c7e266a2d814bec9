package br.com.sentinela.geo.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Histórico das execuções (builds do catálogo e lotes de extração) e saúde do pipeline.
 */
@Service
public class PipelineStatusService {

    private static final Logger logger = LoggerFactory.getLogger(PipelineStatusService.class);
    private static final int MAX_STATUS_ENTRIES = 50;

    public enum RunType {
        CATALOG_BUILD,
        EXTRACTION_BATCH
    }

    private final ConcurrentLinkedDeque<RunEntry> history = new ConcurrentLinkedDeque<>();

    private LocalDateTime lastSuccessfulRun;
    private LocalDateTime lastFailedRun;
    private String lastErrorMessage;
    private int consecutiveFailures = 0;
    private int totalRuns = 0;
    private int successfulRuns = 0;

    /**
     * @param summary resumo legível (ex.: contagens do lote ou versão do catálogo)
     */
    public synchronized void registerSuccess(RunType type, String summary) {
        lastSuccessfulRun = LocalDateTime.now();
        consecutiveFailures = 0;
        totalRuns++;
        successfulRuns++;
        addToHistory(new RunEntry(type, lastSuccessfulRun, true, summary));
        logger.info("{} bem-sucedido registrado em {}: {}", type,
                lastSuccessfulRun.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME), summary);
    }

    public synchronized void registerFailure(RunType type, String errorMessage) {
        lastFailedRun = LocalDateTime.now();
        lastErrorMessage = errorMessage;
        consecutiveFailures++;
        totalRuns++;
        addToHistory(new RunEntry(type, lastFailedRun, false, errorMessage));
        logger.error("Falha de {} registrada em {}: {}. Falhas consecutivas: {}", type,
                lastFailedRun.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME), errorMessage, consecutiveFailures);
    }

    private void addToHistory(RunEntry entry) {
        history.addLast(entry);
        while (history.size() > MAX_STATUS_ENTRIES) {
            history.pollFirst();
        }
    }

    /**
     * Histórico do mais recente para o mais antigo.
     */
    public List<RunEntry> getHistory() {
        List<RunEntry> entries = new ArrayList<>(history);
        Collections.reverse(entries);
        return entries;
    }

    public synchronized PipelineStatus getCurrentStatus() {
        PipelineStatus status = new PipelineStatus();
        status.setLastSuccessfulRun(lastSuccessfulRun);
        status.setLastFailedRun(lastFailedRun);
        status.setLastErrorMessage(lastErrorMessage);
        status.setConsecutiveFailures(consecutiveFailures);
        status.setTotalRuns(totalRuns);
        status.setSuccessfulRuns(successfulRuns);
        status.setSuccessRate(totalRuns > 0 ? (double) successfulRuns / totalRuns : 0);
        status.setHealthy(consecutiveFailures == 0);
        return status;
    }

    public static class RunEntry {
        private final RunType type;
        private final LocalDateTime timestamp;
        private final boolean success;
        private final String message;

        public RunEntry(RunType type, LocalDateTime timestamp, boolean success, String message) {
            this.type = type;
            this.timestamp = timestamp;
            this.success = success;
            this.message = message;
        }

        public RunType getType() {
            return type;
        }

        public LocalDateTime getTimestamp() {
            return timestamp;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getMessage() {
            return message;
        }
    }

    public static class PipelineStatus {
        private LocalDateTime lastSuccessfulRun;
        private LocalDateTime lastFailedRun;
        private String lastErrorMessage;
        private int consecutiveFailures;
        private int totalRuns;
        private int successfulRuns;
        private double successRate;
        private boolean healthy;

        public LocalDateTime getLastSuccessfulRun() {
            return lastSuccessfulRun;
        }

        public void setLastSuccessfulRun(LocalDateTime lastSuccessfulRun) {
            this.lastSuccessfulRun = lastSuccessfulRun;
        }

        public LocalDateTime getLastFailedRun() {
            return lastFailedRun;
        }

        public void setLastFailedRun(LocalDateTime lastFailedRun) {
            this.lastFailedRun = lastFailedRun;
        }

        public String getLastErrorMessage() {
            return lastErrorMessage;
        }

        public void setLastErrorMessage(String lastErrorMessage) {
            this.lastErrorMessage = lastErrorMessage;
        }

        public int getConsecutiveFailures() {
            return consecutiveFailures;
        }

        public void setConsecutiveFailures(int consecutiveFailures) {
            this.consecutiveFailures = consecutiveFailures;
        }

        public int getTotalRuns() {
            return totalRuns;
        }

        public void setTotalRuns(int totalRuns) {
            this.totalRuns = totalRuns;
        }

        public int getSuccessfulRuns() {
            return successfulRuns;
        }

        public void setSuccessfulRuns(int successfulRuns) {
            this.successfulRuns = successfulRuns;
        }

        public double getSuccessRate() {
            return successRate;
        }

        public void setSuccessRate(double successRate) {
            this.successRate = successRate;
        }

        public boolean isHealthy() {
            return healthy;
        }

        public void setHealthy(boolean healthy) {
            this.healthy = healthy;
        }
    }
}
