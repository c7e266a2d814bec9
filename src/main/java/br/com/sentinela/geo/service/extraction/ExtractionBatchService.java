package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.extraction.CityResolutionEngine;
import br.com.sentinela.geo.extraction.Gazetteer;
import br.com.sentinela.geo.extraction.MentionPatternMatcher;
import br.com.sentinela.geo.extraction.TextNormalizer;
import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.EntitySpan;
import br.com.sentinela.geo.model.NewsDocument;
import br.com.sentinela.geo.model.PipelineVersions;
import br.com.sentinela.geo.model.ResolutionStatus;
import br.com.sentinela.geo.service.AlertService;
import br.com.sentinela.geo.service.PipelineStatusService;
import br.com.sentinela.geo.service.PipelineStatusService.RunType;
import br.com.sentinela.geo.service.catalog.GazetteerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Processa lotes de notícias pendentes, um artigo por vez: normaliza, roda o NER, resolve
 * as cidades e grava. A falha de um artigo é registrada nele e não interrompe o lote.
 */
@Service
public class ExtractionBatchService {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionBatchService.class);

    @Autowired
    private NewsRepository newsRepository;

    @Autowired
    private ExtractionResultWriter resultWriter;

    @Autowired
    private NerEngine nerEngine;

    @Autowired
    private GazetteerService gazetteerService;

    @Autowired
    private TextNormalizer textNormalizer;

    @Autowired
    private MentionPatternMatcher patternMatcher;

    @Autowired
    private PipelineVersions pipelineVersions;

    @Autowired
    private PipelineStatusService statusService;

    @Autowired
    private AlertService alertService;

    @Autowired
    private Clock clock;

    @Value("${app.extraction.batch-size:500}")
    private int batchSize;

    @Value("${app.extraction.context-required-names:Natal,Esperança,Palmas}")
    private String contextRequiredNames;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private volatile CityResolutionEngine engine;

    public BatchReport processNextBatch(boolean dryRun) {
        return processNextBatch(batchSize, dryRun);
    }

    /**
     * Busca e processa o próximo lote. No dry run nada é gravado nem marcado: os artigos
     * são apenas consultados e o relatório traz as resoluções.
     */
    public BatchReport processNextBatch(int size, boolean dryRun) {
        logger.info("=== INÍCIO DO LOTE DE EXTRAÇÃO (tamanho {}, dry run {}) ===", size, dryRun);
        stopRequested.set(false);

        PipelineVersions versions = activeVersions();
        List<NewsDocument> batch;
        try {
            batch = dryRun
                    ? newsRepository.previewPending(size, versions)
                    : newsRepository.fetchPending(size, versions);
        } catch (RuntimeException e) {
            logger.error("=== ERRO AO BUSCAR NOTÍCIAS PENDENTES: {} ===", e.getMessage(), e);
            statusService.registerFailure(RunType.EXTRACTION_BATCH, "Erro ao buscar pendentes: " + e.getMessage());
            alertService.sendFailureAlert("lote de extração", "Erro ao buscar pendentes: " + e.getMessage());
            throw e;
        }

        BatchReport report = processDocuments(batch, dryRun, versions);

        String summary = String.format("%d buscadas, %d processadas, %d vazias, %d ambíguas, %d erros",
                report.getFetched(), report.getProcessed(), report.getSkippedEmpty(), report.getAmbiguous(),
                report.getErrors().size());
        if (!dryRun) {
            if (!batch.isEmpty() && report.getErrors().size() == batch.size()) {
                statusService.registerFailure(RunType.EXTRACTION_BATCH, "Todos os artigos falharam: " + summary);
                alertService.sendFailureAlert("lote de extração", summary);
            } else {
                statusService.registerSuccess(RunType.EXTRACTION_BATCH, summary);
            }
        }
        logger.info("=== LOTE DE EXTRAÇÃO CONCLUÍDO: {} ===", summary);
        return report;
    }

    /**
     * Dispara o lote em segundo plano, no executor de extração. Falhas são registradas no
     * status do pipeline pelo próprio lote.
     */
    @Async("extractionExecutor")
    public CompletableFuture<BatchReport> processNextBatchAsync(Integer size, boolean dryRun) {
        logger.info("=== INÍCIO DO LOTE DE EXTRAÇÃO ASSÍNCRONO ===");
        try {
            return CompletableFuture.completedFuture(size != null
                    ? processNextBatch(size, dryRun)
                    : processNextBatch(dryRun));
        } catch (RuntimeException e) {
            logger.error("=== ERRO FATAL NO LOTE ASSÍNCRONO: {} ===", e.getMessage(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    BatchReport processDocuments(List<NewsDocument> batch, boolean dryRun, PipelineVersions versions) {
        int processed = 0;
        int skippedEmpty = 0;
        int cityOccurrences = 0;
        int resolved = 0;
        int ambiguous = 0;
        int foreign = 0;
        int persons = 0;
        boolean stopped = false;
        List<BatchReport.ArticleError> errors = new ArrayList<>();
        List<ArticleResolution> resolutions = new ArrayList<>();

        for (int i = 0; i < batch.size(); i++) {
            NewsDocument document = batch.get(i);
            if (stopRequested.get()) {
                logger.warn("Interrupção solicitada; {} artigos do lote não foram processados", batch.size() - i);
                if (!dryRun) {
                    releaseRemaining(batch.subList(i, batch.size()));
                }
                stopped = true;
                break;
            }
            try {
                if (document.isEmpty()) {
                    skippedEmpty++;
                    if (!dryRun) {
                        newsRepository.markProcessed(document.getUrl(), versions, Instant.now(clock));
                    }
                    continue;
                }
                ArticleResolution resolution = processArticle(document, dryRun);
                processed++;
                cityOccurrences += resolution.getCityOccurrences().size();
                resolved += resolution.countByStatus(ResolutionStatus.RESOLVED);
                ambiguous += resolution.countByStatus(ResolutionStatus.AMBIGUOUS);
                foreign += resolution.countByStatus(ResolutionStatus.FOREIGN);
                persons += resolution.getPersonOccurrences().size();
                if (dryRun) {
                    resolutions.add(resolution);
                }
            } catch (RuntimeException e) {
                String message = describe(e);
                logger.error("Falha ao processar notícia {}: {}", document.getUrl(), message, e);
                errors.add(new BatchReport.ArticleError(document.getUrl(), message));
                if (!dryRun) {
                    markErrorSafely(document.getUrl(), message);
                }
            }
        }

        return BatchReport.builder()
                .dryRun(dryRun)
                .fetched(batch.size())
                .processed(processed)
                .skippedEmpty(skippedEmpty)
                .cityOccurrences(cityOccurrences)
                .resolved(resolved)
                .ambiguous(ambiguous)
                .foreign(foreign)
                .personOccurrences(persons)
                .stopped(stopped)
                .errors(List.copyOf(errors))
                .resolutions(List.copyOf(resolutions))
                .build();
    }

    private ArticleResolution processArticle(NewsDocument document, boolean dryRun) {
        ArticleResolution resolution;
        try {
            resolution = resolveArticle(document);
        } catch (RuntimeException e) {
            throw new ArticleProcessingException(document.getUrl(), "Falha na resolução de " + document.getUrl(), e);
        }
        if (!dryRun) {
            try {
                resultWriter.writeArticle(resolution);
            } catch (RuntimeException e) {
                throw new ArticleProcessingException(document.getUrl(), "Falha ao gravar " + document.getUrl(), e);
            }
            newsRepository.markProcessed(document.getUrl(), resolution.getVersions(), Instant.now(clock));
        }
        return resolution;
    }

    /**
     * Resolve um artigo sem gravar nada.
     */
    public ArticleResolution resolveArticle(NewsDocument document) {
        return resolveArticle(document, null);
    }

    /**
     * @param externalSpans trechos já produzidos por um NER externo, com offsets sobre o texto
     *                      normalizado; se nulo, o {@link NerEngine} configurado é usado
     */
    public ArticleResolution resolveArticle(NewsDocument document, List<EntitySpan> externalSpans) {
        String text = textNormalizer.normalize(document.getCombinedText());
        List<EntitySpan> spans = externalSpans != null ? externalSpans : nerEngine.analyze(text);
        return currentEngine().resolve(document.getUrl(), text, spans);
    }

    /**
     * Pede a interrupção do lote em andamento; o artigo atual termina normalmente.
     */
    public void requestStop() {
        logger.info("Interrupção do lote de extração solicitada");
        stopRequested.set(true);
    }

    /**
     * Versões em vigor agora: a do NER configurada e a do catálogo carregado no gazetteer.
     * Antes de qualquer carregamento vale a versão de gazetteer configurada.
     */
    public PipelineVersions getPipelineVersions() {
        return activeVersions();
    }

    private PipelineVersions activeVersions() {
        GazetteerService.LoadedCatalog loaded = gazetteerService.getLoadedCatalog();
        return loaded != null ? versionsFor(loaded) : pipelineVersions;
    }

    private PipelineVersions versionsFor(GazetteerService.LoadedCatalog loaded) {
        return new PipelineVersions(pipelineVersions.getNerVersion(), loaded.getVersion());
    }

    static String describe(RuntimeException e) {
        Throwable root = e instanceof ArticleProcessingException && e.getCause() != null ? e.getCause() : e;
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    private void releaseRemaining(List<NewsDocument> remaining) {
        for (NewsDocument document : remaining) {
            newsRepository.release(document.getUrl());
        }
    }

    private void markErrorSafely(String articleUrl, String message) {
        try {
            newsRepository.markError(articleUrl, message);
        } catch (RuntimeException e) {
            logger.error("Não foi possível registrar o erro da notícia {}: {}", articleUrl, e.getMessage(), e);
        }
    }

    // O motor é recriado a cada troca de gazetteer e carrega a versão do catálogo correspondente
    private CityResolutionEngine currentEngine() {
        GazetteerService.LoadedCatalog loaded = gazetteerService.getLoadedCatalog();
        if (loaded == null) {
            throw new IllegalStateException("Gazetteer não carregado; gere ou carregue o catálogo");
        }
        Gazetteer gazetteer = loaded.getGazetteer();
        CityResolutionEngine current = engine;
        if (current == null || current.getGazetteer() != gazetteer) {
            current = new CityResolutionEngine(gazetteer, textNormalizer, patternMatcher, versionsFor(loaded),
                    parseNames(contextRequiredNames));
            engine = current;
        }
        return current;
    }

    static List<String> parseNames(String names) {
        if (names == null || names.isBlank()) {
            return List.of();
        }
        List<String> parsed = new ArrayList<>();
        for (String name : Arrays.asList(names.split(","))) {
            if (!name.isBlank()) {
                parsed.add(name.trim());
            }
        }
        return parsed;
    }
}
