package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.extraction.MentionPatternMatcher;
import br.com.sentinela.geo.extraction.TextNormalizer;
import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.CatalogMetadata;
import br.com.sentinela.geo.model.CityOccurrence;
import br.com.sentinela.geo.model.EntityLabel;
import br.com.sentinela.geo.model.EntitySpan;
import br.com.sentinela.geo.model.NewsDocument;
import br.com.sentinela.geo.model.PipelineVersions;
import br.com.sentinela.geo.model.ResolutionStatus;
import br.com.sentinela.geo.service.AlertService;
import br.com.sentinela.geo.service.PipelineStatusService;
import br.com.sentinela.geo.service.catalog.GazetteerService;
import br.com.sentinela.geo.support.TestCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static br.com.sentinela.geo.support.TestCatalog.CAMPINAS;
import static br.com.sentinela.geo.support.TestCatalog.NATAL;
import static br.com.sentinela.geo.support.TestCatalog.SPRINGFIELD_MG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExtractionBatchServiceTest {

    private static final PipelineVersions V1 = new PipelineVersions("ner-1", "v1");

    private PendingNewsQueue queue;
    private InMemoryResultWriter writer;
    private PipelineStatusService statusService;
    private AlertService alertService;
    private GazetteerService gazetteerService;
    private NerEngine nerEngine;
    private ExtractionBatchService service;

    @BeforeEach
    void setUp() {
        queue = new PendingNewsQueue(2);
        writer = new InMemoryResultWriter();
        statusService = new PipelineStatusService();
        alertService = mock(AlertService.class);
        gazetteerService = mock(GazetteerService.class);
        when(gazetteerService.getLoadedCatalog()).thenReturn(loadedCatalog("v1"));
        nerEngine = text -> {
            if (text.contains("FALHA")) {
                throw new IllegalStateException("modelo indisponível");
            }
            return List.of();
        };
        service = newService(V1);
    }

    private ExtractionBatchService newService(PipelineVersions versions) {
        ExtractionBatchService batchService = new ExtractionBatchService();
        ReflectionTestUtils.setField(batchService, "newsRepository", new QueueNewsRepository(queue));
        ReflectionTestUtils.setField(batchService, "resultWriter", writer);
        ReflectionTestUtils.setField(batchService, "nerEngine", (NerEngine) text -> nerEngine.analyze(text));
        ReflectionTestUtils.setField(batchService, "gazetteerService", gazetteerService);
        ReflectionTestUtils.setField(batchService, "textNormalizer", new TextNormalizer());
        ReflectionTestUtils.setField(batchService, "patternMatcher", new MentionPatternMatcher());
        ReflectionTestUtils.setField(batchService, "pipelineVersions", versions);
        ReflectionTestUtils.setField(batchService, "statusService", statusService);
        ReflectionTestUtils.setField(batchService, "alertService", alertService);
        ReflectionTestUtils.setField(batchService, "clock", Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"),
                ZoneOffset.UTC));
        ReflectionTestUtils.setField(batchService, "batchSize", 10);
        ReflectionTestUtils.setField(batchService, "contextRequiredNames", "Natal,Esperança,Palmas");
        return batchService;
    }

    private static GazetteerService.LoadedCatalog loadedCatalog(String version) {
        CatalogMetadata metadata = CatalogMetadata.builder()
                .version(version)
                .source("ibge")
                .primarySource("ibge")
                .recordCount(TestCatalog.records().size())
                .build();
        return new GazetteerService.LoadedCatalog(TestCatalog.gazetteer(), metadata);
    }

    private static NewsDocument news(String url, String title, String body) {
        return NewsDocument.builder().url(url).title(title).body(body).source("teste").build();
    }

    @Nested
    @DisplayName("Lote normal")
    class NormalBatch {

        @Test
        void resolvesWritesAndMarksArticles() {
            queue.enqueue(news("u1", "Chuva em Campinas-SP", "Ruas alagadas."));
            queue.enqueue(news("u2", "Show lota estádio", "Multidão em Natal-RN na sexta."));

            BatchReport report = service.processNextBatch(false);

            assertThat(report.getFetched()).isEqualTo(2);
            assertThat(report.getProcessed()).isEqualTo(2);
            assertThat(report.getResolved()).isEqualTo(2);
            assertThat(report.getErrors()).isEmpty();
            assertThat(report.getResolutions()).isEmpty();
            assertThat(writer.occurrencesOf("u1")).extracting(CityOccurrence::getResolvedCity).containsExactly(CAMPINAS);
            assertThat(writer.occurrencesOf("u2")).extracting(CityOccurrence::getResolvedCity).containsExactly(NATAL);
            assertThat(queue.get("u1").getNerVersion()).isEqualTo("ner-1");
            assertThat(queue.get("u1").getGazetteerVersion()).isEqualTo("v1");
            assertThat(queue.pendingCount(V1)).isZero();
            assertThat(statusService.getCurrentStatus().getSuccessfulRuns()).isEqualTo(1);
        }

        @Test
        void respectsBatchSize() {
            queue.enqueue(news("u1", "Campinas-SP", null));
            queue.enqueue(news("u2", "Natal-RN", null));

            BatchReport report = service.processNextBatch(1, false);

            assertThat(report.getFetched()).isEqualTo(1);
            assertThat(queue.pendingCount(V1)).isEqualTo(1);
        }

        @Test
        void emptyArticleIsSkippedAndMarked() {
            queue.enqueue(news("vazia", " ", null));

            BatchReport report = service.processNextBatch(false);

            assertThat(report.getSkippedEmpty()).isEqualTo(1);
            assertThat(report.getProcessed()).isZero();
            assertThat(queue.get("vazia").getNerVersion()).isEqualTo("ner-1");
            assertThat(writer.cityOccurrences).isEmpty();
        }
    }

    @Nested
    @DisplayName("Falhas")
    class Failures {

        @Test
        void failingArticleDoesNotStopBatch() {
            queue.enqueue(news("ruim", "FALHA", "Campinas-SP"));
            queue.enqueue(news("boa", "Obras em Campinas-SP", null));

            BatchReport report = service.processNextBatch(false);

            assertThat(report.getProcessed()).isEqualTo(1);
            assertThat(report.getErrors()).hasSize(1);
            assertThat(report.getErrors().get(0).getArticleUrl()).isEqualTo("ruim");
            assertThat(report.getErrors().get(0).getMessage()).isEqualTo("modelo indisponível");
            assertThat(queue.lastError("ruim")).isEqualTo("modelo indisponível");
            assertThat(queue.get("ruim").getNerVersion()).isNull();
            assertThat(writer.occurrencesOf("boa")).hasSize(1);
            assertThat(statusService.getCurrentStatus().getSuccessfulRuns()).isEqualTo(1);
        }

        @Test
        void failedArticleIsRetriedUntilLimit() {
            queue.enqueue(news("ruim", "FALHA", null));

            service.processNextBatch(false);
            assertThat(queue.pendingCount(V1)).isEqualTo(1);
            service.processNextBatch(false);

            assertThat(queue.pendingCount(V1)).isZero();
            assertThat(service.processNextBatch(false).getFetched()).isZero();
        }

        @Test
        void batchWhereEveryArticleFailsRaisesAlert() {
            queue.enqueue(news("ruim", "FALHA", null));

            service.processNextBatch(false);

            assertThat(statusService.getCurrentStatus().getConsecutiveFailures()).isEqualTo(1);
            verify(alertService).sendFailureAlert(eq("lote de extração"), anyString());
        }
    }

    @Test
    void dryRunHasNoSideEffects() {
        queue.enqueue(news("u1", "Chuva em Campinas-SP", null));

        BatchReport report = service.processNextBatch(true);

        assertThat(report.isDryRun()).isTrue();
        assertThat(report.getProcessed()).isEqualTo(1);
        assertThat(report.getResolutions()).hasSize(1);
        assertThat(report.getResolutions().get(0).getCities()).extracting("ibgeId").containsExactly(CAMPINAS);
        assertThat(writer.cityOccurrences).isEmpty();
        assertThat(queue.get("u1").getNerVersion()).isNull();
        assertThat(queue.pendingCount(V1)).isEqualTo(1);
        assertThat(statusService.getCurrentStatus().getTotalRuns()).isZero();
        verify(alertService, never()).sendFailureAlert(anyString(), anyString());
    }

    @Test
    void rerunAfterVersionBumpUpdatesInsteadOfDuplicating() {
        queue.enqueue(news("u1", "Chuva em Campinas-SP", null));
        service.processNextBatch(false);
        assertThat(service.processNextBatch(false).getFetched()).isZero();

        ExtractionBatchService bumped = newService(new PipelineVersions("ner-2", "v1"));
        BatchReport report = bumped.processNextBatch(false);

        assertThat(report.getProcessed()).isEqualTo(1);
        assertThat(writer.occurrencesOf("u1")).hasSize(1);
        assertThat(writer.occurrencesOf("u1").get(0).getNerVersion()).isEqualTo("ner-2");
        assertThat(queue.get("u1").getNerVersion()).isEqualTo("ner-2");
    }

    @Test
    void stopRequestEndsBatchAndReleasesRemainingArticles() {
        queue.enqueue(news("u1", "Campinas-SP", null));
        queue.enqueue(news("u2", "Natal-RN", null));
        nerEngine = text -> {
            service.requestStop();
            return List.of();
        };

        BatchReport report = service.processNextBatch(false);

        assertThat(report.isStopped()).isTrue();
        assertThat(report.getProcessed()).isEqualTo(1);
        assertThat(queue.pendingCount(V1)).isEqualTo(1);
        assertThat(queue.peek(10, V1)).extracting(NewsDocument::getUrl).containsExactly("u2");
    }

    @Test
    void externalSpansReplaceConfiguredNer() {
        NewsDocument document = news("u1", "Springfield recebeu verba", "O governo de Minas Gerais confirmou.");
        EntitySpan springfield = EntitySpan.builder()
                .text("Springfield")
                .label(EntityLabel.LOCATION)
                .start(0)
                .end(11)
                .confidence(0.9)
                .method(EntitySpan.METHOD_NER)
                .build();

        ArticleResolution resolution = service.resolveArticle(document, List.of(springfield));

        assertThat(resolution.getCityOccurrences()).hasSize(1);
        assertThat(resolution.getCityOccurrences().get(0).getStatus()).isEqualTo(ResolutionStatus.RESOLVED);
        assertThat(resolution.getCityOccurrences().get(0).getResolvedCity()).isEqualTo(SPRINGFIELD_MG);
        assertThat(writer.cityOccurrences).isEmpty();
    }

    @Test
    void parsesContextRequiredNames() {
        assertThat(ExtractionBatchService.parseNames(" Natal, ,Palmas ")).containsExactly("Natal", "Palmas");
        assertThat(ExtractionBatchService.parseNames("")).isEmpty();
    }

    @Nested
    @DisplayName("Troca de catálogo")
    class CatalogReload {

        @Test
        void occurrencesAndArticlesCarryTheLoadedCatalogVersion() {
            queue.enqueue(news("u1", "Chuva em Campinas-SP", null));
            service.processNextBatch(false);
            assertThat(queue.get("u1").getGazetteerVersion()).isEqualTo("v1");

            when(gazetteerService.getLoadedCatalog()).thenReturn(loadedCatalog("v2"));

            assertThat(service.getPipelineVersions()).isEqualTo(new PipelineVersions("ner-1", "v2"));
            BatchReport report = service.processNextBatch(false);

            assertThat(report.getProcessed()).isEqualTo(1);
            assertThat(writer.occurrencesOf("u1")).extracting(CityOccurrence::getGazetteerVersion)
                    .containsExactly("v2");
            assertThat(queue.get("u1").getGazetteerVersion()).isEqualTo("v2");
            assertThat(queue.pendingCount(new PipelineVersions("ner-1", "v2"))).isZero();
        }

        @Test
        void resolutionIsStampedWithLoadedCatalogNotConfiguredVersion() {
            when(gazetteerService.getLoadedCatalog()).thenReturn(loadedCatalog("v2"));

            ArticleResolution resolution = service.resolveArticle(news("u1", "Chuva em Campinas-SP", null));

            assertThat(resolution.getVersions().getGazetteerVersion()).isEqualTo("v2");
            assertThat(resolution.getCityOccurrences()).extracting(CityOccurrence::getGazetteerVersion)
                    .containsExactly("v2");
        }

        @Test
        void configuredVersionsApplyBeforeAnyCatalogIsLoaded() {
            when(gazetteerService.getLoadedCatalog()).thenReturn(null);

            assertThat(service.getPipelineVersions()).isEqualTo(V1);
        }
    }
}
