package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.CityCandidate;
import br.com.sentinela.geo.model.CityOccurrence;
import br.com.sentinela.geo.model.PersonOccurrence;
import br.com.sentinela.geo.model.PipelineVersions;
import br.com.sentinela.geo.model.ResolutionStatus;
import br.com.sentinela.geo.repository.CityOccurrenceRepository;
import br.com.sentinela.geo.repository.PersonOccurrenceRepository;
import br.com.sentinela.geo.repository.PersonRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaExtractionResultWriterTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final String URL = "https://exemplo.com.br/noticia";

    @Mock
    private CityOccurrenceRepository cityOccurrenceRepository;

    @Mock
    private PersonRepository personRepository;

    @Mock
    private PersonOccurrenceRepository personOccurrenceRepository;

    @InjectMocks
    private JpaExtractionResultWriter writer;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(writer, "objectMapper", new ObjectMapper());
        ReflectionTestUtils.setField(writer, "clock", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CityOccurrence campinas() {
        return CityOccurrence.builder()
                .articleUrl(URL)
                .surface("Campinas-SP")
                .start(9)
                .end(20)
                .ufHint("SP")
                .status(ResolutionStatus.RESOLVED)
                .resolvedCity("3509502")
                .candidates(List.of(CityCandidate.builder().ibgeId("3509502").name("Campinas").uf("SP").score(0.95)
                        .build()))
                .confidence(0.95)
                .phrase("Chuva em Campinas-SP.")
                .method("pattern:city_uf")
                .nerVersion("ner-1")
                .gazetteerVersion("v1")
                .build();
    }

    private static PersonOccurrence person(int start) {
        return PersonOccurrence.builder()
                .articleUrl(URL)
                .canonicalName("João da Silva")
                .aliases(Set.of("Prefeito João da Silva"))
                .surface("Prefeito João da Silva")
                .start(start)
                .end(start + 22)
                .method("ner")
                .confidence(0.9)
                .build();
    }

    @Test
    void writesCandidatesAsJson() {
        writer.writeCityOccurrence(campinas());

        ArgumentCaptor<String> candidates = ArgumentCaptor.forClass(String.class);
        verify(cityOccurrenceRepository).upsertOccurrence(eq(URL), eq(9), eq(20), eq("Campinas-SP"), eq("SP"),
                eq("resolved"), eq("3509502"), candidates.capture(), eq(0.95), eq("Chuva em Campinas-SP."),
                eq("pattern:city_uf"), eq("ner-1"), eq("v1"), eq(NOW));
        assertThat(candidates.getValue()).contains("\"ibge_id\":\"3509502\"", "\"score\":0.95");
    }

    @Test
    void writeArticleRemovesStaleRowsBeforeWriting() {
        when(personRepository.upsertPerson("João da Silva", "Prefeito João da Silva")).thenReturn(7L);
        ArticleResolution resolution = ArticleResolution.builder()
                .articleUrl(URL)
                .ufMentions(Set.of("SP"))
                .cityOccurrences(List.of(campinas()))
                .personOccurrences(List.of(person(0), person(40)))
                .cities(List.of())
                .versions(new PipelineVersions("ner-1", "v1"))
                .build();

        writer.writeArticle(resolution);

        InOrder order = inOrder(cityOccurrenceRepository, personRepository);
        order.verify(cityOccurrenceRepository).deleteStaleOccurrences(URL, "ner-1", "v1");
        order.verify(personRepository).upsertPerson("João da Silva", "Prefeito João da Silva");
        verify(personRepository, times(1)).upsertPerson(anyString(), anyString());
        verify(personOccurrenceRepository, times(2)).upsertOccurrence(eq(7L), eq(URL), anyInt(), anyInt(),
                anyString(), isNull(), eq("ner"), anyDouble(), any(Instant.class));
        verify(cityOccurrenceRepository).upsertOccurrence(eq(URL), eq(9), eq(20), anyString(), anyString(),
                anyString(), anyString(), anyString(), anyDouble(), anyString(), anyString(), anyString(),
                anyString(), any(Instant.class));
    }

    @Test
    void staleCleanupUsesVersionsOfTheResolution() {
        ArticleResolution resolution = ArticleResolution.builder()
                .articleUrl(URL)
                .ufMentions(Set.of())
                .cityOccurrences(List.of())
                .personOccurrences(List.of())
                .cities(List.of())
                .versions(new PipelineVersions("ner-1", "v2"))
                .build();

        writer.writeArticle(resolution);

        verify(cityOccurrenceRepository).deleteStaleOccurrences(URL, "ner-1", "v2");
    }
}
