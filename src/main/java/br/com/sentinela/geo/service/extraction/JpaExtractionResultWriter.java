package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.CityOccurrence;
import br.com.sentinela.geo.model.PersonOccurrence;
import br.com.sentinela.geo.model.PipelineVersions;
import br.com.sentinela.geo.repository.CityOccurrenceRepository;
import br.com.sentinela.geo.repository.PersonOccurrenceRepository;
import br.com.sentinela.geo.repository.PersonRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link ExtractionResultWriter} sobre PostgreSQL, com upserts nativos
 * ({@code INSERT ... ON CONFLICT}). Cada artigo é gravado em uma transação.
 */
@Component
public class JpaExtractionResultWriter implements ExtractionResultWriter {

    private static final Logger logger = LoggerFactory.getLogger(JpaExtractionResultWriter.class);

    @Autowired
    private CityOccurrenceRepository cityOccurrenceRepository;

    @Autowired
    private PersonRepository personRepository;

    @Autowired
    private PersonOccurrenceRepository personOccurrenceRepository;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Clock clock;

    @Override
    @Transactional
    public String ensurePerson(String canonicalName, Set<String> aliases) {
        Long id = personRepository.upsertPerson(canonicalName, String.join("|", new TreeSet<>(aliases)));
        return String.valueOf(id);
    }

    @Override
    @Transactional
    public void writeCityOccurrence(CityOccurrence occurrence) {
        int changed = cityOccurrenceRepository.upsertOccurrence(
                occurrence.getArticleUrl(),
                occurrence.getStart(),
                occurrence.getEnd(),
                occurrence.getSurface(),
                occurrence.getUfHint(),
                occurrence.getStatus().getCodigo(),
                occurrence.getResolvedCity(),
                toJson(occurrence),
                occurrence.getConfidence(),
                occurrence.getPhrase(),
                occurrence.getMethod(),
                occurrence.getNerVersion(),
                occurrence.getGazetteerVersion(),
                Instant.now(clock));
        if (changed == 0) {
            logger.debug("Ocorrência [{}, {}) de {} já gravada com as versões atuais", occurrence.getStart(),
                    occurrence.getEnd(), occurrence.getArticleUrl());
        }
    }

    @Override
    @Transactional
    public void writePersonOccurrence(String personId, PersonOccurrence occurrence) {
        personOccurrenceRepository.upsertOccurrence(
                Long.valueOf(personId),
                occurrence.getArticleUrl(),
                occurrence.getStart(),
                occurrence.getEnd(),
                occurrence.getSurface(),
                occurrence.getPhrase(),
                occurrence.getMethod(),
                occurrence.getConfidence(),
                Instant.now(clock));
    }

    /**
     * Remove as ocorrências de versões anteriores do pipeline e grava as atuais, tudo
     * na mesma transação.
     */
    @Override
    @Transactional
    public void writeArticle(ArticleResolution resolution) {
        PipelineVersions versions = resolution.getVersions();
        int removed = cityOccurrenceRepository.deleteStaleOccurrences(resolution.getArticleUrl(),
                versions.getNerVersion(), versions.getGazetteerVersion());
        if (removed > 0) {
            logger.info("{} ocorrências de versões anteriores removidas de {}", removed, resolution.getArticleUrl());
        }
        ExtractionResultWriter.super.writeArticle(resolution);
    }

    private String toJson(CityOccurrence occurrence) {
        try {
            return objectMapper.writeValueAsString(occurrence.getCandidates());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar candidatos de " + occurrence.getArticleUrl(), e);
        }
    }
}
