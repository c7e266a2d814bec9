package br.com.sentinela.geo.config;

import br.com.sentinela.geo.extraction.MentionPatternMatcher;
import br.com.sentinela.geo.extraction.TextNormalizer;
import br.com.sentinela.geo.model.PipelineVersions;
import br.com.sentinela.geo.service.extraction.NerEngine;
import br.com.sentinela.geo.service.extraction.NoOpNerEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Componentes puros da extração e versões do pipeline
 */
@Configuration
public class ExtractionConfig {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionConfig.class);

    @Bean
    public TextNormalizer textNormalizer(@Value("${app.extraction.boilerplate-patterns:}") List<String> patterns) {
        if (patterns == null || patterns.stream().allMatch(String::isBlank)) {
            return new TextNormalizer();
        }
        logger.info("Usando {} padrões de boilerplate configurados", patterns.size());
        return new TextNormalizer(patterns);
    }

    @Bean
    public MentionPatternMatcher mentionPatternMatcher() {
        return new MentionPatternMatcher();
    }

    /**
     * Versão do NER da resolução. A do gazetteer só vale até o primeiro carregamento do
     * catálogo; depois disso a resolução usa a versão do catálogo carregado.
     */
    @Bean
    public PipelineVersions pipelineVersions(@Value("${app.pipeline.ner-version:none}") String nerVersion,
                                             @Value("${app.pipeline.gazetteer-version:${app.catalog.version:v1}}") String gazetteerVersion) {
        logger.info("Versões do pipeline: NER={}, gazetteer={}", nerVersion, gazetteerVersion);
        return new PipelineVersions(nerVersion, gazetteerVersion);
    }

    @Bean
    @ConditionalOnMissingBean(NerEngine.class)
    public NerEngine nerEngine() {
        return new NoOpNerEngine();
    }
}
