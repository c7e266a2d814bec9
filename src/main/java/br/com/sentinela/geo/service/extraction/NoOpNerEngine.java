package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.EntitySpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * NER padrão quando nenhum modelo está configurado: não devolve trechos, e a extração
 * de cidades fica só com os padrões determinísticos.
 */
public class NoOpNerEngine implements NerEngine {

    private static final Logger logger = LoggerFactory.getLogger(NoOpNerEngine.class);

    public NoOpNerEngine() {
        logger.info("Nenhum modelo de NER configurado; usando apenas padrões determinísticos");
    }

    @Override
    public List<EntitySpan> analyze(String text) {
        return List.of();
    }
}
