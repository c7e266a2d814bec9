package br.com.sentinela.geo.service.extraction;

import br.com.sentinela.geo.model.EntitySpan;

import java.util.List;

/**
 * Reconhecimento de entidades nomeadas. Os offsets devolvidos referem-se ao texto recebido.
 */
public interface NerEngine {

    List<EntitySpan> analyze(String text);
}
