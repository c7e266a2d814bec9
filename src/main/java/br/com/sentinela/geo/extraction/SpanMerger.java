package br.com.sentinela.geo.extraction;

import br.com.sentinela.geo.model.EntitySpan;
import br.com.sentinela.geo.model.SpanSource;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Remove trechos sobrepostos mantendo o de maior prioridade: primeiro os que trazem UF
 * explícita, depois o mais longo, depois padrão antes de NER e por fim o que começa antes.
 */
public final class SpanMerger {

    static final Comparator<EntitySpan> PRIORITY = Comparator
            .comparing((EntitySpan s) -> !s.isUfQualified())
            .thenComparing(Comparator.comparingInt(EntitySpan::length).reversed())
            .thenComparing(s -> s.getSource() != SpanSource.PATTERN)
            .thenComparingInt(EntitySpan::getStart);

    private SpanMerger() {
    }

    /**
     * @return trechos sem sobreposição, em ordem de posição no texto
     */
    public static List<EntitySpan> dedupe(List<EntitySpan> spans) {
        List<EntitySpan> ordered = new ArrayList<>(spans);
        ordered.sort(PRIORITY);
        List<EntitySpan> kept = new ArrayList<>();
        for (EntitySpan candidate : ordered) {
            boolean overlaps = false;
            for (EntitySpan existing : kept) {
                if (existing.overlaps(candidate)) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparingInt(EntitySpan::getStart).thenComparingInt(EntitySpan::getEnd));
        return kept;
    }
}
