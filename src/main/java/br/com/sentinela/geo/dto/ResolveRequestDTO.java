package br.com.sentinela.geo.dto;

import br.com.sentinela.geo.model.EntityLabel;
import br.com.sentinela.geo.model.EntitySpan;
import br.com.sentinela.geo.model.NewsDocument;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Pedido de resolução avulsa: a notícia e, opcionalmente, os trechos de um NER externo.
 * Os offsets dos trechos referem-se ao texto normalizado (título + corpo).
 */
@Data
public class ResolveRequestDTO {
    private NewsDocument article;
    private List<NerSpanDTO> spans;

    /**
     * @return trechos convertidos, ou nulo quando o pedido não trouxe nenhum
     */
    public List<EntitySpan> toEntitySpans() {
        if (spans == null) {
            return null;
        }
        List<EntitySpan> converted = new ArrayList<>();
        for (NerSpanDTO span : spans) {
            EntityLabel label = EntityLabel.fromNerLabel(span.getLabel());
            if (label == null) {
                continue;
            }
            converted.add(EntitySpan.builder()
                    .text(span.getText())
                    .label(label)
                    .start(span.getStart())
                    .end(span.getEnd())
                    .confidence(span.getScore() != null ? span.getScore() : 1.0)
                    .method(EntitySpan.METHOD_NER)
                    .build());
        }
        return converted;
    }

    @Data
    public static class NerSpanDTO {
        private String text;
        private String label;
        private int start;
        private int end;
        private Double score;
    }
}
