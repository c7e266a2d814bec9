package br.com.sentinela.geo.model;

import lombok.Builder;
import lombok.Value;

/**
 * Trecho do texto detectado como menção (pessoa ou local), vindo do NER ou do matcher de padrões.
 * Offsets referem-se ao texto limpo do artigo; {@code end} é exclusivo.
 */
@Value
@Builder(toBuilder = true)
public class EntitySpan {

    public static final String METHOD_NER = "ner";

    String text;

    EntityLabel label;

    int start;

    int end;

    double confidence;

    String method;

    @Builder.Default
    SpanSource source = SpanSource.NER;

    // Nome da cidade sem a UF, quando a superfície traz "Cidade-UF"
    String cityName;

    // UF explícita na própria superfície
    String ufHint;

    public int length() {
        return end - start;
    }

    public boolean isUfQualified() {
        return ufHint != null;
    }

    public boolean overlaps(EntitySpan other) {
        return start < other.end && other.start < end;
    }

    public String nameForLookup() {
        return cityName != null ? cityName : text;
    }
}
