package br.com.sentinela.geo.model;

/**
 * Origem de um {@link EntitySpan}: motor NER externo ou regra determinística de padrão.
 */
public enum SpanSource {
    NER,
    PATTERN
}
