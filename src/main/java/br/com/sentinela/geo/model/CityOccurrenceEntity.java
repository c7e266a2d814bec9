package br.com.sentinela.geo.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "city_occurrences",
        uniqueConstraints = @UniqueConstraint(name = "uk_city_occurrence_span",
                columnNames = {"article_url", "start_offset", "end_offset"}))
public class CityOccurrenceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "article_url", nullable = false, columnDefinition = "TEXT")
    private String articleUrl;

    @Column(name = "start_offset", nullable = false)
    private Integer startOffset;

    @Column(name = "end_offset", nullable = false)
    private Integer endOffset;

    @Column(columnDefinition = "TEXT")
    private String surface;

    @Column(name = "uf_hint", length = 2)
    private String ufHint;

    @Column(nullable = false, length = 16)
    private String status;

    // Código IBGE
    @Column(name = "resolved_city", length = 16)
    private String resolvedCity;

    // Lista de candidatos em JSON
    @Column(columnDefinition = "TEXT")
    private String candidates;

    private Double confidence;

    @Column(columnDefinition = "TEXT")
    private String phrase;

    private String method;

    @Column(name = "ner_version")
    private String nerVersion;

    @Column(name = "gazetteer_version")
    private String gazetteerVersion;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
