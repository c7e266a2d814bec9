package br.com.sentinela.geo.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "person_occurrences",
        uniqueConstraints = @UniqueConstraint(name = "uk_person_occurrence_span",
                columnNames = {"article_url", "start_offset", "end_offset"}))
public class PersonOccurrenceEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "person_id", nullable = false)
    private Long personId;

    @Column(name = "article_url", nullable = false, columnDefinition = "TEXT")
    private String articleUrl;

    @Column(name = "start_offset", nullable = false)
    private Integer startOffset;

    @Column(name = "end_offset", nullable = false)
    private Integer endOffset;

    @Column(columnDefinition = "TEXT")
    private String surface;

    @Column(columnDefinition = "TEXT")
    private String phrase;

    private String method;

    private Double confidence;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
