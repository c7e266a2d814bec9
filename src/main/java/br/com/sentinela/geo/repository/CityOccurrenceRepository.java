package br.com.sentinela.geo.repository;

import br.com.sentinela.geo.model.CityOccurrenceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CityOccurrenceRepository extends JpaRepository<CityOccurrenceEntity, Long> {

    List<CityOccurrenceEntity> findByArticleUrlOrderByStartOffset(String articleUrl);

    List<CityOccurrenceEntity> findByStatusOrderByUpdatedAtDesc(String status);

    long countByArticleUrl(String articleUrl);

    // Upsert pela chave (article_url, start_offset, end_offset); só atualiza quando a versão do pipeline mudou
    @Modifying
    @Query(value =
        "INSERT INTO city_occurrences (article_url, start_offset, end_offset, surface, uf_hint, status, " +
        "resolved_city, candidates, confidence, phrase, method, ner_version, gazetteer_version, updated_at) " +
        "VALUES (:articleUrl, :startOffset, :endOffset, :surface, :ufHint, :status, :resolvedCity, :candidates, " +
        ":confidence, :phrase, :method, :nerVersion, :gazetteerVersion, :updatedAt) " +
        "ON CONFLICT (article_url, start_offset, end_offset) DO UPDATE SET " +
        "surface = EXCLUDED.surface, " +
        "uf_hint = EXCLUDED.uf_hint, " +
        "status = EXCLUDED.status, " +
        "resolved_city = EXCLUDED.resolved_city, " +
        "candidates = EXCLUDED.candidates, " +
        "confidence = EXCLUDED.confidence, " +
        "phrase = EXCLUDED.phrase, " +
        "method = EXCLUDED.method, " +
        "ner_version = EXCLUDED.ner_version, " +
        "gazetteer_version = EXCLUDED.gazetteer_version, " +
        "updated_at = EXCLUDED.updated_at " +
        "WHERE city_occurrences.ner_version IS DISTINCT FROM EXCLUDED.ner_version " +
        "OR city_occurrences.gazetteer_version IS DISTINCT FROM EXCLUDED.gazetteer_version",
        nativeQuery = true)
    int upsertOccurrence(
        @Param("articleUrl") String articleUrl,
        @Param("startOffset") int startOffset,
        @Param("endOffset") int endOffset,
        @Param("surface") String surface,
        @Param("ufHint") String ufHint,
        @Param("status") String status,
        @Param("resolvedCity") String resolvedCity,
        @Param("candidates") String candidates,
        @Param("confidence") double confidence,
        @Param("phrase") String phrase,
        @Param("method") String method,
        @Param("nerVersion") String nerVersion,
        @Param("gazetteerVersion") String gazetteerVersion,
        @Param("updatedAt") Instant updatedAt);

    // Remove ocorrências do artigo gravadas por outra versão do pipeline
    @Modifying
    @Query(value =
        "DELETE FROM city_occurrences WHERE article_url = :articleUrl " +
        "AND (ner_version IS DISTINCT FROM :nerVersion OR gazetteer_version IS DISTINCT FROM :gazetteerVersion)",
        nativeQuery = true)
    int deleteStaleOccurrences(
        @Param("articleUrl") String articleUrl,
        @Param("nerVersion") String nerVersion,
        @Param("gazetteerVersion") String gazetteerVersion);
}
