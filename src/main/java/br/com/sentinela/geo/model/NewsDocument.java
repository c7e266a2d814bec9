package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Notícia pendente de extração, identificada pela URL.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NewsDocument {

    String url;

    String title;

    String body;

    @JsonProperty("published_at")
    Instant publishedAt;

    String source;

    // Versões com que o artigo foi processado da última vez (nulas se nunca foi)
    @JsonProperty("ner_version")
    String nerVersion;

    @JsonProperty("gazetteer_version")
    String gazetteerVersion;

    @JsonIgnore
    public boolean isEmpty() {
        return (title == null || title.isBlank()) && (body == null || body.isBlank());
    }

    /**
     * Texto analisado pelo pipeline: título e corpo separados por quebra de linha.
     */
    @JsonIgnore
    public String getCombinedText() {
        StringBuilder sb = new StringBuilder();
        if (title != null && !title.isBlank()) {
            sb.append(title.trim());
        }
        if (body != null && !body.isBlank()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(body.trim());
        }
        return sb.toString();
    }
}
