package br.com.sentinela.geo.service.extraction;

/**
 * Falha ao processar um único artigo. O lote registra o erro no artigo e segue para o próximo.
 */
public class ArticleProcessingException extends RuntimeException {

    private final String articleUrl;

    public ArticleProcessingException(String articleUrl, String message, Throwable cause) {
        super(message, cause);
        this.articleUrl = articleUrl;
    }

    public String getArticleUrl() {
        return articleUrl;
    }
}
