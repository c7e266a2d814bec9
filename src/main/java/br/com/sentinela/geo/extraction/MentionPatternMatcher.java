package br.com.sentinela.geo.extraction;

import br.com.sentinela.geo.model.EntityLabel;
import br.com.sentinela.geo.model.EntitySpan;
import br.com.sentinela.geo.model.SpanSource;
import br.com.sentinela.geo.model.Uf;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detecta menções a cidades por padrões jornalísticos determinísticos, sem depender do NER:
 * <ul>
 *     <li>{@code Cidade-UF} e {@code Cidade/UF} (a UF precisa ser uma das 27 válidas)</li>
 *     <li>{@code prefeito(a) de Cidade}</li>
 *     <li>{@code prefeitura de Cidade}</li>
 *     <li>{@code município de Cidade}</li>
 * </ul>
 * A busca é feita sobre o texto sem acentos, mas os offsets devolvidos são do texto recebido.
 */
public class MentionPatternMatcher {

    public static final String METHOD_CITY_UF = "pattern:city_uf";
    public static final String METHOD_PREFEITO = "pattern:prefeito";
    public static final String METHOD_PREFEITURA = "pattern:prefeitura";
    public static final String METHOD_MUNICIPIO = "pattern:municipio";

    static final double CITY_UF_CONFIDENCE = 0.95;
    static final double KEYWORD_CONFIDENCE = 0.85;

    private static final String WORD = "\\p{Lu}[\\p{L}'\u2019]*";
    private static final String NEXT_WORD = "(?:[dD]['\u2019])?\\p{Lu}[\\p{L}'\u2019]*";
    private static final String CONNECTOR = "(?:d[aeo]s?|e)";
    private static final String NAME =
            WORD + "(?:(?:\\h+" + CONNECTOR + ")?\\h+" + NEXT_WORD + "|-" + NEXT_WORD + ")*";

    private static final Pattern CITY_UF = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?<name>" + NAME + ")\\h*[-/]\\h*(?<uf>[A-Za-z]{2})(?![\\p{L}\\p{N}])");
    private static final Pattern PREFEITO = Pattern.compile(
            "(?<!\\p{L})(?i:prefeit[oa]s?)\\h+(?i:d[aeo])\\h+(?<name>" + NAME + ")");
    private static final Pattern PREFEITURA = Pattern.compile(
            "(?<!\\p{L})(?i:prefeitura)\\h+(?i:d[aeo])\\h+(?<name>" + NAME + ")");
    private static final Pattern MUNICIPIO = Pattern.compile(
            "(?<!\\p{L})(?i:municipio)\\h+(?i:d[aeo])\\h+(?<name>" + NAME + ")");

    // Palavras capitalizadas no início de frase que não fazem parte do nome ("Em Campinas-SP")
    private static final Set<String> LEADING_STOPWORDS = Set.of(
            "a", "o", "as", "os", "ao", "aos", "em", "no", "na", "nos", "nas", "de", "do", "da",
            "dos", "das", "para", "pela", "pelo", "com", "e", "segundo", "sobre", "entre", "ate", "apos");

    public List<EntitySpan> findCityPatternMatches(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        FoldedText folded = TextNormalizer.fold(text);
        List<EntitySpan> matches = new ArrayList<>();
        findCityUf(folded, matches);
        findKeyword(folded, PREFEITO, METHOD_PREFEITO, matches);
        findKeyword(folded, PREFEITURA, METHOD_PREFEITURA, matches);
        findKeyword(folded, MUNICIPIO, METHOD_MUNICIPIO, matches);
        return SpanMerger.dedupe(matches);
    }

    private void findCityUf(FoldedText folded, List<EntitySpan> out) {
        String source = folded.getFolded();
        Matcher m = CITY_UF.matcher(source);
        while (m.find()) {
            String ufToken = m.group("uf");
            Uf uf = Uf.fromSigla(ufToken);
            if (uf == null) {
                continue;
            }
            boolean upper = ufToken.equals(ufToken.toUpperCase(Locale.ROOT));
            if (!upper && uf.exigeCaixaAlta()) {
                continue;
            }
            int nameStart = skipLeadingStopwords(source, m.start("name"), m.end("name"));
            int[] span = folded.toOriginalSpan(nameStart, m.end());
            int[] name = folded.toOriginalSpan(nameStart, m.end("name"));
            String original = folded.getOriginal();
            out.add(EntitySpan.builder()
                    .text(original.substring(span[0], span[1]))
                    .label(EntityLabel.LOCATION)
                    .start(span[0])
                    .end(span[1])
                    .confidence(CITY_UF_CONFIDENCE)
                    .method(METHOD_CITY_UF)
                    .source(SpanSource.PATTERN)
                    .cityName(original.substring(name[0], name[1]))
                    .ufHint(uf.name())
                    .build());
        }
    }

    private void findKeyword(FoldedText folded, Pattern pattern, String method, List<EntitySpan> out) {
        Matcher m = pattern.matcher(folded.getFolded());
        while (m.find()) {
            int[] name = folded.toOriginalSpan(m.start("name"), m.end("name"));
            String surface = folded.getOriginal().substring(name[0], name[1]);
            out.add(EntitySpan.builder()
                    .text(surface)
                    .label(EntityLabel.LOCATION)
                    .start(name[0])
                    .end(name[1])
                    .confidence(KEYWORD_CONFIDENCE)
                    .method(method)
                    .source(SpanSource.PATTERN)
                    .cityName(surface)
                    .build());
        }
    }

    private static int skipLeadingStopwords(String text, int start, int end) {
        int current = start;
        while (current < end) {
            int wordEnd = current;
            while (wordEnd < end && !isNameSeparator(text.charAt(wordEnd))) {
                wordEnd++;
            }
            if (wordEnd >= end) {
                break;
            }
            String word = text.substring(current, wordEnd).toLowerCase(Locale.ROOT);
            if (!LEADING_STOPWORDS.contains(word)) {
                break;
            }
            int next = wordEnd;
            while (next < end && isNameSeparator(text.charAt(next))) {
                next++;
            }
            current = next;
        }
        return current;
    }

    private static boolean isNameSeparator(char c) {
        return c == ' ' || c == '\t' || c == '-' || c == '\u00A0';
    }
}
