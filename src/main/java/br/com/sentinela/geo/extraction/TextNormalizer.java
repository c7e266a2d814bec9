package br.com.sentinela.geo.extraction;

import br.com.sentinela.geo.model.NormalizedPersonName;
import br.com.sentinela.geo.model.Uf;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Limpeza e normalização de texto das notícias: remoção de trechos padrão (créditos,
 * "leia também" etc.), detecção de menções a UFs, extração da frase em torno de um trecho
 * e canonização de nomes de pessoas.
 * <p>
 * Não guarda estado mutável; uma instância pode ser compartilhada entre threads.
 */
public class TextNormalizer {

    /**
     * Padrões (regex, sem diferenciar caixa) de linhas descartadas por padrão.
     */
    public static final List<String> DEFAULT_BOILERPLATE_PATTERNS = List.of(
            "^leia (tamb[eé]m|mais|ainda)\\b",
            "^(cr[eé]dito|reportagem|foto|fotos|imagem|edi[cç][aã]o)\\s*:",
            "^(©|\\(c\\)|copyright)",
            "todos os direitos reservados"
    );

    private static final Pattern DIACRITICS = Pattern.compile("\\p{InCombiningDiacriticalMarks}+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern HORIZONTAL_SPACES = Pattern.compile("\\h+");
    private static final Pattern WHITESPACES = Pattern.compile("\\s+");
    private static final Pattern APOSTROPHES = Pattern.compile("['\u2019`\u00B4]");
    private static final String HYPHEN_VARIANTS = "\u2010\u2011\u2012\u2013\u2014\u2015";
    private static final char SOFT_HYPHEN = '\u00AD';

    private static final Pattern TWO_LETTER_WORD =
            Pattern.compile("(?<![\\p{L}\\p{N}])([A-Za-z]{2})(?![\\p{L}\\p{N}])");

    private static final Pattern HONORIFICS = Pattern.compile(
            "(?<!\\p{L})(dr|dra|sr|sra|dep|deputad[oa]|ministr[oa]|presidente|governador[a]?"
                    + "|prefeit[oa]|vereador[a]?|senador[a]?|secret[aá]ri[oa])\\.?(?!\\p{L})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern EX_PREFIX = Pattern.compile("^ex[\\s-]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NON_LETTERS = Pattern.compile("^[^\\p{L}]+");
    private static final Pattern TRAILING_NON_LETTERS = Pattern.compile("[^\\p{L}]+$");
    private static final Pattern SPACED_HYPHEN = Pattern.compile("\\s*-\\s*");
    private static final Set<String> CONNECTORS = Set.of("da", "de", "do", "das", "dos", "e");

    // Nomes por extenso (dobrados) ordenados do mais longo para o mais curto,
    // para "mato grosso do sul" vencer "mato grosso"
    private static final List<UfNamePattern> STATE_NAME_PATTERNS = buildStateNamePatterns();

    private final List<Pattern> boilerplatePatterns;

    public TextNormalizer() {
        this(DEFAULT_BOILERPLATE_PATTERNS);
    }

    public TextNormalizer(List<String> boilerplatePatterns) {
        this.boilerplatePatterns = boilerplatePatterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> Pattern.compile(p.trim(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Remove linhas de boilerplate, colapsa espaços horizontais e descarta linhas vazias.
     * As quebras de linha restantes são mantidas porque delimitam frases.
     */
    public String normalize(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return "";
        }
        String nfc = Normalizer.normalize(rawText, Normalizer.Form.NFC);
        List<String> lines = new ArrayList<>();
        for (String rawLine : LINE_BREAK.split(nfc)) {
            String line = HORIZONTAL_SPACES.matcher(rawLine).replaceAll(" ").strip();
            if (line.isEmpty() || isBoilerplate(line)) {
                continue;
            }
            lines.add(line);
        }
        return String.join("\n", lines);
    }

    private boolean isBoilerplate(String line) {
        for (Pattern pattern : boilerplatePatterns) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Detecta as UFs citadas no texto, por sigla ou por nome por extenso.
     *
     * @return siglas encontradas, em ordem alfabética
     */
    public Set<String> detectUfMentions(String text) {
        Set<String> found = new TreeSet<>();
        if (text == null || text.isBlank()) {
            return found;
        }
        String nfc = Normalizer.normalize(text, Normalizer.Form.NFC);

        Matcher siglas = TWO_LETTER_WORD.matcher(nfc);
        while (siglas.find()) {
            String token = siglas.group(1);
            Uf uf = Uf.fromSigla(token);
            if (uf == null) {
                continue;
            }
            boolean upper = token.equals(token.toUpperCase(Locale.ROOT));
            if (upper || !uf.exigeCaixaAlta()) {
                found.add(uf.name());
            }
        }

        StringBuilder masked = new StringBuilder(stripDiacritics(nfc).toLowerCase(Locale.ROOT));
        for (UfNamePattern statePattern : STATE_NAME_PATTERNS) {
            if (statePattern.accentRequired) {
                if (statePattern.pattern.matcher(nfc).find()) {
                    found.add(statePattern.uf.name());
                }
                continue;
            }
            Matcher m = statePattern.pattern.matcher(masked);
            while (m.find()) {
                found.add(statePattern.uf.name());
                for (int i = m.start(); i < m.end(); i++) {
                    masked.setCharAt(i, ' ');
                }
            }
        }
        return found;
    }

    /**
     * Retorna a frase que contém o intervalo [start, end). Offsets fora do texto são
     * ajustados aos limites, nunca lançam exceção.
     */
    public String extractPhrase(String text, int start, int end) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int length = text.length();
        int from = Math.max(0, Math.min(start, length));
        int to = Math.max(from, Math.min(end, length));

        while (from > 0 && !isSentenceBoundary(text, from - 1)) {
            from--;
        }
        while (to < length && !isSentenceBoundary(text, to)) {
            to++;
        }
        if (to < length && text.charAt(to) != '\n') {
            to++;
        }
        return text.substring(from, to).strip();
    }

    private static boolean isSentenceBoundary(String text, int index) {
        char c = text.charAt(index);
        if (c == '\n' || c == '!' || c == '?') {
            return true;
        }
        // "5.000" e "gov.br" não encerram frase
        return c == '.' && (index + 1 >= text.length() || Character.isWhitespace(text.charAt(index + 1)));
    }

    /**
     * Canoniza um nome de pessoa para servir de chave: remove títulos ("Dr.", "Prefeito"),
     * o prefixo "ex-", normaliza conectores e hifenização.
     */
    public NormalizedPersonName normalizePersonName(String surface) {
        String original = surface == null ? "" : surface.strip();
        String name = Normalizer.normalize(original, Normalizer.Form.NFC);
        for (char hyphen : HYPHEN_VARIANTS.toCharArray()) {
            name = name.replace(hyphen, '-');
        }
        name = HONORIFICS.matcher(name).replaceAll(" ");
        name = WHITESPACES.matcher(name).replaceAll(" ").strip();
        name = EX_PREFIX.matcher(name).replaceFirst("");
        name = LEADING_NON_LETTERS.matcher(name).replaceFirst("");
        name = TRAILING_NON_LETTERS.matcher(name).replaceFirst("");
        name = SPACED_HYPHEN.matcher(name).replaceAll("-");

        List<String> tokens = new ArrayList<>();
        for (String token : name.split(" ")) {
            if (token.isEmpty()) {
                continue;
            }
            tokens.add(titleCase(token, tokens.isEmpty()));
        }
        String canonical = String.join(" ", tokens);
        Set<String> aliases = new TreeSet<>();
        if (!canonical.isEmpty() && !canonical.equals(original)) {
            aliases.add(original);
        }
        return new NormalizedPersonName(canonical, Collections.unmodifiableSet(aliases));
    }

    private static String titleCase(String token, boolean first) {
        String lower = token.toLowerCase(Locale.ROOT);
        if (!first && CONNECTORS.contains(lower)) {
            return lower;
        }
        if (token.length() <= 3 && token.equals(token.toUpperCase(Locale.ROOT)) && !CONNECTORS.contains(lower)) {
            return token;
        }
        return Arrays.stream(token.split("-", -1))
                .map(TextNormalizer::capitalize)
                .collect(Collectors.joining("-"));
    }

    private static String capitalize(String part) {
        if (part.isEmpty()) {
            return part;
        }
        String lower = part.toLowerCase(Locale.ROOT);
        return lower.substring(0, 1).toUpperCase(Locale.ROOT) + lower.substring(1);
    }

    /**
     * Remove acentos e demais marcas combinantes.
     */
    public static String stripDiacritics(String text) {
        if (text == null) {
            return "";
        }
        return DIACRITICS.matcher(Normalizer.normalize(text, Normalizer.Form.NFD)).replaceAll("");
    }

    /**
     * Chave de busca de nomes de lugares: sem acentos, minúscula, hífens como espaço,
     * sem apóstrofos e com espaços colapsados.
     */
    public static String lookupKey(String name) {
        if (name == null) {
            return "";
        }
        String key = stripDiacritics(name).toLowerCase(Locale.ROOT);
        for (char hyphen : HYPHEN_VARIANTS.toCharArray()) {
            key = key.replace(hyphen, ' ');
        }
        key = key.replace('-', ' ');
        key = APOSTROPHES.matcher(key).replaceAll("");
        return WHITESPACES.matcher(key).replaceAll(" ").strip();
    }

    /**
     * Dobra o texto (sem acentos, caixa preservada) mantendo o mapa de offsets para o original.
     * Variantes de hífen viram '-' e o hífen suave é descartado.
     */
    public static FoldedText fold(String text) {
        String source = text == null ? "" : text;
        StringBuilder folded = new StringBuilder(source.length());
        int[] offsets = new int[source.length() * 2 + 1];
        int size = 0;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == SOFT_HYPHEN) {
                continue;
            }
            if (HYPHEN_VARIANTS.indexOf(c) >= 0) {
                c = '-';
            }
            if (c < 128) {
                folded.append(c);
                offsets[size++] = i;
                continue;
            }
            String decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
            for (int j = 0; j < decomposed.length(); j++) {
                char d = decomposed.charAt(j);
                if (Character.getType(d) == Character.NON_SPACING_MARK) {
                    continue;
                }
                if (size == offsets.length) {
                    offsets = Arrays.copyOf(offsets, offsets.length * 2);
                }
                folded.append(d);
                offsets[size++] = i;
            }
        }
        return new FoldedText(source, folded.toString(), Arrays.copyOf(offsets, size));
    }

    private static List<UfNamePattern> buildStateNamePatterns() {
        List<UfNamePattern> patterns = new ArrayList<>();
        for (Uf uf : Uf.values()) {
            String folded = stripDiacritics(uf.getNome()).toLowerCase(Locale.ROOT);
            // "Pará" sem acento é a preposição "para"
            boolean accentRequired = uf == Uf.PA;
            Pattern pattern = accentRequired
                    ? Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(uf.getNome()) + "(?![\\p{L}\\p{N}])",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    : Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(folded) + "(?![\\p{L}\\p{N}])");
            patterns.add(new UfNamePattern(uf, folded.length(), pattern, accentRequired));
        }
        patterns.sort(Comparator.comparingInt((UfNamePattern p) -> p.length).reversed());
        return Collections.unmodifiableList(patterns);
    }

    private static final class UfNamePattern {
        private final Uf uf;
        private final int length;
        private final Pattern pattern;
        private final boolean accentRequired;

        private UfNamePattern(Uf uf, int length, Pattern pattern, boolean accentRequired) {
            this.uf = uf;
            this.length = length;
            this.pattern = pattern;
            this.accentRequired = accentRequired;
        }
    }
}
