package br.com.sentinela.geo.extraction;

import br.com.sentinela.geo.model.ArticleResolution;
import br.com.sentinela.geo.model.CityCandidate;
import br.com.sentinela.geo.model.CityMention;
import br.com.sentinela.geo.model.CityOccurrence;
import br.com.sentinela.geo.model.CityRecord;
import br.com.sentinela.geo.model.EntityLabel;
import br.com.sentinela.geo.model.EntitySpan;
import br.com.sentinela.geo.model.NormalizedPersonName;
import br.com.sentinela.geo.model.PersonOccurrence;
import br.com.sentinela.geo.model.PipelineVersions;
import br.com.sentinela.geo.model.ResolutionStatus;
import br.com.sentinela.geo.model.SpanSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolve as menções a cidades de um artigo contra o {@link Gazetteer}.
 * <p>
 * Cada trecho candidato termina em um de três estados: {@code resolved} (um único
 * município sobrou), {@code ambiguous} (dois ou mais, todos devolvidos para revisão)
 * ou {@code foreign} (nenhum município do catálogo tem esse nome).
 * <p>
 * A ordem das dicas de UF é: UF explícita na superfície ({@code Cidade-UF}), UFs citadas
 * na frase do trecho, UFs citadas no artigo inteiro. Não faz I/O; quem grava o resultado
 * é o chamador.
 */
public class CityResolutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(CityResolutionEngine.class);

    static final double HINTED_CONFIDENCE = 0.9;
    static final double EXPLICIT_UF_BOOST = 0.05;
    static final double UNIQUE_NAME_CONFIDENCE = 0.8;

    private final Gazetteer gazetteer;
    private final TextNormalizer normalizer;
    private final MentionPatternMatcher patternMatcher;
    private final PipelineVersions versions;
    private final Set<String> contextRequiredNames;

    public CityResolutionEngine(Gazetteer gazetteer, TextNormalizer normalizer, MentionPatternMatcher patternMatcher,
                                PipelineVersions versions, Collection<String> contextRequiredNames) {
        this.gazetteer = gazetteer;
        this.normalizer = normalizer;
        this.patternMatcher = patternMatcher;
        this.versions = versions;
        Set<String> keys = new HashSet<>();
        for (String name : contextRequiredNames) {
            String key = TextNormalizer.lookupKey(name);
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        this.contextRequiredNames = Set.copyOf(keys);
    }

    /**
     * @param text     texto já normalizado do artigo; os offsets dos trechos do NER referem-se a ele
     * @param nerSpans trechos produzidos pelo NER (pessoas e locais)
     */
    public ArticleResolution resolve(String articleUrl, String text, List<EntitySpan> nerSpans) {
        String safeText = text == null ? "" : text;
        List<EntitySpan> valid = discardMalformed(articleUrl, safeText, nerSpans);

        List<EntitySpan> locations = new ArrayList<>();
        List<EntitySpan> persons = new ArrayList<>();
        for (EntitySpan span : valid) {
            if (span.getLabel() == EntityLabel.LOCATION) {
                locations.add(span);
            } else if (span.getLabel() == EntityLabel.PERSON) {
                persons.add(span);
            }
        }
        locations.addAll(patternMatcher.findCityPatternMatches(safeText));
        List<EntitySpan> merged = SpanMerger.dedupe(locations);

        Set<String> documentUfs = normalizer.detectUfMentions(safeText);
        List<CityOccurrence> occurrences = new ArrayList<>();
        for (EntitySpan span : merged) {
            CityOccurrence occurrence = resolveSpan(articleUrl, safeText, span, documentUfs);
            if (occurrence != null) {
                occurrences.add(occurrence);
            }
        }

        return ArticleResolution.builder()
                .articleUrl(articleUrl)
                .ufMentions(documentUfs)
                .cityOccurrences(occurrences)
                .personOccurrences(resolvePersons(articleUrl, safeText, persons))
                .cities(aggregate(occurrences))
                .versions(versions)
                .build();
    }

    CityOccurrence resolveSpan(String articleUrl, String text, EntitySpan span, Set<String> documentUfs) {
        NameMatch match = findName(text, span);
        if (match == null) {
            return occurrence(articleUrl, text, span.getStart(), span.getEnd(), span)
                    .ufHint(span.getUfHint())
                    .status(ResolutionStatus.FOREIGN)
                    .confidence(0.0)
                    .build();
        }
        List<CityRecord> all = match.candidates;
        int start = match.start;
        int end = match.end;

        // 1. UF explícita na superfície
        if (span.isUfQualified()) {
            List<CityRecord> hinted = Gazetteer.filterByUf(gazetteer.lookup(match.name, span.getUfHint()),
                    span.getUfHint());
            if (!hinted.isEmpty()) {
                double confidence = HINTED_CONFIDENCE
                        + (MentionPatternMatcher.METHOD_CITY_UF.equals(span.getMethod()) ? EXPLICIT_UF_BOOST : 0.0);
                return decide(articleUrl, text, start, end, span, hinted, span.getUfHint(), confidence);
            }
            logger.debug("UF {} não confere com '{}' em {}, usando contexto", span.getUfHint(), match.name, articleUrl);
        }

        // 2. UFs da frase, 3. UFs do artigo
        Set<String> phraseUfs = normalizer.detectUfMentions(normalizer.extractPhrase(text, start, end));
        for (Set<String> pool : List.of(phraseUfs, documentUfs)) {
            List<CityRecord> hinted = filterByUfs(all, pool);
            if (!hinted.isEmpty()) {
                String ufHint = hinted.size() == 1 ? hinted.get(0).getUf() : null;
                return decide(articleUrl, text, start, end, span, hinted, ufHint, HINTED_CONFIDENCE);
            }
        }

        if (contextRequiredNames.contains(TextNormalizer.lookupKey(match.name))) {
            logger.debug("'{}' descartado em {}: nome exige UF no contexto", match.name, articleUrl);
            return null;
        }
        return decide(articleUrl, text, start, end, span, all, null, UNIQUE_NAME_CONFIDENCE);
    }

    private CityOccurrence decide(String articleUrl, String text, int start, int end, EntitySpan span,
                                  List<CityRecord> candidates, String ufHint, double confidence) {
        CityOccurrence.CityOccurrenceBuilder builder = occurrence(articleUrl, text, start, end, span).ufHint(ufHint);
        if (candidates.size() == 1) {
            CityRecord city = candidates.get(0);
            return builder.status(ResolutionStatus.RESOLVED)
                    .resolvedCity(city.getIbgeId())
                    .candidates(List.of(CityCandidate.of(city, confidence)))
                    .confidence(confidence)
                    .build();
        }
        double split = HINTED_CONFIDENCE / candidates.size();
        List<CityCandidate> scored = new ArrayList<>();
        for (CityRecord city : candidates) {
            scored.add(CityCandidate.of(city, split));
        }
        return builder.status(ResolutionStatus.AMBIGUOUS)
                .candidates(List.copyOf(scored))
                .confidence(split)
                .build();
    }

    private CityOccurrence.CityOccurrenceBuilder occurrence(String articleUrl, String text, int start, int end,
                                                            EntitySpan span) {
        return CityOccurrence.builder()
                .articleUrl(articleUrl)
                .surface(text.substring(start, end))
                .start(start)
                .end(end)
                .phrase(normalizer.extractPhrase(text, start, end))
                .method(span.getMethod())
                .nerVersion(versions.getNerVersion())
                .gazetteerVersion(versions.getGazetteerVersion());
    }

    /**
     * Procura o nome no catálogo. Para trechos de padrão, tenta também versões mais curtas:
     * em {@code Cidade-UF} descarta palavras do início ("Ontem Campinas-SP"), nos demais
     * padrões descarta palavras do fim ("prefeito de Campinas Dário").
     */
    private NameMatch findName(String text, EntitySpan span) {
        String name = span.nameForLookup();
        List<CityRecord> direct = gazetteer.candidates(name);
        if (!direct.isEmpty() || span.getSource() != SpanSource.PATTERN) {
            return direct.isEmpty() ? null : new NameMatch(name, direct, span.getStart(), span.getEnd());
        }
        int nameStart = span.getStart();
        int nameEnd = nameStart + name.length();
        if (nameEnd > text.length() || !text.startsWith(name, nameStart)) {
            return null;
        }
        List<int[]> words = words(name);
        for (int drop = 1; drop < words.size(); drop++) {
            int from;
            int to;
            if (span.isUfQualified()) {
                from = words.get(drop)[0];
                to = name.length();
            } else {
                from = 0;
                to = words.get(words.size() - 1 - drop)[1];
            }
            String shorter = name.substring(from, to);
            if (!Character.isUpperCase(shorter.charAt(0))) {
                continue;
            }
            List<CityRecord> found = gazetteer.candidates(shorter);
            if (!found.isEmpty()) {
                int start = nameStart + from;
                int end = span.isUfQualified() ? span.getEnd() : nameStart + to;
                return new NameMatch(shorter, found, start, end);
            }
        }
        return null;
    }

    private static List<int[]> words(String name) {
        List<int[]> words = new ArrayList<>();
        int i = 0;
        while (i < name.length()) {
            while (i < name.length() && Character.isWhitespace(name.charAt(i))) {
                i++;
            }
            int start = i;
            while (i < name.length() && !Character.isWhitespace(name.charAt(i))) {
                i++;
            }
            if (i > start) {
                words.add(new int[]{start, i});
            }
        }
        return words;
    }

    private static List<CityRecord> filterByUfs(List<CityRecord> records, Set<String> ufs) {
        List<CityRecord> filtered = new ArrayList<>();
        if (ufs.isEmpty()) {
            return filtered;
        }
        for (CityRecord record : records) {
            if (ufs.contains(record.getUf())) {
                filtered.add(record);
            }
        }
        return filtered;
    }

    private List<EntitySpan> discardMalformed(String articleUrl, String text, List<EntitySpan> spans) {
        List<EntitySpan> valid = new ArrayList<>();
        if (spans == null) {
            return valid;
        }
        for (EntitySpan span : spans) {
            if (span == null || span.getLabel() == null) {
                continue;
            }
            if (span.getStart() < 0 || span.getStart() >= span.getEnd() || span.getEnd() > text.length()) {
                logger.warn("Trecho do NER com offsets inválidos descartado em {}: [{}, {}) '{}'",
                        articleUrl, span.getStart(), span.getEnd(), span.getText());
                continue;
            }
            String surface = text.substring(span.getStart(), span.getEnd());
            valid.add(surface.equals(span.getText()) ? span : span.toBuilder().text(surface).build());
        }
        return valid;
    }

    private List<PersonOccurrence> resolvePersons(String articleUrl, String text, List<EntitySpan> persons) {
        List<PersonOccurrence> result = new ArrayList<>();
        for (EntitySpan span : persons) {
            NormalizedPersonName normalized = normalizer.normalizePersonName(span.getText());
            if (normalized.getCanonicalName().isEmpty()) {
                continue;
            }
            result.add(PersonOccurrence.builder()
                    .articleUrl(articleUrl)
                    .canonicalName(normalized.getCanonicalName())
                    .aliases(normalized.getAliases())
                    .surface(span.getText())
                    .start(span.getStart())
                    .end(span.getEnd())
                    .phrase(normalizer.extractPhrase(text, span.getStart(), span.getEnd()))
                    .method(span.getMethod())
                    .confidence(span.getConfidence())
                    .build());
        }
        return result;
    }

    private List<CityMention> aggregate(List<CityOccurrence> occurrences) {
        Map<String, List<CityOccurrence>> byCity = new LinkedHashMap<>();
        for (CityOccurrence occurrence : occurrences) {
            if (occurrence.getStatus() == ResolutionStatus.RESOLVED) {
                byCity.computeIfAbsent(occurrence.getResolvedCity(), k -> new ArrayList<>()).add(occurrence);
            }
        }
        List<CityMention> mentions = new ArrayList<>();
        byCity.forEach((ibgeId, list) -> {
            CityCandidate city = list.get(0).getCandidates().get(0);
            Set<String> methods = new TreeSet<>();
            for (CityOccurrence occurrence : list) {
                methods.add(occurrence.getMethod());
            }
            mentions.add(CityMention.builder()
                    .ibgeId(ibgeId)
                    .label(city.getName())
                    .uf(city.getUf())
                    .occurrences(list.size())
                    .sources(List.copyOf(methods))
                    .build());
        });
        return mentions;
    }

    public Gazetteer getGazetteer() {
        return gazetteer;
    }

    public PipelineVersions getVersions() {
        return versions;
    }

    private static final class NameMatch {
        private final String name;
        private final List<CityRecord> candidates;
        private final int start;
        private final int end;

        private NameMatch(String name, List<CityRecord> candidates, int start, int end) {
            this.name = name;
            this.candidates = candidates;
            this.start = start;
            this.end = end;
        }
    }
}
