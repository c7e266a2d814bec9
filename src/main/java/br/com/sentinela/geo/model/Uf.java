package br.com.sentinela.geo.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Unidades federativas do Brasil, com nome por extenso, macrorregião e capital.
 */
public enum Uf {
    AC("Acre", "Norte", "Rio Branco"),
    AL("Alagoas", "Nordeste", "Maceió"),
    AP("Amapá", "Norte", "Macapá"),
    AM("Amazonas", "Norte", "Manaus"),
    BA("Bahia", "Nordeste", "Salvador"),
    CE("Ceará", "Nordeste", "Fortaleza"),
    DF("Distrito Federal", "Centro-Oeste", "Brasília"),
    ES("Espírito Santo", "Sudeste", "Vitória"),
    GO("Goiás", "Centro-Oeste", "Goiânia"),
    MA("Maranhão", "Nordeste", "São Luís"),
    MT("Mato Grosso", "Centro-Oeste", "Cuiabá"),
    MS("Mato Grosso do Sul", "Centro-Oeste", "Campo Grande"),
    MG("Minas Gerais", "Sudeste", "Belo Horizonte"),
    PA("Pará", "Norte", "Belém"),
    PB("Paraíba", "Nordeste", "João Pessoa"),
    PR("Paraná", "Sul", "Curitiba"),
    PE("Pernambuco", "Nordeste", "Recife"),
    PI("Piauí", "Nordeste", "Teresina"),
    RJ("Rio de Janeiro", "Sudeste", "Rio de Janeiro"),
    RN("Rio Grande do Norte", "Nordeste", "Natal"),
    RS("Rio Grande do Sul", "Sul", "Porto Alegre"),
    RO("Rondônia", "Norte", "Porto Velho"),
    RR("Roraima", "Norte", "Boa Vista"),
    SC("Santa Catarina", "Sul", "Florianópolis"),
    SP("São Paulo", "Sudeste", "São Paulo"),
    SE("Sergipe", "Nordeste", "Aracaju"),
    TO("Tocantins", "Norte", "Palmas");

    // Siglas que também são palavras comuns em português; só contam em caixa alta
    private static final Set<Uf> SIGLAS_AMBIGUAS = Collections.unmodifiableSet(
            EnumSet.of(AL, AM, AP, ES, MA, PA, PE, SE, TO));

    private static final Map<String, Uf> POR_SIGLA = new HashMap<>();

    static {
        for (Uf uf : values()) {
            POR_SIGLA.put(uf.name(), uf);
        }
    }

    private final String nome;
    private final String regiao;
    private final String capital;

    Uf(String nome, String regiao, String capital) {
        this.nome = nome;
        this.regiao = regiao;
        this.capital = capital;
    }

    public String getNome() {
        return nome;
    }

    public String getRegiao() {
        return regiao;
    }

    public String getCapital() {
        return capital;
    }

    public boolean exigeCaixaAlta() {
        return SIGLAS_AMBIGUAS.contains(this);
    }

    /**
     * Busca a UF pela sigla, sem diferenciar maiúsculas de minúsculas.
     *
     * @return a UF ou {@code null} quando a sigla não é uma das 27 válidas
     */
    public static Uf fromSigla(String sigla) {
        if (sigla == null) {
            return null;
        }
        return POR_SIGLA.get(sigla.trim().toUpperCase());
    }

    public static boolean isValida(String sigla) {
        return fromSigla(sigla) != null;
    }
}
