package br.com.sentinela.geo.extraction;

/**
 * Versão do texto sem diacríticos (caixa preservada), com o mapa de cada caractere
 * resultante para o índice de origem no texto original.
 */
public final class FoldedText {

    private final String original;
    private final String folded;
    private final int[] offsets;

    FoldedText(String original, String folded, int[] offsets) {
        this.original = original;
        this.folded = folded;
        this.offsets = offsets;
    }

    public String getOriginal() {
        return original;
    }

    public String getFolded() {
        return folded;
    }

    /**
     * Converte um intervalo [start, end) do texto dobrado para o texto original.
     */
    public int[] toOriginalSpan(int foldedStart, int foldedEnd) {
        if (foldedEnd <= foldedStart || offsets.length == 0) {
            int pos = foldedStart < offsets.length ? offsets[foldedStart] : original.length();
            return new int[]{pos, pos};
        }
        int start = offsets[foldedStart];
        int end = offsets[foldedEnd - 1] + 1;
        return new int[]{start, end};
    }
}
