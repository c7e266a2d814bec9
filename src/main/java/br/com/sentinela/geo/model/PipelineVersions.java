package br.com.sentinela.geo.model;

import lombok.Value;

/**
 * Versões do pipeline ativas na resolução. Um artigo só é reprocessado quando
 * alguma delas difere das gravadas no artigo.
 */
@Value
public class PipelineVersions {

    String nerVersion;

    String gazetteerVersion;

    public boolean isStale(NewsDocument document) {
        return !nerVersion.equals(document.getNerVersion())
                || !gazetteerVersion.equals(document.getGazetteerVersion());
    }
}
