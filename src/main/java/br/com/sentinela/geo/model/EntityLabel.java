package br.com.sentinela.geo.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Rótulos de entidades aceitos pelo pipeline. Rótulos equivalentes de motores NER
 * diferentes (PER, LOC, GPE, CITY) são mapeados para estes dois.
 */
public enum EntityLabel {
    PERSON,
    LOCATION;

    @JsonCreator
    public static EntityLabel fromNerLabel(String label) {
        if (label == null) {
            return null;
        }
        switch (label.trim().toUpperCase(Locale.ROOT)) {
            case "PERSON":
            case "PER":
                return PERSON;
            case "LOCATION":
            case "LOC":
            case "GPE":
            case "CITY":
                return LOCATION;
            default:
                return null;
        }
    }
}
