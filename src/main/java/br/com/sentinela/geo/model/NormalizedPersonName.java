package br.com.sentinela.geo.model;

import lombok.Value;

import java.util.Set;

@Value
public class NormalizedPersonName {

    String canonicalName;

    Set<String> aliases;
}
