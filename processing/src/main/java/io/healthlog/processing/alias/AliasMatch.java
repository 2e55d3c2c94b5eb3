package io.healthlog.processing.alias;

public record AliasMatch(AliasCategory category, String abbreviation, String canonical) {
}
