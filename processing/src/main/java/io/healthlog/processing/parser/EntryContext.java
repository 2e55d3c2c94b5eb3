package io.healthlog.processing.parser;

import io.healthlog.processing.alias.AliasTable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * What the field parsers share for one entry: the resolved timestamp, the extracted tags and the alias
 * snapshot the whole parse runs against.
 */
record EntryContext(LocalDateTime timestamp, List<String> tags, AliasTable aliases) {
}
