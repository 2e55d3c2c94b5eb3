package io.healthlog.processing.directive;

import java.util.List;

/**
 * Tags found in the input, in first-occurrence order, and the input with every tag removed.
 * {@code tags} is null when the input had none.
 */
public record TagDirectives(List<String> tags, String remaining) {
}
