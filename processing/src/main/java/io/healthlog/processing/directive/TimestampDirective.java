package io.healthlog.processing.directive;

import java.time.LocalDateTime;

/**
 * The entry timestamp and the input with the timestamp directive removed.
 */
public record TimestampDirective(LocalDateTime timestamp, String remaining) {
}
