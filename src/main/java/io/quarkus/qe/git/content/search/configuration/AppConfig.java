package io.quarkus.qe.git.content.search.configuration;

import java.nio.file.Path;

/**
 * Command options shared with the beans that observe this event.
 *
 * @param workingDirectory git repository the history is read from
 * @param logDirectory directory for the search log and for temporary file versions
 * @param linearFallback whether the last-match search may fall back to a linear scan
 * @param resultFilePath where the JSON result is written, or null
 */
public record AppConfig(Path workingDirectory, Path logDirectory, boolean linearFallback, String resultFilePath) {
}
