package com.rolebind.engine.reconcile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@code rebuild} for one guild.
 *
 * @param rebuilt message ids whose reactions or components were re-created
 * @param missing message ids whose platform message is gone
 * @param failed  message id to error for platform failures
 */
public record RebuildReport(String guildId, List<String> rebuilt, List<String> missing, Map<String, String> failed) {

    public RebuildReport {
        rebuilt = List.copyOf(rebuilt);
        missing = List.copyOf(missing);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }
}
