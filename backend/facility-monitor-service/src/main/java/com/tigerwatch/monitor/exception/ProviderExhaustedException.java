package com.tigerwatch.monitor.exception;

import java.util.List;

/**
 * Every search provider in the fallback chain failed or returned nothing.
 * Never thrown to gateway callers; its message ends up in the response's error field.
 */
public class ProviderExhaustedException extends MonitorException {

    private final List<String> attemptedProviders;

    public ProviderExhaustedException(String query, List<String> attemptedProviders) {
        super("PROVIDER_EXHAUSTED",
                "All search providers failed for query '" + query + "' (tried: " + String.join(", ", attemptedProviders) + ")");
        this.attemptedProviders = List.copyOf(attemptedProviders);
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
