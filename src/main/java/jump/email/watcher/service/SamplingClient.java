package jump.email.watcher.service;

import jump.email.watcher.model.SamplingRequest;
import jump.email.watcher.model.SamplingResult;

/**
 * Request/response access to an external reasoning model.
 * This abstraction keeps the triage hooks independent of the provider.
 */
public interface SamplingClient {

    /**
     * Raised for any failed call: transport errors, provider errors and quota/rate limits.
     */
    class SamplingException extends RuntimeException {
        private final boolean quotaExceeded;

        public SamplingException(String message, Throwable cause) {
            this(message, cause, false);
        }

        public SamplingException(String message, Throwable cause, boolean quotaExceeded) {
            super(message, cause);
            this.quotaExceeded = quotaExceeded;
        }

        public boolean isQuotaExceeded() {
            return quotaExceeded;
        }
    }

    /**
     * Capability check done once at startup.
     * @return true if this client is configured and can be called
     */
    boolean isAvailable();

    /**
     * @throws SamplingException if the call fails for any reason
     */
    SamplingResult createMessage(SamplingRequest request);

    static SamplingClient unavailable() {
        return new SamplingClient() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public SamplingResult createMessage(SamplingRequest request) {
                throw new SamplingException("No AI provider configured", null);
            }
        };
    }
}
