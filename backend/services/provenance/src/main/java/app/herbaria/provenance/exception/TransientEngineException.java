package app.herbaria.provenance.exception;

/**
 * Timeout, rate limit or outage reported by an extraction provider. Recorded as a
 * failed attempt; whether to retry is the orchestrator's call.
 */
public class TransientEngineException extends ProvenanceException {

    private final String provider;

    public TransientEngineException(String provider, String message) {
        super(message + " (provider: " + provider + ")");
        this.provider = provider;
    }

    public TransientEngineException(String provider, String message, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
