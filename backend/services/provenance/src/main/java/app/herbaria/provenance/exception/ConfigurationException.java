package app.herbaria.provenance.exception;

/**
 * Invalid or unhashable extraction parameters, missing credentials or an unusable
 * policy setting. Fatal to the single attempt it was raised for.
 */
public class ConfigurationException extends ProvenanceException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
