package ch.ethz.systems.vialbench.core.config.exceptions;

public class PropertyValueInvalidException extends RuntimeException {

    public PropertyValueInvalidException(String key, String value, String reason) {
        super("Property \"" + key + "\" has invalid value \"" + value + "\": " + reason);
    }

    public PropertyValueInvalidException(String key, String value, Throwable cause) {
        super("Property \"" + key + "\" has invalid value \"" + value + "\"", cause);
    }

}
