package ch.ethz.systems.vialbench.core.config.exceptions;

public class PropertyMissingException extends RuntimeException {

    public PropertyMissingException(String key) {
        super("Property \"" + key + "\" is required but was not set.");
    }

}
