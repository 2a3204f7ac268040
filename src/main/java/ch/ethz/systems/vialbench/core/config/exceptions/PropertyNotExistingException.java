package ch.ethz.systems.vialbench.core.config.exceptions;

public class PropertyNotExistingException extends RuntimeException {

    public PropertyNotExistingException(String key) {
        super("Property \"" + key + "\" is not a known property (typo?).");
    }

}
