package io.surfworks.warplayout.pass;

/**
 * Thrown when a pass configuration file cannot be read or holds invalid values.
 */
public class LayoutConfigException extends RuntimeException {

    public LayoutConfigException(String message) {
        super(message);
    }

    public LayoutConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
