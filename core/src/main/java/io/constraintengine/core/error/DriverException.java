package io.constraintengine.core.error;

/** Thrown by a driver when its backend cannot complete an operation. */
public final class DriverException extends ConstraintEngineException {

    private static final long serialVersionUID = 1L;

    private final String driver;

    public DriverException(String message, String driver, String resource) {
        super(message, resource, Phase.QUERY);
        this.driver = driver;
    }

    public DriverException(String message, Throwable cause, String driver, String resource) {
        super(message, cause, resource, Phase.QUERY);
        this.driver = driver;
    }

    /** Name of the driver that failed. */
    public String driver() {
        return driver;
    }
}
