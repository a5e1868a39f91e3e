package org.minikconfig.api;

/**
 * An exception that is thrown when a configuration run cannot continue, i.e. when the
 * root description file, a sourced file or the output file cannot be accessed.
 * <p>
 * Malformed input never raises this exception; it is reported as a diagnostic instead.
 */
public class KconfigException extends Exception {

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public KconfigException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the specified detail message, source information and cause.
     * @param message The detail message.
     * @param sourceInfo The statement that triggered the failure.
     * @param cause The cause.
     */
    public KconfigException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(String.format("%s at %s", message, sourceInfo), cause);
    }
}
