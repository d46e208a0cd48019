package org.godog.scrambler.api;

/**
 * An exception that is thrown when a file cannot be scrambled.
 * <p>
 * Every instance is fatal for the file it names; partial output of that file must be discarded.
 */
public class ScrambleException extends Exception {

    private final ScrambleErrorCode errorCode;
    private final String fileName;

    /**
     * Constructs a new scramble exception.
     * @param errorCode The machine-readable error code.
     * @param fileName The file that was being processed.
     * @param message The detail message.
     */
    public ScrambleException(ScrambleErrorCode errorCode, String fileName, String message) {
        this(errorCode, fileName, message, null);
    }

    /**
     * Constructs a new scramble exception with a cause.
     * @param errorCode The machine-readable error code.
     * @param fileName The file that was being processed.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ScrambleException(ScrambleErrorCode errorCode, String fileName, String message, Throwable cause) {
        super(String.format("[%s] %s", fileName, message), cause);
        this.errorCode = errorCode;
        this.fileName = fileName;
    }

    public ScrambleErrorCode getErrorCode() {
        return errorCode;
    }

    public String getFileName() {
        return fileName;
    }
}
