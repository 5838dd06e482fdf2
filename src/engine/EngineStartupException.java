package engine;

/**
 * Unrecoverable failure while building the {@link App}: a second instance, a window that could
 * not be created, or a render thread that died during initialisation. Not meant to be caught.
 */
public class EngineStartupException extends RuntimeException {
    public EngineStartupException(String message) { super(message); }
    public EngineStartupException(String message, Throwable cause) { super(message, cause); }
}
