package work.lcod.use.api;

/**
 * Raised when the global context is used outside of any factory execution.
 */
public final class NoActiveContextException extends ContextException {
    public NoActiveContextException() {
        super(null, "No current context");
    }
}
