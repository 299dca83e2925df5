package in.voltedge.service.engine;

/**
 * Fatal condition: reconnect attempts or the unexpected-error budget are exhausted.
 * The engine stops every loop and needs an external restart.
 */
public class EngineHaltedException extends RuntimeException {

    private final String source;

    public EngineHaltedException(String source, String message) {
        super(String.format("[%s] Engine halted: %s", source, message));
        this.source = source;
    }

    public EngineHaltedException(String source, String message, Throwable cause) {
        super(String.format("[%s] Engine halted: %s", source, message), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
