package astgen.asts;

/**
 * Failure of one (backend, family) generation unit.
 */
public abstract class GenerationException extends RuntimeException {

    protected GenerationException(String message) {
        super(message);
    }

    protected GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
