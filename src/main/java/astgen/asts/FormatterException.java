package astgen.asts;

/**
 * The external formatter could not be launched, timed out or exited with a
 * non-zero status. The generated file is left unformatted.
 */
public class FormatterException extends Exception {

    public FormatterException(String message) {
        super(message);
    }

    public FormatterException(String message, Throwable cause) {
        super(message, cause);
    }
}
