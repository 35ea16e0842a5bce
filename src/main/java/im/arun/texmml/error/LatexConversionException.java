package im.arun.texmml.error;

/**
 * Base class for failures that abort a conversion.
 */
public class LatexConversionException extends RuntimeException {

    public LatexConversionException(String message) {
        super(message);
    }

    public LatexConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
