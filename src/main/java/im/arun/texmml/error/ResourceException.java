package im.arun.texmml.error;

import java.nio.file.Path;

/**
 * A file referenced by the document (an import or a bibliography) is missing or unreadable.
 */
public class ResourceException extends LatexConversionException {
    private final Path path;

    public ResourceException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    public ResourceException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
