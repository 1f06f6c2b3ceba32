package astgen.asts;

import java.io.IOException;
import java.nio.file.Path;

public class SinkWriteException extends GenerationException {

    public SinkWriteException(Path file, IOException cause) {
        super("Could not write " + file + ": " + cause.getMessage(), cause);
    }
}
