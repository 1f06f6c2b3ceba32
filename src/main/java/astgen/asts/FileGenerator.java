package astgen.asts;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.io.MoreFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes generated sources. A file is first written next to its destination
 * and then moved over it, so readers never see a partially written file.
 */
public class FileGenerator {

    public static final String GENERATED_COMMENT = "/* This file is autogenerated, DO NOT MODIFY */";

    /** mode of newly created files on POSIX file systems */
    public static final ImmutableSet<PosixFilePermission> DEFAULT_PERMISSIONS =
            Sets.immutableEnumSet(PosixFilePermissions.fromString("rw-r--r--"));

    private static final Logger log = LoggerFactory.getLogger(FileGenerator.class);

    private final List<Path> writtenFiles = new ArrayList<>();

    public void createFile(Path file, CharSequence content) {
        Path dir = file.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
            MoreFiles.asCharSink(tmp, StandardCharsets.UTF_8).write(content);
            applyPermissions(tmp, file);
            move(tmp, file);
            tmp = null;
        } catch (IOException e) {
            throw new SinkWriteException(file, e);
        } finally {
            if (tmp != null) {
                removeTemporary(tmp);
            }
        }
        synchronized (writtenFiles) {
            writtenFiles.add(file);
        }
    }

    public ImmutableList<Path> getWrittenFiles() {
        synchronized (writtenFiles) {
            return ImmutableList.copyOf(writtenFiles);
        }
    }

    /**
     * Temporary files are private to the owner. An overwritten file keeps its
     * mode, a new one gets {@link #DEFAULT_PERMISSIONS}.
     */
    private static void applyPermissions(Path tmp, Path file) throws IOException {
        PosixFileAttributeView view = Files.getFileAttributeView(tmp, PosixFileAttributeView.class);
        if (view == null) {
            return;
        }
        if (Files.isRegularFile(file)) {
            view.setPermissions(Files.getPosixFilePermissions(file));
        } else {
            view.setPermissions(DEFAULT_PERMISSIONS);
        }
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void removeTemporary(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
