package villagecompute.autopost.jobs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

/**
 * Temporary directory holding one post's downloaded images. Everything in it is deleted on {@link #close()}.
 */
public class AssetWorkspace implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(AssetWorkspace.class);

    private final Path directory;
    private int counter;
    private boolean closed;

    private AssetWorkspace(Path directory) {
        this.directory = directory;
    }

    /**
     * Creates a workspace under the system temp directory.
     *
     * @param postId
     *            post the files belong to, used in the directory name
     */
    public static AssetWorkspace create(long postId) {
        try {
            return new AssetWorkspace(Files.createTempDirectory("autopost-" + postId + "-"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create asset workspace", e);
        }
    }

    public Path directory() {
        return directory;
    }

    /**
     * @return a fresh path inside the workspace; the file is not created
     */
    public synchronized Path newFile(String extension) {
        if (closed) {
            throw new IllegalStateException("Workspace already closed");
        }
        counter++;
        return directory.resolve(String.format("image-%02d.%s", counter, extension));
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    LOG.warnf("Could not delete %s: %s", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            LOG.warnf("Could not clean asset workspace %s: %s", directory, e.getMessage());
        }
    }
}
