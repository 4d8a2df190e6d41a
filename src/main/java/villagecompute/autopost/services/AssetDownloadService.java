package villagecompute.autopost.services;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.autopost.api.types.GeneratedImageType;
import villagecompute.autopost.jobs.AssetWorkspace;

/**
 * Materializes generated images as local files inside a post's {@link AssetWorkspace}.
 */
@ApplicationScoped
public class AssetDownloadService {

    private static final Logger LOG = Logger.getLogger(AssetDownloadService.class);

    private static final Duration DOWNLOAD_TIMEOUT = Duration.ofSeconds(60);

    private final HttpClient httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10)).build();

    /**
     * Downloads (or decodes) each image in order.
     *
     * @return local paths, same order as {@code images}
     * @throws UncheckedIOException
     *             if any image cannot be retrieved
     */
    public List<Path> retrieve(List<GeneratedImageType> images, AssetWorkspace workspace) {
        List<Path> files = new ArrayList<>(images.size());
        for (GeneratedImageType image : images) {
            Path target = workspace.newFile("jpg");
            if (image.url() != null && !image.url().isBlank()) {
                download(image.url(), target);
            } else {
                write(target, Base64.getDecoder().decode(image.inlineData()));
            }
            files.add(target);
        }
        LOG.infof("Retrieved %d images into %s", files.size(), workspace.directory());
        return files;
    }

    private void download(String url, Path target) {
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(DOWNLOAD_TIMEOUT).GET()
                    .build();
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
            if (response.statusCode() / 100 != 2) {
                throw new UncheckedIOException(
                        new IOException("Image download returned status " + response.statusCode() + ": " + url));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Image download failed: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during image download", e);
        }
    }

    private static void write(Path target, byte[] data) {
        try {
            Files.write(target, data);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write image " + target, e);
        }
    }
}
