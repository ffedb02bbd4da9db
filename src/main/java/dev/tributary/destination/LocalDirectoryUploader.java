package dev.tributary.destination;

import dev.tributary.pipeline.UploadItem;
import dev.tributary.pipeline.Uploader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploader that copies each staged artifact to {@code uploadDir/<relative path>.json}, mirroring
 * the source hierarchy. Existing files are replaced.
 */
public class LocalDirectoryUploader implements Uploader {

    private static final Logger log = LoggerFactory.getLogger(LocalDirectoryUploader.class);

    private final Path uploadDir;

    public LocalDirectoryUploader(Path uploadDir) {
        this.uploadDir = uploadDir.toAbsolutePath().normalize();
    }

    @Override
    public void upload(List<UploadItem> items) throws IOException {
        for (UploadItem item : items) {
            Path target = uploadDir.resolve(item.record().relativePath() + ".json").normalize();
            if (!target.startsWith(uploadDir)) {
                throw new IOException("Upload target escapes " + uploadDir + ": " + item.record().relativePath());
            }
            Files.createDirectories(target.getParent());
            Files.copy(item.artifact(), target, StandardCopyOption.REPLACE_EXISTING);
        }
        log.info("Copied {} artifacts to {}", items.size(), uploadDir);
    }
}
