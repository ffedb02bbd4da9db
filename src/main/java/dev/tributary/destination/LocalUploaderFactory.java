package dev.tributary.destination;

import dev.tributary.document.StageName;
import dev.tributary.pipeline.StageFactory;
import dev.tributary.pipeline.StageSettings;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Uploader variant {@code local}. Requires option {@code upload-dir}. */
@Component
public class LocalUploaderFactory implements StageFactory<LocalDirectoryUploader> {

    static final String VARIANT = "local";

    @Override
    public StageName stage() {
        return StageName.UPLOAD;
    }

    @Override
    public String variant() {
        return VARIANT;
    }

    @Override
    public LocalDirectoryUploader create(StageSettings settings) {
        return new LocalDirectoryUploader(Path.of(settings.requireOption("upload-dir")));
    }
}
