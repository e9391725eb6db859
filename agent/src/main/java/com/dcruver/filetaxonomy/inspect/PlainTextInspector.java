package com.dcruver.filetaxonomy.inspect;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.nlp.FileTypeHint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads a bounded prefix of text-like files. Other files get an empty signal tagged with their type.
 * Media analysis (OCR, transcription, scene tagging) is left to richer inspectors.
 */
@Component
@Slf4j
public class PlainTextInspector implements Inspector {

    private static final Set<String> TEXT_EXTENSIONS = Set.of(
        "txt", "md", "markdown", "org", "csv", "tsv", "json", "xml", "html", "htm", "yml", "yaml",
        "log", "ini", "conf", "properties", "java", "py", "js", "ts", "swift", "rb", "go", "rs", "sh", "sql");

    private final int maxChars;

    public PlainTextInspector(@Value("${taxonomy.inspector.max-chars:4000}") int maxChars) {
        this.maxChars = maxChars;
    }

    @Override
    public ContentSignal inspect(ScannedFile file) throws InspectionException {
        String kind = file.isDirectory() ? "folder" : FileTypeHint.fromExtension(file.getExtension()).name().toLowerCase();
        if (file.isDirectory() || !TEXT_EXTENSIONS.contains(file.getExtension())) {
            return ContentSignal.empty(kind);
        }

        Path path = Path.of(file.getPath());
        if (!Files.isRegularFile(path)) {
            throw new InspectionException("Not a readable file: " + path);
        }

        char[] buffer = new char[maxChars];
        int read = 0;
        try (Reader reader = new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8)) {
            int n;
            while (read < maxChars && (n = reader.read(buffer, read, maxChars - read)) != -1) {
                read += n;
            }
        } catch (IOException e) {
            throw new InspectionException("Failed to read " + path + ": " + e.getMessage(), e);
        }

        log.debug("Read {} chars from {}", read, file.getName());
        return ContentSignal.builder()
            .textCue(new String(buffer, 0, read))
            .kind(kind)
            .build();
    }
}
