package com.dcruver.filetaxonomy.scan;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Scans a directory tree on the local file system. Hidden files and folders are skipped.
 */
@Component
@Slf4j
public class FilesystemScanner implements Scanner {

    @Override
    public ScanResult scan(Path root, boolean hierarchyAware) throws IOException {
        Path dir = root.toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }
        String rootName = dir.getFileName() != null ? dir.getFileName().toString() : dir.toString();

        log.info("Scanning {} ({})", dir, hierarchyAware ? "hierarchy-aware" : "flat");

        if (!hierarchyAware) {
            List<ScannedFile> files = walkFiles(dir, dir);
            log.info("Found {} files", files.size());
            return new ScanResult(rootName, files, List.of(), files);
        }

        List<ScannedFile> folders = new ArrayList<>();
        List<ScannedFile> loose = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : children.sorted().toList()) {
                if (isHidden(dir, child)) {
                    continue;
                }
                if (Files.isDirectory(child)) {
                    folders.add(describeFolder(child));
                } else if (Files.isRegularFile(child)) {
                    loose.add(describe(child));
                }
            }
        }

        List<ScannedFile> all = new ArrayList<>(folders);
        all.addAll(loose);
        log.info("Found {} folders and {} loose files", folders.size(), loose.size());
        return new ScanResult(rootName, all, folders, loose);
    }

    private List<ScannedFile> walkFiles(Path dir, Path root) throws IOException {
        List<ScannedFile> files = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(dir)) {
            List<Path> regular = paths
                .filter(Files::isRegularFile)
                .filter(p -> !isHidden(root, p))
                .sorted(Comparator.naturalOrder())
                .toList();
            for (Path path : regular) {
                try {
                    files.add(describe(path));
                } catch (IOException e) {
                    log.error("Failed to read attributes of {}: {}", path, e.getMessage());
                }
            }
        }
        return files;
    }

    private ScannedFile describe(Path path) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
        String name = path.getFileName().toString();
        return ScannedFile.builder()
            .id(stableId(path))
            .name(name)
            .path(path.toString())
            .extension(ScannedFile.extensionOf(name))
            .size(attributes.size())
            .createdAt(attributes.creationTime().toInstant())
            .modifiedAt(attributes.lastModifiedTime().toInstant())
            .directory(false)
            .build();
    }

    private ScannedFile describeFolder(Path folder) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(folder, BasicFileAttributes.class);
        long size = walkFiles(folder, folder).stream().mapToLong(ScannedFile::getSize).sum();
        return ScannedFile.builder()
            .id(stableId(folder))
            .name(folder.getFileName().toString())
            .path(folder.toString())
            .extension("")
            .size(size)
            .createdAt(attributes.creationTime().toInstant())
            .modifiedAt(attributes.lastModifiedTime().toInstant())
            .directory(true)
            .build();
    }

    private static boolean isHidden(Path root, Path path) {
        for (Path segment : root.relativize(path)) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static UUID stableId(Path path) {
        return UUID.nameUUIDFromBytes(path.toString().getBytes(StandardCharsets.UTF_8));
    }
}
