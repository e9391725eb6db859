package com.dcruver.filetaxonomy.scan;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemScannerTest {

    @TempDir
    Path tempDir;

    private final FilesystemScanner scanner = new FilesystemScanner();

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("recipe_pasta.txt"), "Boil water.");
        Files.writeString(tempDir.resolve(".DS_Store"), "x");
        Path magic = Files.createDirectories(tempDir.resolve("Magic"));
        Files.writeString(magic.resolve("card_trick.pdf"), "0123456789");
        Files.writeString(magic.resolve("coin_trick.mp4"), "01234");
        Path hidden = Files.createDirectories(tempDir.resolve(".cache"));
        Files.writeString(hidden.resolve("blob.bin"), "x");
    }

    @Test
    void testFlatScanFindsVisibleFiles() throws IOException {
        ScanResult result = scanner.scan(tempDir, false);

        List<String> names = result.getFiles().stream().map(ScannedFile::getName).sorted().toList();
        assertEquals(List.of("card_trick.pdf", "coin_trick.mp4", "recipe_pasta.txt"), names);
        assertEquals(tempDir.getFileName().toString(), result.getRootName());
        assertTrue(result.getFolders().isEmpty());
        ScannedFile pdf = result.getFiles().stream().filter(f -> f.getName().equals("card_trick.pdf")).findFirst().orElseThrow();
        assertEquals("pdf", pdf.getExtension());
        assertEquals(10, pdf.getSize());
        assertFalse(pdf.isDirectory());
    }

    @Test
    void testIdsAreStableAcrossScans() throws IOException {
        List<ScannedFile> first = scanner.scan(tempDir, false).getFiles();
        List<ScannedFile> second = scanner.scan(tempDir, false).getFiles();

        assertEquals(first.stream().map(ScannedFile::getId).toList(), second.stream().map(ScannedFile::getId).toList());
    }

    @Test
    void testHierarchyAwareScanTreatsFoldersAsUnits() throws IOException {
        ScanResult result = scanner.scan(tempDir, true);

        assertEquals(1, result.getFolders().size());
        ScannedFile folder = result.getFolders().get(0);
        assertEquals("Magic", folder.getName());
        assertTrue(folder.isDirectory());
        assertEquals(15, folder.getSize());
        assertEquals(List.of("recipe_pasta.txt"), result.getLooseFiles().stream().map(ScannedFile::getName).toList());
        assertEquals(2, result.getFiles().size());
    }

    @Test
    void testMissingDirectory() {
        assertThrows(IOException.class, () -> scanner.scan(tempDir.resolve("nope"), false));
    }
}
