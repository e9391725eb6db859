package com.dcruver.filetaxonomy.nlp;

import com.dcruver.filetaxonomy.domain.ScannedFile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns file names into keyword sets.
 *
 * Names are split on separators ({@code _ - . ( ) [ ] { }} and whitespace), then on camelCase and
 * letter/digit boundaries. Tokens are lower-cased; short tokens, pure numbers and stopwords are
 * dropped. The extractor is pure and never fails: a name with no usable tokens yields an empty set.
 */
@Slf4j
public class KeywordExtractor {

    private static final Pattern SEPARATORS = Pattern.compile("[_\\-.()\\[\\]{}\\s]+");
    private static final Pattern CASE_BOUNDARY = Pattern.compile(
        "(?<=[a-z])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])|(?<=[A-Za-z])(?=\\d)|(?<=\\d)(?=[A-Za-z])");
    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");
    private static final Pattern QUARTER = Pattern.compile("(?<![A-Za-z])[Qq]([1-4])(?!\\d)");

    private static final Set<String> STOPWORDS = Set.of(
        "the", "and", "for", "with", "from", "this", "that", "your", "you", "are", "was", "were",
        "been", "being", "have", "has", "had", "having", "does", "did", "doing", "will", "would",
        "could", "should", "may", "might", "must", "shall", "can", "need", "our", "ours", "their",
        "download", "file", "files", "copy", "new", "old", "final", "draft", "version", "ver", "rev",
        "edit", "edited", "original", "backup", "tmp", "temp", "test", "sample", "example", "demo",
        "untitled");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
        Map.entry("jan", 1), Map.entry("january", 1),
        Map.entry("feb", 2), Map.entry("february", 2),
        Map.entry("mar", 3), Map.entry("march", 3),
        Map.entry("apr", 4), Map.entry("april", 4),
        Map.entry("may", 5),
        Map.entry("jun", 6), Map.entry("june", 6),
        Map.entry("jul", 7), Map.entry("july", 7),
        Map.entry("aug", 8), Map.entry("august", 8),
        Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
        Map.entry("oct", 10), Map.entry("october", 10),
        Map.entry("nov", 11), Map.entry("november", 11),
        Map.entry("dec", 12), Map.entry("december", 12));

    private final int minKeywordLength;
    private final boolean stemming;

    public KeywordExtractor(int minKeywordLength, boolean stemming) {
        this.minKeywordLength = minKeywordLength;
        this.stemming = stemming;
    }

    /**
     * Fast preset: three-character minimum, no stemming. Used for the instant taxonomy.
     */
    public static KeywordExtractor fast() {
        return new KeywordExtractor(3, false);
    }

    /**
     * Quality preset: two-character minimum with suffix stemming.
     */
    public static KeywordExtractor quality() {
        return new KeywordExtractor(2, true);
    }

    public static KeywordExtractor forPreset(String preset) {
        return "quality".equalsIgnoreCase(preset) ? quality() : fast();
    }

    public ExtractedKeywords extract(ScannedFile file) {
        return extract(file.getName(), file).build();
    }

    public ExtractedKeywords extract(String fileName) {
        return extract(fileName, null).build();
    }

    public List<ExtractedKeywords> extractAll(List<ScannedFile> files) {
        List<ExtractedKeywords> result = new ArrayList<>(files.size());
        for (ScannedFile file : files) {
            result.add(extract(file));
        }
        log.debug("Extracted keywords for {} files", result.size());
        return result;
    }

    private ExtractedKeywords.ExtractedKeywordsBuilder extract(String fileName, ScannedFile file) {
        String extension = file != null && !file.isDirectory() ? file.getExtension() : ScannedFile.extensionOf(fileName);
        String base = baseName(fileName, file);

        Set<String> keywords = new TreeSet<>();
        List<String> rawTokens = tokenize(base);
        for (String token : rawTokens) {
            String lower = token.toLowerCase();
            if (lower.length() < minKeywordLength || NUMERIC.matcher(lower).matches() || STOPWORDS.contains(lower)) {
                continue;
            }
            keywords.add(lower);
        }

        Set<String> stems = new TreeSet<>();
        if (stemming) {
            keywords.forEach(k -> stems.add(stem(k)));
        }

        return ExtractedKeywords.builder()
            .fileId(file != null ? file.getId() : null)
            .fileName(fileName)
            .filePath(file != null ? file.getPath() : fileName)
            .keywords(keywords)
            .stems(stems)
            .dateInfo(dateHint(base, rawTokens))
            .fileType(file != null && file.isDirectory() ? FileTypeHint.OTHER : FileTypeHint.fromExtension(extension));
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String chunk : SEPARATORS.split(text)) {
            if (chunk.isEmpty()) {
                continue;
            }
            for (String part : CASE_BOUNDARY.split(chunk)) {
                if (!part.isEmpty()) {
                    tokens.add(part);
                }
            }
        }
        return tokens;
    }

    /**
     * Light suffix stripping; good enough to fold plurals and gerunds together.
     */
    static String stem(String word) {
        if (word.length() > 5 && word.endsWith("ing")) {
            return word.substring(0, word.length() - 3);
        }
        if (word.length() > 4 && word.endsWith("ies")) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.length() > 4 && word.endsWith("ed")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.length() > 3 && word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static DateInfo dateHint(String base, List<String> tokens) {
        Matcher year = YEAR.matcher(base);
        if (year.find()) {
            return DateInfo.ofYear(Integer.parseInt(year.group(1)));
        }
        Matcher quarter = QUARTER.matcher(base);
        if (quarter.find()) {
            return DateInfo.ofQuarter(Integer.parseInt(quarter.group(1)));
        }
        for (String token : tokens) {
            Integer month = MONTHS.get(token.toLowerCase());
            if (month != null) {
                return DateInfo.ofMonth(month);
            }
        }
        return null;
    }

    private static String baseName(String fileName, ScannedFile file) {
        if (file != null && file.isDirectory()) {
            return fileName;
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
