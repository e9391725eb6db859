package com.dcruver.filetaxonomy.build;

import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses merge answers of the form {@code Card Tricks + Card Magic -> Card Magic}, one per line.
 * {@code →} is accepted for the arrow and {@code NO_MERGES} means nothing should be merged.
 * Lines that do not fit the grammar are ignored.
 */
public final class MergeLineParser {

    public static final String NO_MERGES = "NO_MERGES";

    private static final Pattern LIST_MARKER = Pattern.compile("^(?:[-*•]|\\d+[.)])\\s+");

    @Value
    public static class MergeLine {
        List<String> sources;
        String mergedName;
    }

    private MergeLineParser() {
    }

    public static List<MergeLine> parse(String response, int maxLines) {
        List<MergeLine> lines = new ArrayList<>();
        if (response == null || response.isBlank()) {
            return lines;
        }
        for (String raw : response.split("\\R")) {
            if (lines.size() >= maxLines) {
                break;
            }
            String line = LIST_MARKER.matcher(raw.trim()).replaceFirst("");
            if (line.isEmpty() || line.equals(NO_MERGES)) {
                continue;
            }
            parseLine(line).ifPresent(lines::add);
        }
        return lines;
    }

    static Optional<MergeLine> parseLine(String line) {
        int arrow = line.indexOf("->");
        int arrowLength = 2;
        if (arrow < 0) {
            arrow = line.indexOf('→');
            arrowLength = 1;
        }
        if (arrow < 0) {
            return Optional.empty();
        }
        String mergedName = line.substring(arrow + arrowLength).trim();
        List<String> sources = Arrays.stream(line.substring(0, arrow).split("\\+"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
        if (sources.size() < 2 || mergedName.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new MergeLine(sources, mergedName));
    }
}
