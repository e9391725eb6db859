package com.dcruver.filetaxonomy.nlp;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Groups files into themes from their keywords alone, without any model calls.
 *
 * Known semantic groups (a small fixed lexicon) are tried first, then frequent leftover keywords
 * together with look-alike keywords. Files go to the theme with the best keyword overlap; the rest
 * are regrouped by their most frequent keyword or end up in "Uncategorized". Large themes are split
 * into sub-themes on their most distinctive keyword.
 *
 * Every map that feeds a tie-break is sorted, so the same input always gives the same output.
 */
@Slf4j
public class SemanticThemeClusterer {

    static final Map<String, Set<String>> SEMANTIC_GROUPS = new LinkedHashMap<>();

    static {
        SEMANTIC_GROUPS.put("magic", Set.of("magic", "trick", "tricks", "illusion", "card", "cards", "coin",
            "coins", "sleight", "prestidigitation", "magician", "performance", "routine"));
        SEMANTIC_GROUPS.put("cooking", Set.of("recipe", "recipes", "cooking", "food", "chef", "kitchen", "baking",
            "ingredients", "meal", "dinner", "lunch", "breakfast"));
        SEMANTIC_GROUPS.put("music", Set.of("music", "song", "songs", "album", "artist", "band", "concert", "audio",
            "track", "playlist", "guitar", "piano"));
        SEMANTIC_GROUPS.put("programming", Set.of("code", "coding", "programming", "developer", "software", "app",
            "swift", "python", "javascript", "java", "api", "function", "class"));
        SEMANTIC_GROUPS.put("photography", Set.of("photo", "photos", "photography", "camera", "image", "images",
            "picture", "pictures", "portrait", "landscape"));
        SEMANTIC_GROUPS.put("video", Set.of("video", "videos", "movie", "movies", "film", "footage", "clip"));
        SEMANTIC_GROUPS.put("document", Set.of("document", "documents", "report", "paper", "memo", "letter"));
        SEMANTIC_GROUPS.put("project", Set.of("project", "projects", "work", "task", "plan", "planning"));
        SEMANTIC_GROUPS.put("personal", Set.of("personal", "private", "family", "home", "vacation", "travel"));
        SEMANTIC_GROUPS.put("finance", Set.of("finance", "financial", "budget", "invoice", "tax", "bank", "money"));
        SEMANTIC_GROUPS.put("education", Set.of("tutorial", "tutorials", "lesson", "lessons", "course", "learn",
            "learning", "training", "education", "study"));
    }

    private static final double MIN_ASSIGNMENT_SCORE = 0.1;
    private static final double MERGE_SIMILARITY = 0.2;
    private static final int MAX_KEYWORD_THEMES = 20;
    private static final String OTHER = "Other";

    private final ClusteringProperties config;

    public SemanticThemeClusterer(ClusteringProperties config) {
        this.config = config;
    }

    public ClusteringProperties getConfig() {
        return config;
    }

    public List<ThemeCluster> cluster(List<ExtractedKeywords> files) {
        if (files.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> frequencies = keywordFrequencies(files);
        List<WorkingTheme> candidates = candidateThemes(frequencies);
        candidates.sort(Comparator.comparingInt((WorkingTheme t) -> t.score).reversed()
            .thenComparing(t -> t.name));
        if (candidates.size() > config.getTargetThemeCount()) {
            candidates = new ArrayList<>(candidates.subList(0, config.getTargetThemeCount()));
        }

        // Assign each file to its best-overlapping theme
        List<ExtractedKeywords> unassigned = new ArrayList<>();
        for (ExtractedKeywords file : files) {
            WorkingTheme best = null;
            double bestScore = MIN_ASSIGNMENT_SCORE;
            for (WorkingTheme theme : candidates) {
                double score = jaccard(file.getKeywords(), theme.keywords);
                if (score > bestScore) {
                    bestScore = score;
                    best = theme;
                }
            }
            if (best != null) {
                best.files.add(file);
            } else {
                unassigned.add(file);
            }
        }

        List<WorkingTheme> themes = new ArrayList<>(candidates.stream().filter(t -> !t.files.isEmpty()).toList());
        List<ExtractedKeywords> uncategorized = regroupUnassigned(unassigned, frequencies, themes);
        mergeSmallThemes(themes);

        themes.sort(Comparator.comparingInt((WorkingTheme t) -> t.files.size()).reversed()
            .thenComparing(t -> t.name));

        List<ThemeCluster> clusters = new ArrayList<>();
        for (WorkingTheme theme : themes) {
            clusters.add(ThemeCluster.builder()
                .name(theme.name)
                .keywords(theme.keywords)
                .files(List.copyOf(theme.files))
                .subThemes(subThemes(theme.files, theme.keywords, 2))
                .uncategorized(false)
                .build());
        }
        if (!uncategorized.isEmpty()) {
            clusters.add(ThemeCluster.builder()
                .name(ThemeCluster.UNCATEGORIZED)
                .keywords(Set.of())
                .files(List.copyOf(uncategorized))
                .subThemes(List.of())
                .uncategorized(true)
                .build());
        }

        log.info("Clustered {} files into {} themes ({} uncategorized)",
            files.size(), clusters.size(), uncategorized.size());
        return clusters;
    }

    private Map<String, Integer> keywordFrequencies(List<ExtractedKeywords> files) {
        Map<String, Integer> frequencies = new TreeMap<>();
        for (ExtractedKeywords file : files) {
            for (String keyword : file.getKeywords()) {
                frequencies.merge(keyword, 1, Integer::sum);
            }
        }
        return frequencies;
    }

    private List<WorkingTheme> candidateThemes(Map<String, Integer> frequencies) {
        List<WorkingTheme> candidates = new ArrayList<>();
        Set<String> used = new HashSet<>();

        for (Map.Entry<String, Set<String>> group : SEMANTIC_GROUPS.entrySet()) {
            Set<String> matching = new TreeSet<>();
            int score = 0;
            for (String keyword : group.getValue()) {
                Integer frequency = frequencies.get(keyword);
                if (frequency != null) {
                    matching.add(keyword);
                    score += frequency;
                }
            }
            if (score >= config.getMinFilesPerTheme()) {
                candidates.add(new WorkingTheme(capitalize(group.getKey()), matching, score));
                used.addAll(matching);
            }
        }

        List<String> frequent = frequencies.entrySet().stream()
            .filter(e -> !used.contains(e.getKey()) && e.getValue() >= config.getMinFilesPerTheme())
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .limit(MAX_KEYWORD_THEMES)
            .map(Map.Entry::getKey)
            .toList();

        Set<String> absorbed = new HashSet<>();
        for (String keyword : frequent) {
            if (absorbed.contains(keyword)) {
                continue;
            }
            Set<String> related = new TreeSet<>();
            related.add(keyword);
            for (String other : frequent) {
                if (!other.equals(keyword) && !absorbed.contains(other)
                        && characterSimilarity(keyword, other) >= config.getThemeSimilarityThreshold()) {
                    related.add(other);
                }
            }
            absorbed.addAll(related);
            int score = related.stream().mapToInt(frequencies::get).sum();
            candidates.add(new WorkingTheme(capitalize(keyword), related, score));
        }
        return candidates;
    }

    /**
     * Group leftovers by their most frequent keyword. Groups that are big enough become themes (or
     * join a theme of the same name); everything else is returned as uncategorized.
     */
    private List<ExtractedKeywords> regroupUnassigned(List<ExtractedKeywords> unassigned,
                                                      Map<String, Integer> frequencies,
                                                      List<WorkingTheme> themes) {
        List<ExtractedKeywords> uncategorized = new ArrayList<>();
        Map<String, List<ExtractedKeywords>> byKeyword = new TreeMap<>();
        for (ExtractedKeywords file : unassigned) {
            String key = mostFrequentKeyword(file.getKeywords(), frequencies);
            if (key == null) {
                uncategorized.add(file);
            } else {
                byKeyword.computeIfAbsent(key, k -> new ArrayList<>()).add(file);
            }
        }

        for (Map.Entry<String, List<ExtractedKeywords>> group : byKeyword.entrySet()) {
            if (group.getValue().size() < config.getMinFilesPerTheme()) {
                uncategorized.addAll(group.getValue());
                continue;
            }
            String name = capitalize(group.getKey());
            WorkingTheme existing = themes.stream()
                .filter(t -> t.name.equalsIgnoreCase(name))
                .findFirst()
                .orElse(null);
            if (existing != null) {
                existing.files.addAll(group.getValue());
            } else {
                WorkingTheme theme = new WorkingTheme(name, new TreeSet<>(Set.of(group.getKey())), group.getValue().size());
                theme.files.addAll(group.getValue());
                themes.add(theme);
            }
        }
        return uncategorized;
    }

    private void mergeSmallThemes(List<WorkingTheme> themes) {
        List<WorkingTheme> surviving = themes.stream()
            .filter(t -> t.files.size() >= config.getMinFilesPerTheme())
            .toList();
        List<WorkingTheme> small = themes.stream()
            .filter(t -> t.files.size() < config.getMinFilesPerTheme())
            .toList();

        for (WorkingTheme theme : small) {
            WorkingTheme best = null;
            double bestSimilarity = MERGE_SIMILARITY;
            for (WorkingTheme candidate : surviving) {
                double similarity = jaccard(theme.keywords, candidate.keywords);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    best = candidate;
                }
            }
            if (best != null) {
                log.debug("Merging small theme {} into {}", theme.name, best.name);
                best.files.addAll(theme.files);
                best.keywords.addAll(theme.keywords);
                themes.remove(theme);
            }
        }
    }

    private List<SubTheme> subThemes(List<ExtractedKeywords> files, Set<String> parentKeywords, int level) {
        if (level > config.getMaxDepth() || files.size() < 2 * config.getMinFilesPerSubTheme()) {
            return List.of();
        }

        Map<String, List<ExtractedKeywords>> byKeyword = new TreeMap<>();
        List<ExtractedKeywords> other = new ArrayList<>();
        for (ExtractedKeywords file : files) {
            String key = mostDistinctiveKeyword(file.getKeywords(), parentKeywords);
            if (key == null) {
                other.add(file);
            } else {
                byKeyword.computeIfAbsent(key, k -> new ArrayList<>()).add(file);
            }
        }

        List<SubTheme> result = new ArrayList<>();
        for (Map.Entry<String, List<ExtractedKeywords>> group : byKeyword.entrySet()) {
            if (group.getValue().size() < config.getMinFilesPerSubTheme()) {
                other.addAll(group.getValue());
                continue;
            }
            Set<String> keywords = new TreeSet<>(parentKeywords);
            keywords.add(group.getKey());
            result.add(SubTheme.builder()
                .name(capitalize(group.getKey()))
                .keywords(keywords)
                .files(List.copyOf(group.getValue()))
                .subThemes(subThemes(group.getValue(), keywords, level + 1))
                .build());
        }

        // A single group is no split at all
        if (result.isEmpty() || result.size() + (other.isEmpty() ? 0 : 1) < 2) {
            return List.of();
        }
        if (!other.isEmpty()) {
            result.add(SubTheme.builder()
                .name(OTHER)
                .keywords(parentKeywords)
                .files(List.copyOf(other))
                .subThemes(List.of())
                .build());
        }
        return result;
    }

    static String mostFrequentKeyword(Set<String> keywords, Map<String, Integer> frequencies) {
        return keywords.stream()
            .min(Comparator.comparingInt((String k) -> frequencies.getOrDefault(k, 0)).reversed()
                .thenComparing(Comparator.comparingInt(String::length).reversed())
                .thenComparing(Comparator.naturalOrder()))
            .orElse(null);
    }

    static String mostDistinctiveKeyword(Set<String> keywords, Set<String> exclude) {
        return keywords.stream()
            .filter(k -> !exclude.contains(k))
            .min(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .orElse(null);
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    /**
     * Jaccard similarity of the two words' character sets.
     */
    static double characterSimilarity(String a, String b) {
        Set<Character> left = new HashSet<>();
        for (char c : a.toCharArray()) {
            left.add(c);
        }
        Set<Character> right = new HashSet<>();
        for (char c : b.toCharArray()) {
            right.add(c);
        }
        Set<Character> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) {
            return 0.0;
        }
        left.retainAll(right);
        return (double) left.size() / union.size();
    }

    static String capitalize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    private static final class WorkingTheme {
        final String name;
        final Set<String> keywords;
        final int score;
        final List<ExtractedKeywords> files = new ArrayList<>();

        WorkingTheme(String name, Set<String> keywords, int score) {
            this.name = name;
            this.keywords = keywords;
            this.score = score;
        }
    }
}
