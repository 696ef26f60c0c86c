package com.anton.core.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Keyword search over the markdown notes and plans kept in the project's plan directory.
 *
 * <p>Each file scores one point per query term it contains; files with no matching term are not
 * returned. Content is capped so a single large plan cannot crowd out the rest.
 */
public class PlanDirectoryKnowledgeStore implements KnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(PlanDirectoryKnowledgeStore.class);

    static final int MAX_FILES = 200;
    static final int MAX_CONTENT_CHARS = 4000;

    private final Path projectDir;
    private final Path directory;

    public PlanDirectoryKnowledgeStore(Path projectDir, Path directory) {
        this.projectDir = projectDir;
        this.directory = directory;
    }

    @Override
    public List<KnowledgeHit> search(String query, int limit) {
        if (query == null || query.isBlank() || !Files.isDirectory(directory)) {
            return List.of();
        }
        String[] terms = query.toLowerCase(Locale.ROOT).trim().split("\\s+");

        List<KnowledgeHit> hits = new ArrayList<>();
        try (Stream<Path> files = Files.walk(directory, 2)) {
            List<Path> candidates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .limit(MAX_FILES)
                    .toList();
            for (Path file : candidates) {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                String lower = content.toLowerCase(Locale.ROOT);
                int score = 0;
                for (String term : terms) {
                    if (lower.contains(term)) {
                        score++;
                    }
                }
                if (score > 0) {
                    hits.add(new KnowledgeHit(label(file), truncate(content), score));
                }
            }
        } catch (IOException e) {
            log.warn("Knowledge search in {} failed: {}", directory, e.getMessage());
            return List.of();
        }

        hits.sort(Comparator.comparingDouble(KnowledgeHit::score).reversed()
                .thenComparing(KnowledgeHit::key));
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : hits;
    }

    private String label(Path file) {
        Path abs = file.toAbsolutePath().normalize();
        Path root = projectDir.toAbsolutePath().normalize();
        return abs.startsWith(root) ? root.relativize(abs).toString() : abs.toString();
    }

    private static String truncate(String content) {
        return content.length() <= MAX_CONTENT_CHARS
                ? content.trim()
                : content.substring(0, MAX_CONTENT_CHARS).trim() + "\n... (truncated)";
    }
}
