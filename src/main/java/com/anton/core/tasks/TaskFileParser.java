package com.anton.core.tasks;

import com.anton.core.model.Task;
import com.anton.core.model.TaskFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a markdown checklist into phases and nested tasks.
 *
 * <p>Headings set the phase breadcrumb; {@code - [ ]}, {@code * [ ]} and {@code ● [ ]} items
 * become tasks, nested by indentation (two spaces or one tab per level). Fenced code blocks are
 * ignored, and indented non-list lines directly under a task continue its text.
 */
public final class TaskFileParser {

    private static final Logger log = LoggerFactory.getLogger(TaskFileParser.class);

    static final Pattern HEADING = Pattern.compile("^(#+)\\s*(.+)$");
    static final Pattern TASK_LINE = Pattern.compile("^(\\s*)(?:[-*]|●) \\[([ xX])\\] (.+)$");

    private TaskFileParser() {}

    /**
     * Reads and parses a task document.
     *
     * @throws TaskFileException if the file is missing or cannot be read
     */
    public static TaskFile parse(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new TaskFileException("Task file not found: " + path, e);
        } catch (IOException e) {
            throw new TaskFileException("Failed to read task file " + path + ": " + e.getMessage(), e);
        }
        return parse(content, path);
    }

    public static TaskFile parse(String content, Path path) {
        List<Node> nodes = new ArrayList<>();
        List<String> phasePath = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        Map<String, Integer> siblingCounts = new HashMap<>();
        boolean inCodeBlock = false;
        Node current = null;

        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = stripCarriageReturn(lines[i]);
            int lineNumber = i + 1;

            if (line.trim().startsWith("```")) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            if (inCodeBlock) {
                continue;
            }

            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                int level = heading.group(1).length();
                while (phasePath.size() > level - 1) {
                    phasePath.remove(phasePath.size() - 1);
                }
                phasePath.add(heading.group(2).trim());
                current = null;
                continue;
            }

            Matcher task = TASK_LINE.matcher(line);
            if (task.matches()) {
                String text = task.group(3).trim();
                if (text.isEmpty()) {
                    log.warn("Skipping empty task at line {}", lineNumber);
                    continue;
                }
                int depth = task.group(1).replace("\t", "  ").length() / 2;

                while (!stack.isEmpty() && stack.peek().depth >= depth) {
                    stack.pop();
                }
                Node parent = stack.peek();
                String parentKey = parent == null ? null : parent.key;

                String siblingKey = (parentKey == null ? "root" : parentKey) + ":" + depth + ":"
                        + TaskKeys.normalizeWhitespace(text);
                int ordinal = siblingCounts.merge(siblingKey, 1, Integer::sum) - 1;

                Node node = new Node(TaskKeys.taskKey(phasePath, depth, text, ordinal), text, lineNumber,
                        List.copyOf(phasePath), depth, !" ".equals(task.group(2)), parentKey);
                if (parent != null) {
                    parent.children.add(node);
                }
                nodes.add(node);
                stack.push(node);
                current = node;
            } else if (current != null && !line.isEmpty() && Character.isWhitespace(line.charAt(0))
                    && !isListMarker(line.trim())) {
                String continuation = line.trim();
                if (!continuation.isEmpty()) {
                    current.text.append(' ').append(continuation);
                }
            } else {
                current = null;
            }
        }

        Map<Node, Task> built = new IdentityHashMap<>();
        List<Task> all = new ArrayList<>(nodes.size());
        List<Task> pending = new ArrayList<>();
        List<Task> completed = new ArrayList<>();
        for (Node node : nodes) {
            Task t = build(node, built);
            all.add(t);
            (t.checked() ? completed : pending).add(t);
        }
        return new TaskFile(path, all, pending, completed, all.size(), TaskKeys.sha256(content));
    }

    private static Task build(Node node, Map<Node, Task> built) {
        Task existing = built.get(node);
        if (existing != null) {
            return existing;
        }
        List<Task> children = new ArrayList<>(node.children.size());
        for (Node child : node.children) {
            children.add(build(child, built));
        }
        Task task = new Task(node.key, node.text.toString(), node.line, node.phasePath, node.depth,
                node.checked, node.parentKey, children);
        built.put(node, task);
        return task;
    }

    private static boolean isListMarker(String trimmed) {
        return trimmed.startsWith("-") || trimmed.startsWith("*") || trimmed.startsWith("●");
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static final class Node {
        final String key;
        final StringBuilder text;
        final int line;
        final List<String> phasePath;
        final int depth;
        final boolean checked;
        final String parentKey;
        final List<Node> children = new ArrayList<>();

        Node(String key, String text, int line, List<String> phasePath, int depth, boolean checked,
             String parentKey) {
            this.key = key;
            this.text = new StringBuilder(text);
            this.line = line;
            this.phasePath = phasePath;
            this.depth = depth;
            this.checked = checked;
            this.parentKey = parentKey;
        }
    }
}
