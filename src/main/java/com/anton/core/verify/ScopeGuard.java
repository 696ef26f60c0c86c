package com.anton.core.verify;

import com.anton.core.model.ScopeGuardMode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that an attempt's changes stay on the files a task explicitly names.
 *
 * <p>Tasks that name no files are never constrained. In lax mode, tests, fixtures, mocks and
 * files in the same directory as a named file are also allowed.
 */
public final class ScopeGuard {

    private static final Pattern PATH = Pattern.compile(
            "\\b([A-Za-z0-9._-]+(?:/[A-Za-z0-9._-]+)+\\.[A-Za-z0-9]{1,8})\\b");
    private static final Pattern BARE = Pattern.compile("\\b([A-Za-z0-9._-]+\\.[A-Za-z0-9]{1,8})\\b");
    private static final Set<String> TEST_DIRS = Set.of(
            "tests", "test", "__tests__", "spec", "specs", "unit", "integration", "feature");

    private ScopeGuard() {}

    /**
     * Outcome of a scope check.
     *
     * @param ok true when every changed file is in scope
     * @param reason one-line failure reason, null when ok
     * @param outOfScope changed files that are not allowed
     */
    public record ScopeCheck(boolean ok, String reason, List<String> outOfScope) {

        static ScopeCheck passed() {
            return new ScopeCheck(true, null, List.of());
        }
    }

    public static ScopeCheck check(String taskText, List<String> changedFiles, ScopeGuardMode mode) {
        if (mode == ScopeGuardMode.OFF) {
            return ScopeCheck.passed();
        }
        List<String> expected = explicitFiles(taskText);
        if (expected.isEmpty() || changedFiles.isEmpty()) {
            return ScopeCheck.passed();
        }

        List<String> outOfScope = new ArrayList<>();
        for (String raw : changedFiles) {
            String changed = raw.startsWith("./") ? raw.substring(2) : raw;
            if (expected.contains(changed)) {
                continue;
            }
            boolean related = mode == ScopeGuardMode.LAX
                    && expected.stream().anyMatch(e -> isRelated(changed, e));
            if (!related) {
                outOfScope.add(changed);
            }
        }
        if (outOfScope.isEmpty()) {
            return ScopeCheck.passed();
        }
        return new ScopeCheck(false,
                "Scope guard failed: task explicitly targets %s but modified out-of-scope files %s"
                        .formatted(String.join(", ", expected), String.join(", ", outOfScope)),
                outOfScope);
    }

    /** File paths and bare file names mentioned in task text. */
    public static List<String> explicitFiles(String taskText) {
        Set<String> files = new LinkedHashSet<>();
        if (taskText == null) {
            return List.of();
        }
        Matcher paths = PATH.matcher(taskText);
        while (paths.find()) {
            String file = paths.group(1);
            files.add(file.startsWith("./") ? file.substring(2) : file);
        }
        Matcher bare = BARE.matcher(taskText);
        while (bare.find()) {
            String file = bare.group(1);
            if (!file.contains("/") && !isPartOfPath(taskText, bare.start())) {
                files.add(file);
            }
        }
        return List.copyOf(files);
    }

    static boolean isRelated(String changedFile, String expectedFile) {
        String changedBase = baseName(changedFile).toLowerCase(Locale.ROOT);
        String expectedBase = baseName(expectedFile).toLowerCase(Locale.ROOT);
        String changedDir = dirName(changedFile);
        String expectedDir = dirName(expectedFile);

        if (changedBase.startsWith(expectedBase) || expectedBase.startsWith(changedBase)) {
            return true;
        }
        String quoted = Pattern.quote(expectedBase);
        if (Pattern.compile("^test[._-]?" + quoted).matcher(changedBase).find()
                || Pattern.compile(quoted + "[._-](test|spec)$").matcher(changedBase).find()
                || Pattern.compile("^mock[._-]?" + quoted).matcher(changedBase).find()) {
            return true;
        }
        for (String part : changedDir.toLowerCase(Locale.ROOT).split("/")) {
            if (TEST_DIRS.contains(part) && changedBase.contains(expectedBase)) {
                return true;
            }
        }
        return !changedDir.isEmpty() && changedDir.equals(expectedDir);
    }

    private static boolean isPartOfPath(String text, int start) {
        return start > 0 && text.charAt(start - 1) == '/';
    }

    private static String baseName(String file) {
        String name = file.substring(file.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String dirName(String file) {
        int slash = file.lastIndexOf('/');
        return slash < 0 ? "" : file.substring(0, slash);
    }
}
