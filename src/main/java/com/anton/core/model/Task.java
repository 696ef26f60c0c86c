package com.anton.core.model;

import java.util.List;

/**
 * A checklist item parsed from the task document.
 *
 * @param key stable identifier derived from breadcrumb, depth, text and sibling position
 * @param text task text, continuation lines joined with a space
 * @param line 1-based source line of the checkbox
 * @param phasePath ancestor heading texts, outermost first
 * @param depth nesting level (0 for top-level items)
 * @param checked whether the document marks the item as done
 * @param parentKey key of the enclosing task, or null at top level
 * @param children nested checklist items in declaration order
 */
public record Task(
    String key,
    String text,
    int line,
    List<String> phasePath,
    int depth,
    boolean checked,
    String parentKey,
    List<Task> children
) {

    public Task {
        phasePath = List.copyOf(phasePath);
        children = List.copyOf(children);
    }

}
