package com.challenges.collector.query;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Parses a compact path such as {@code .orders[].items[0]."offer name"} into the
 * chain of {@link QueryNode.Select} and {@link QueryNode.Iterate} nodes that leads
 * to {@code tail}.
 *
 * <ul>
 *     <li>{@code .name} or {@code ."quoted name"} selects a mapping key</li>
 *     <li>{@code [n]} or {@code .[n]} selects a list index, negative counts from the end</li>
 *     <li>{@code []} or {@code .[]} iterates</li>
 * </ul>
 */
public class PathParser {
    private static final Object ITERATE = new Object();

    public QueryNode parse(String path, QueryNode tail) {
        if (path == null || path.isBlank()) {
            return tail;
        }

        String trimmed = path.trim();
        if (trimmed.equals(".")) {
            return tail;
        }

        MutableList<Object> steps = Lists.mutable.empty();
        int i = 0;
        while (i < trimmed.length()) {
            char c = trimmed.charAt(i);
            if (c == '.' && i + 1 < trimmed.length() && trimmed.charAt(i + 1) == '[') {
                i++;
                continue;
            }
            if (c == '[') {
                int close = trimmed.indexOf(']', i);
                if (close == -1) {
                    throw new IllegalArgumentException("Unclosed '[' in path: " + path);
                }
                String index = trimmed.substring(i + 1, close).trim();
                if (index.isEmpty()) {
                    steps.add(ITERATE);
                } else {
                    try {
                        steps.add(Integer.parseInt(index));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid list index in path: " + index);
                    }
                }
                i = close + 1;
            } else if (c == '.') {
                i = parseKey(trimmed, i + 1, steps, path);
            } else {
                throw new IllegalArgumentException("Unsupported path: " + path);
            }
        }

        QueryNode node = tail;
        for (Object step : steps.asReversed()) {
            node = step == ITERATE ? new QueryNode.Iterate(node) : new QueryNode.Select(step, node);
        }
        return node;
    }

    private int parseKey(String path, int start, MutableList<Object> steps, String original) {
        if (start < path.length() && path.charAt(start) == '"') {
            int close = path.indexOf('"', start + 1);
            if (close == -1) {
                throw new IllegalArgumentException("Unclosed quoted key in path: " + original);
            }
            steps.add(path.substring(start + 1, close));
            return close + 1;
        }

        int end = start;
        while (end < path.length() && ".[]".indexOf(path.charAt(end)) == -1) {
            end++;
        }
        if (end == start) {
            throw new IllegalArgumentException("Empty key in path: " + original);
        }
        steps.add(path.substring(start, end));
        return end;
    }
}
