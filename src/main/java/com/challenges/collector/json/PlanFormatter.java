package com.challenges.collector.json;

import com.challenges.collector.query.Filter;
import com.challenges.collector.query.QueryNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Renders a query tree in the JSON definition format read by
 * {@link QueryDefinitionReader}. Named predicates and key transforms are written by
 * name, so a definition read with a {@link QueryFunctions} registry formats back to
 * an equivalent definition.
 */
public class PlanFormatter {
    private final boolean prettyPrint;

    // StringBuilder pool for performance
    private static final ThreadLocal<StringBuilder> STRING_BUILDER_POOL =
        ThreadLocal.withInitial(() -> new StringBuilder(512));

    public PlanFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(QueryNode node) {
        StringBuilder sb = STRING_BUILDER_POOL.get();
        sb.setLength(0); // Clear the builder

        formatNode(node, 0, sb);

        return sb.toString();
    }

    private void formatNode(QueryNode node, int indent, StringBuilder sb) {
        MutableList<Field> fields = Lists.mutable.empty();

        if (node instanceof QueryNode.Select select) {
            fields.add(new Field("select", literal(select.key())));
            fields.add(new Field("then", select.child()));
        } else if (node instanceof QueryNode.Iterate iterate) {
            fields.add(new Field("iterate", iterate.child()));
        } else if (node instanceof QueryNode.Fanout fanout) {
            fields.add(new Field("fanout", fanout.children()));
        } else if (node instanceof QueryNode.ElementLeaf element) {
            fields.add(new Field("element", String.valueOf(element.position())));
            addFilters(element.filters(), fields);
        } else if (node instanceof QueryNode.GroupLeaf group) {
            fields.add(new Field("group", String.valueOf(group.position())));
            if (group.keyTransform() != null) {
                fields.add(new Field("key", literal(group.keyTransform().name())));
            }
            addFilters(group.filters(), fields);
        } else if (node instanceof QueryNode.Guard guard) {
            MutableList<Field> guardFields = Lists.mutable.empty();
            addFilters(guard.filters(), guardFields);
            fields.add(new Field("guard", new Raw(guardFields)));
        } else {
            throw new IllegalStateException("Unknown query node: " + node);
        }

        formatObject(fields, indent, sb);
    }

    private void addFilters(ImmutableList<Filter> filters, MutableList<Field> fields) {
        if (filters.notEmpty()) {
            fields.add(new Field("filters", filters));
        }
    }

    private void formatObject(MutableList<Field> fields, int indent, StringBuilder sb) {
        if (fields.isEmpty()) {
            sb.append("{}");
            return;
        }
        String indentStr = " ".repeat(indent);

        sb.append('{');
        boolean first = true;
        for (Field field : fields) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            if (prettyPrint) {
                sb.append('\n').append(indentStr).append("  ");
            }
            sb.append('"').append(field.name()).append("\":");
            if (prettyPrint) {
                sb.append(' ');
            }
            formatValue(field.value(), indent + 2, sb);
        }
        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append('}');
    }

    private void formatValue(Object value, int indent, StringBuilder sb) {
        if (value instanceof String literal) {
            sb.append(literal);
        } else if (value instanceof QueryNode child) {
            formatNode(child, indent, sb);
        } else if (value instanceof Raw raw) {
            formatObject(raw.fields(), indent, sb);
        } else if (value instanceof Filter filter) {
            MutableList<Field> fields = Lists.mutable.empty();
            fields.add(new Field(filter.mode() == Filter.Mode.INCLUDE ? "include" : "exclude",
                    conditionValue(filter.condition())));
            formatObject(fields, indent, sb);
        } else if (value instanceof ImmutableList<?> items) {
            formatArray(items, indent, sb);
        } else {
            throw new IllegalStateException("Unexpected value: " + value);
        }
    }

    private Object conditionValue(Filter.Condition condition) {
        if (condition instanceof Filter.Condition.Matches matches) {
            return new Raw(Lists.mutable.with(new Field("test", literal(matches.name()))));
        }
        Filter.Condition.AnyOf anyOf = (Filter.Condition.AnyOf) condition;
        return Lists.immutable.withAll(anyOf.values().collect(this::literal));
    }

    private void formatArray(ImmutableList<?> items, int indent, StringBuilder sb) {
        if (items.isEmpty()) {
            sb.append("[]");
            return;
        }
        String indentStr = " ".repeat(indent);

        sb.append('[');
        boolean first = true;
        for (Object item : items) {
            if (!first) {
                sb.append(',');
            }
            first = false;

            if (prettyPrint) {
                sb.append('\n').append(indentStr).append("  ");
            }
            formatValue(item, indent + 2, sb);
        }
        if (prettyPrint) {
            sb.append('\n').append(indentStr);
        }
        sb.append(']');
    }

    private String literal(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        return "\"" + escapeString(value.toString()) + "\"";
    }

    private String escapeString(String s) {
        // Fast path: if no escaping needed, return original
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c < 0x20) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default   -> {
                    if (c < 0x20) {
                        result.append(String.format("\\u%04x", (int) c));
                    } else {
                        result.append(c);
                    }
                }
            }
        }
        return result.toString();
    }

    // A value already rendered as JSON text is held as a String.
    private record Field(String name, Object value) {
    }

    private record Raw(MutableList<Field> fields) {
    }
}
