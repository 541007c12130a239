package com.challenges.collector.json;

import com.challenges.collector.query.Filter;
import com.challenges.collector.query.KeyTransform;
import com.challenges.collector.query.PathParser;
import com.challenges.collector.query.QueryNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a query tree from its JSON definition. Every node is an object with one
 * node key:
 *
 * <pre>
 * {"select": "orders", "then": ...}      {"path": ".orders[]", "then": ...}
 * {"iterate": ...}                       {"fanout": [..., ...]}
 * {"element": 1, "filters": [...]}       {"group": 1, "key": "upper", "filters": [...]}
 * {"guard": {"filters": [...]}}
 * </pre>
 *
 * A filter is {@code {"include": [values]}}, {@code {"exclude": [values]}}, or the
 * same keys with {@code {"test": "name"}} for a named predicate. Predicates and key
 * transforms are looked up in the {@link QueryFunctions} given to the reader.
 */
public class QueryDefinitionReader {
    private static final ImmutableList<String> NODE_KEYS =
            Lists.immutable.with("select", "path", "iterate", "fanout", "element", "group", "guard");

    private final JsonRecordReader jsonReader = new JsonRecordReader();
    private final PathParser pathParser = new PathParser();
    private final QueryFunctions functions;

    public QueryDefinitionReader() {
        this(QueryFunctions.none());
    }

    public QueryDefinitionReader(QueryFunctions functions) {
        this.functions = Objects.requireNonNull(functions, "functions");
    }

    public QueryNode read(InputStream input) throws IOException {
        return toNode(jsonReader.read(input));
    }

    public QueryNode read(String json) throws IOException {
        return read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    private QueryNode toNode(Object definition) {
        if (!(definition instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("A query node must be a JSON object, got: " + definition);
        }
        MutableList<String> present = NODE_KEYS.select(map::containsKey).toList();
        if (present.size() != 1) {
            throw new IllegalArgumentException("A query node needs exactly one of "
                    + NODE_KEYS.makeString(", ") + ", got: " + map.keySet());
        }

        String kind = present.getFirst();
        Object body = map.get(kind);
        return switch (kind) {
            case "select" -> new QueryNode.Select(selectKey(body), toNode(required(map, "then")));
            case "path" -> pathParser.parse(string(body, "path"), toNode(required(map, "then")));
            case "iterate" -> new QueryNode.Iterate(toNode(body));
            case "fanout" -> new QueryNode.Fanout(list(body, "fanout").collect(this::toNode).toImmutable());
            case "element" -> new QueryNode.ElementLeaf(position(body), filters(map.get("filters")));
            case "group" -> {
                Object key = map.get("key");
                KeyTransform transform = key == null ? null : functions.keyTransform(string(key, "key"));
                yield new QueryNode.GroupLeaf(position(body), filters(map.get("filters")), transform);
            }
            case "guard" -> {
                if (!(body instanceof Map<?, ?> guard)) {
                    throw new IllegalArgumentException("A guard must be a JSON object, got: " + body);
                }
                yield new QueryNode.Guard(filters(guard.get("filters")));
            }
            default -> throw new IllegalStateException("Unhandled node key: " + kind);
        };
    }

    private ImmutableList<Filter> filters(Object definition) {
        if (definition == null) {
            return Lists.immutable.empty();
        }
        return list(definition, "filters").collect(this::toFilter).toImmutable();
    }

    private Filter toFilter(Object definition) {
        if (!(definition instanceof Map<?, ?> map) || map.size() != 1) {
            throw new IllegalArgumentException("A filter is {\"include\": ...} or {\"exclude\": ...}, got: "
                    + definition);
        }
        Filter.Mode mode;
        Object body;
        if (map.containsKey("include")) {
            mode = Filter.Mode.INCLUDE;
            body = map.get("include");
        } else if (map.containsKey("exclude")) {
            mode = Filter.Mode.EXCLUDE;
            body = map.get("exclude");
        } else {
            throw new IllegalArgumentException("Unsupported filter: " + definition);
        }

        if (body instanceof List<?> values) {
            return new Filter(mode, new Filter.Condition.AnyOf(Sets.mutable.<Object>withAll(values).toImmutable()));
        }
        if (body instanceof Map<?, ?> test && test.get("test") != null) {
            String name = string(test.get("test"), "test");
            return new Filter(mode, new Filter.Condition.Matches(name, functions.predicate(name)));
        }
        throw new IllegalArgumentException("A filter takes a list of values or {\"test\": name}, got: " + body);
    }

    private static Object selectKey(Object key) {
        if (key instanceof String) {
            return key;
        }
        if (key instanceof Long index && fitsInt(index)) {
            return index.intValue();
        }
        throw new IllegalArgumentException("A select key is a string or an int index, got: " + key);
    }

    private static int position(Object value) {
        if (value instanceof Long position && fitsInt(position)) {
            return position.intValue();
        }
        throw new IllegalArgumentException("A position must be an int, got: " + value);
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }

    private static Object required(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing \"" + key + "\" in: " + map);
        }
        return value;
    }

    private static String string(Object value, String what) {
        if (value instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException("\"" + what + "\" must be a string, got: " + value);
    }

    private static MutableList<Object> list(Object value, String what) {
        if (value instanceof List<?> list) {
            return Lists.mutable.withAll(list);
        }
        throw new IllegalArgumentException("\"" + what + "\" must be a JSON array, got: " + value);
    }
}
