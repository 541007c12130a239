package com.challenges.collector.json;

import com.challenges.collector.ContainerCollector;
import com.challenges.collector.GroupCollector;
import com.challenges.collector.Inserter;
import com.challenges.collector.query.Filter;
import com.challenges.collector.query.Query;
import com.challenges.collector.query.QueryNode;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableObjectLongMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.ObjectLongMaps;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

public class QueryDefinitionReaderTest {

    private static final String ORDERS_DEFINITION = """
            {"fanout": [
              {"select": "success", "then": {"guard": {"filters": [{"exclude": [false]}]}}},
              {"path": ".orders[]", "then": {"fanout": [
                {"select": "shipmentStore", "then": {"group": 1, "key": "upper"}},
                {"select": "status", "then": {"group": 2}},
                {"path": ".items[]", "then": {"fanout": [
                  {"select": "quantity", "then": {"element": 3}},
                  {"select": "id", "then": {"element": 1}},
                  {"path": ".offer.name", "then": {"element": 2, "filters": [{"exclude": ["delivery"]}]}}
                ]}}
              ]}}
            ]}
            """;

    private static final String ORDERS_RECORDS = """
            [
              {"success": true, "orders": [
                {"shipmentStore": "north", "status": "new", "items": [
                  {"quantity": 2, "id": 1, "offer": {"name": "pen"}},
                  {"quantity": 1, "id": 9, "offer": {"name": "delivery"}},
                  {"quantity": 3, "id": 1, "offer": {"name": "pen"}}
                ]},
                {"shipmentStore": "south", "status": "new", "items": [
                  {"quantity": 5, "id": 2, "offer": {"name": "cup"}}
                ]}
              ]},
              {"success": false, "orders": [
                {"shipmentStore": "north", "status": "new", "items": [
                  {"quantity": 100, "id": 1, "offer": {"name": "pen"}}
                ]}
              ]},
              {"success": true, "orders": [
                {"shipmentStore": "north", "status": "done", "items": [
                  {"quantity": 4, "id": 2, "offer": {"name": "cup"}}
                ]}
              ]}
            ]
            """;

    private final QueryFunctions functions = new QueryFunctions()
            .keyTransform("upper", value -> ((String) value).toUpperCase())
            .predicate("even", value -> ((Long) value) % 2 == 0);

    private final QueryDefinitionReader reader = new QueryDefinitionReader(functions);

    @Test
    public void testReadsTheSameTreeAsTheLiteralApi() throws IOException {
        QueryNode node = reader.read("{\"path\": \".items[]\", \"then\": {\"element\": 1, \"filters\": [{\"include\": [1, 2]}]}}");

        QueryNode expected = Query.path(".items[]", Query.element(1).includeAnyOf(1L, 2L));
        assertEquals(expected, node);
    }

    @Test
    public void testOrdersDefinitionOverJsonRecords() throws IOException {
        QueryNode query = reader.read(ORDERS_DEFINITION);
        MutableList<Object> records = new JsonRecordReader().readAll(ORDERS_RECORDS);
        Inserter<MutableObjectLongMap<List<Object>>> inserter =
                (totals, values) -> totals.addToValue(List.of(values[0], values[1]), (Long) values[2]);

        GroupCollector<MutableObjectLongMap<List<Object>>> collector =
                GroupCollector.compile(query, ObjectLongMaps.mutable::empty, inserter);
        MutableMap<Object, Object> result = collector.collect(records);

        MutableObjectLongMap<List<Object>> northNew = ObjectLongMaps.mutable.empty();
        northNew.put(List.of(1L, "pen"), 5L);
        MutableObjectLongMap<List<Object>> southNew = ObjectLongMaps.mutable.empty();
        southNew.put(List.of(2L, "cup"), 5L);
        MutableObjectLongMap<List<Object>> northDone = ObjectLongMaps.mutable.empty();
        northDone.put(List.of(2L, "cup"), 4L);

        assertEquals(Map.of(
                "NORTH", Map.of("new", northNew, "done", northDone),
                "SOUTH", Map.of("new", southNew)), result);
    }

    @Test
    public void testNamedPredicate() throws IOException {
        QueryNode query = reader.read("{\"iterate\": {\"element\": 1, \"filters\": [{\"include\": {\"test\": \"even\"}}]}}");

        Inserter<MutableList<Object>> inserter = (list, values) -> list.add(values[0]);
        ContainerCollector<?> collector = ContainerCollector.compile(query, Lists.mutable::<Object>empty, inserter);

        assertEquals(List.of(2L, 4L), collector.collect(new JsonRecordReader().readAll("[[1, 2, 3, 4]]")));
    }

    @Test
    public void testSelectByIndex() throws IOException {
        QueryNode node = reader.read("{\"select\": 0, \"then\": {\"element\": 1}}");

        assertEquals(Query.select(0, Query.element(1)), node);
    }

    @Test
    public void testUnknownFunctionNames() {
        assertThrows(IllegalArgumentException.class,
                () -> reader.read("{\"group\": 1, \"key\": \"missing\"}"));
        assertThrows(IllegalArgumentException.class,
                () -> reader.read("{\"element\": 1, \"filters\": [{\"exclude\": {\"test\": \"missing\"}}]}"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "[]",
            "{}",
            "{\"select\": \"a\"}",
            "{\"select\": \"a\", \"iterate\": {\"element\": 1}}",
            "{\"element\": \"one\"}",
            "{\"fanout\": {\"element\": 1}}",
            "{\"element\": 1, \"filters\": [{\"keep\": [1]}]}",
            "{\"element\": 1, \"filters\": [{\"include\": 1}]}",
            "{\"guard\": []}",
            "{\"element\": 2147483648}",
            "{\"element\": 1.5}",
            "{\"select\": 4294967296, \"then\": {\"element\": 1}}"
    })
    public void testMalformedDefinitions(String json) {
        assertThrows(IllegalArgumentException.class, () -> reader.read(json));
    }

    @Test
    public void testFormattedDefinitionReadsBackToTheSameTree() throws IOException {
        QueryNode node = reader.read(ORDERS_DEFINITION);

        assertEquals(node, reader.read(new PlanFormatter(true).format(node)));
        assertEquals(node, reader.read(new PlanFormatter(false).format(node)));
    }

    @Test
    public void testControlCharactersAreEscaped() throws IOException {
        QueryNode node = Query.select("a\u0001b\u001f", Query.element().excludeAnyOf("tab\there", "bell\u0007"));

        String formatted = new PlanFormatter(false).format(node);

        assertTrue(formatted.contains("\"a\\u0001b\\u001f\""), formatted);
        assertTrue(formatted.contains("\"tab\\there\""), formatted);
        assertEquals(node, reader.read(formatted));
        assertEquals(node, reader.read(new PlanFormatter(true).format(node)));
    }

    @Test
    public void testNamedLambdaFilterReadsBack() throws IOException {
        Predicate<Object> positive = value -> ((Long) value) > 0;
        QueryDefinitionReader positiveReader = new QueryDefinitionReader(new QueryFunctions().predicate("positive", positive));
        QueryNode node = Query.iterate(Query.element().include("positive", positive));

        String formatted = new PlanFormatter(false).format(node);

        assertEquals("{\"iterate\":{\"element\":1,\"filters\":[{\"include\":{\"test\":\"positive\"}}]}}", formatted);
        assertEquals(node, positiveReader.read(formatted));
    }

    @Test
    public void testCompactFormat() {
        QueryNode node = Query.select("a", Query.fanout(
                Query.element(1).excludeAnyOf("x"),
                Query.path(".b[0]", Query.guard()),
                Query.group(1).withFilter(Filter.include(value -> true))));

        assertEquals("{\"select\":\"a\",\"then\":{\"fanout\":["
                        + "{\"element\":1,\"filters\":[{\"exclude\":[\"x\"]}]},"
                        + "{\"select\":\"b\",\"then\":{\"select\":0,\"then\":{\"guard\":{}}}},"
                        + "{\"group\":1,\"filters\":[{\"include\":{\"test\":\"predicate\"}}]}]}}",
                new PlanFormatter(false).format(node));
    }

    @Test
    public void testPrettyFormat() {
        QueryNode node = Query.iterate(Query.element(2));

        assertEquals("""
                {
                  "iterate": {
                    "element": 2
                  }
                }""", new PlanFormatter(true).format(node));
    }
}
