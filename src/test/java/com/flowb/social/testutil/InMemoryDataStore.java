package com.flowb.social.testutil;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowb.social.exception.DataStoreException;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreFilter;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.DataStoreMapper;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Table-per-list {@link DataStore} for scenario tests. Rows are kept as JSON objects mapped
 * with the production {@link DataStoreMapper}, so column names and enum values match what the
 * REST store would hold. Filters follow SQL semantics: a missing column never matches.
 */
public class InMemoryDataStore implements DataStore {

    private final ObjectMapper mapper = DataStoreMapper.create();
    private final Map<String, List<ObjectNode>> tables = new HashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Set<String> failingTables = new HashSet<>();

    /**
     * Make every call against {@code table} fail as if the store were down.
     */
    public void failOn(String table) {
        failingTables.add(table);
    }

    public List<ObjectNode> rows(String table) {
        return tables.computeIfAbsent(table, t -> new ArrayList<>());
    }

    public <T> List<T> all(String table, Class<T> rowType) {
        return rows(table).stream().map(row -> convert(row, rowType)).collect(Collectors.toList());
    }

    @Override
    public synchronized <T> List<T> query(StoreQuery query, Class<T> rowType) {
        checkAvailable(query.getTable());
        List<ObjectNode> matches = matching(query);
        if (query.getOrderColumn() != null) {
            Comparator<ObjectNode> order = (a, b) -> compareNullsLast(a.get(query.getOrderColumn()), b.get(query.getOrderColumn()));
            matches.sort(query.isAscending() ? order : order.reversed());
        }
        if (query.getLimit() != null && matches.size() > query.getLimit()) {
            matches = matches.subList(0, query.getLimit());
        }
        return matches.stream().map(row -> convert(row, rowType)).collect(Collectors.toList());
    }

    @Override
    public synchronized <T> T insert(String table, Object row, Class<T> rowType) {
        checkAvailable(table);
        ObjectNode node = toNode(row);
        if (!node.hasNonNull("id")) {
            node.put("id", String.valueOf(ids.incrementAndGet()));
        }
        rows(table).add(node);
        return convert(node, rowType);
    }

    @Override
    public synchronized <T> T upsert(String table, Object row, List<String> conflictKeys, Class<T> rowType) {
        checkAvailable(table);
        ObjectNode node = toNode(row);
        ObjectNode existing = findConflict(table, node, conflictKeys);
        if (existing == null) {
            return insert(table, row, rowType);
        }
        node.fields().forEachRemaining(field -> {
            if (!"id".equals(field.getKey())) {
                existing.set(field.getKey(), field.getValue());
            }
        });
        return convert(existing, rowType);
    }

    @Override
    public synchronized void insertIgnoringConflicts(String table, Object row, List<String> conflictKeys) {
        checkAvailable(table);
        if (findConflict(table, toNode(row), conflictKeys) == null) {
            insert(table, row, Object.class);
        }
    }

    @Override
    public synchronized void patch(StoreQuery filter, Map<String, Object> fields) {
        checkAvailable(filter.getTable());
        ObjectNode patch = toNode(fields);
        for (ObjectNode row : matching(filter)) {
            row.setAll(patch);
        }
    }

    @Override
    public synchronized void delete(StoreQuery filter) {
        checkAvailable(filter.getTable());
        List<ObjectNode> doomed = matching(filter);
        rows(filter.getTable()).removeIf(row -> doomed.stream().anyMatch(d -> d == row));
    }

    private void checkAvailable(String table) {
        if (failingTables.contains(table)) {
            throw DataStoreException.unavailable(table, new IOException("simulated outage"));
        }
    }

    private ObjectNode findConflict(String table, ObjectNode candidate, List<String> conflictKeys) {
        for (ObjectNode row : rows(table)) {
            boolean same = conflictKeys.stream().allMatch(key ->
                    row.hasNonNull(key) && candidate.hasNonNull(key) && compare(row.get(key), candidate.get(key)) == 0);
            if (same) {
                return row;
            }
        }
        return null;
    }

    private List<ObjectNode> matching(StoreQuery query) {
        return rows(query.getTable()).stream()
                .filter(row -> query.getFilters().stream().allMatch(filter -> matches(row, filter)))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private boolean matches(ObjectNode row, StoreFilter filter) {
        JsonNode actual = row.get(filter.getColumn());
        boolean present = actual != null && !actual.isNull();
        switch (filter.getOperator()) {
            case IS_NULL:
                return !present;
            case IN:
                return present && filter.getValues().stream().anyMatch(v -> compare(actual, mapper.valueToTree(v)) == 0);
            case NOT_IN:
                return present && filter.getValues().stream().noneMatch(v -> compare(actual, mapper.valueToTree(v)) == 0);
            default:
                break;
        }
        if (!present) {
            return false;
        }
        int cmp = compare(actual, mapper.valueToTree(filter.getValue()));
        switch (filter.getOperator()) {
            case EQ:
                return cmp == 0;
            case NEQ:
                return cmp != 0;
            case GT:
                return cmp > 0;
            case GTE:
                return cmp >= 0;
            case LT:
                return cmp < 0;
            case LTE:
                return cmp <= 0;
            default:
                throw new IllegalStateException("Unhandled operator " + filter.getOperator());
        }
    }

    private int compareNullsLast(JsonNode a, JsonNode b) {
        boolean aNull = a == null || a.isNull();
        boolean bNull = b == null || b.isNull();
        if (aNull || bNull) {
            return aNull == bNull ? 0 : (aNull ? 1 : -1);
        }
        return compare(a, b);
    }

    private int compare(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return Double.compare(a.asDouble(), b.asDouble());
        }
        if (a.isBoolean() || b.isBoolean()) {
            return Boolean.compare(a.asBoolean(), b.asBoolean());
        }
        Instant left = asInstant(a);
        Instant right = asInstant(b);
        if (left != null && right != null) {
            return left.compareTo(right);
        }
        return a.asText().compareTo(b.asText());
    }

    private Instant asInstant(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private ObjectNode toNode(Object row) {
        return (ObjectNode) mapper.valueToTree(row);
    }

    private <T> T convert(ObjectNode row, Class<T> rowType) {
        return mapper.convertValue(row.deepCopy(), rowType);
    }
}
