package com.flowb.social.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowb.social.config.DataStoreProperties;
import com.flowb.social.exception.DataStoreException;
import com.flowb.social.store.DataStore;
import com.flowb.social.store.StoreFilter;
import com.flowb.social.store.StoreQuery;
import com.flowb.social.util.DataStoreMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link DataStore} over the hosted store's PostgREST endpoint ({@code /rest/v1/<table>}).
 *
 * Filters become query parameters ({@code user_id=eq.telegram_1}), upserts use
 * {@code on_conflict} with a {@code Prefer: resolution=...} header.
 */
@Component
public class RestDataStoreClient implements DataStore {

    private static final Logger logger = LoggerFactory.getLogger(RestDataStoreClient.class);

    private static final String REST_PATH = "/rest/v1/";
    private static final String RETURN_ROWS = "return=representation";
    private static final String RETURN_NOTHING = "return=minimal";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final DataStoreProperties properties;

    @Autowired
    public RestDataStoreClient(HttpClient externalHttpClient, DataStoreProperties properties) {
        this(externalHttpClient, DataStoreMapper.create(), properties);
    }

    /**
     * Constructor for testing with a custom HttpClient.
     */
    RestDataStoreClient(HttpClient httpClient, ObjectMapper objectMapper, DataStoreProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public <T> List<T> query(StoreQuery query, Class<T> rowType) {
        String url = tableUrl(query.getTable()) + "?" + queryString(query, true);
        HttpRequest request = baseRequest(url).GET().build();
        String body = send(request, query.getTable()).body();
        return readRows(body, rowType, query.getTable());
    }

    @Override
    public <T> T insert(String table, Object row, Class<T> rowType) {
        HttpRequest request = baseRequest(tableUrl(table))
                .header("Prefer", RETURN_ROWS)
                .POST(HttpRequest.BodyPublishers.ofString(write(row, table)))
                .build();
        return firstRow(send(request, table).body(), rowType, table);
    }

    @Override
    public <T> T upsert(String table, Object row, List<String> conflictKeys, Class<T> rowType) {
        HttpRequest request = baseRequest(tableUrl(table) + "?on_conflict=" + encode(String.join(",", conflictKeys)))
                .header("Prefer", RETURN_ROWS + ",resolution=merge-duplicates")
                .POST(HttpRequest.BodyPublishers.ofString(write(row, table)))
                .build();
        return firstRow(send(request, table).body(), rowType, table);
    }

    @Override
    public void insertIgnoringConflicts(String table, Object row, List<String> conflictKeys) {
        HttpRequest request = baseRequest(tableUrl(table) + "?on_conflict=" + encode(String.join(",", conflictKeys)))
                .header("Prefer", RETURN_NOTHING + ",resolution=ignore-duplicates")
                .POST(HttpRequest.BodyPublishers.ofString(write(row, table)))
                .build();
        send(request, table);
    }

    @Override
    public void patch(StoreQuery filter, Map<String, Object> fields) {
        requireFilters(filter, "patch");
        HttpRequest request = baseRequest(tableUrl(filter.getTable()) + "?" + queryString(filter, false))
                .header("Prefer", RETURN_NOTHING)
                .method("PATCH", HttpRequest.BodyPublishers.ofString(write(fields, filter.getTable())))
                .build();
        send(request, filter.getTable());
    }

    @Override
    public void delete(StoreQuery filter) {
        requireFilters(filter, "delete");
        HttpRequest request = baseRequest(tableUrl(filter.getTable()) + "?" + queryString(filter, false))
                .header("Prefer", RETURN_NOTHING)
                .DELETE()
                .build();
        send(request, filter.getTable());
    }

    private void requireFilters(StoreQuery filter, String operation) {
        if (filter.getFilters().isEmpty()) {
            throw new IllegalArgumentException("Refusing unfiltered " + operation + " on " + filter.getTable());
        }
    }

    private HttpRequest.Builder baseRequest(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(properties.getReadTimeout())
                .header("apikey", properties.getServiceKey())
                .header("Authorization", "Bearer " + properties.getServiceKey())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request, String table) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                logger.warn("Data store returned {} for {} {}", status, request.method(), table);
                throw DataStoreException.rejected(table, status, response.body());
            }
            return response;
        } catch (IOException e) {
            throw DataStoreException.unavailable(table, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DataStoreException.unavailable(table, e);
        }
    }

    String queryString(StoreQuery query, boolean forRead) {
        List<String> params = new ArrayList<>();
        if (forRead) {
            params.add("select=*");
        }
        for (StoreFilter filter : query.getFilters()) {
            params.add(encode(filter.getColumn()) + "=" + encode(filterExpression(filter)));
        }
        if (forRead && query.getOrderColumn() != null) {
            params.add("order=" + encode(query.getOrderColumn() + (query.isAscending() ? ".asc" : ".desc")));
        }
        if (forRead && query.getLimit() != null) {
            params.add("limit=" + query.getLimit());
        }
        return String.join("&", params);
    }

    private String filterExpression(StoreFilter filter) {
        String token = filter.getOperator().getToken();
        switch (filter.getOperator()) {
            case IS_NULL:
                return token + ".null";
            case IN:
            case NOT_IN:
                String list = filter.getValues().stream()
                        .map(value -> "\"" + formatValue(value).replace("\"", "\\\"") + "\"")
                        .collect(Collectors.joining(","));
                return token + ".(" + list + ")";
            default:
                return token + "." + formatValue(filter.getValue());
        }
    }

    /**
     * Render a filter value the way it is stored: enums by their JSON name, instants as ISO-8601.
     */
    private String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        JsonNode node = objectMapper.valueToTree(value);
        return node.isTextual() ? node.asText() : node.toString();
    }

    private String write(Object body, String table) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw DataStoreException.mapping(table, e);
        }
    }

    private <T> List<T> readRows(String body, Class<T> rowType, String table) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, rowType);
            return objectMapper.readValue(body, listType);
        } catch (JsonProcessingException e) {
            throw DataStoreException.mapping(table, e);
        }
    }

    private <T> T firstRow(String body, Class<T> rowType, String table) {
        List<T> rows = readRows(body, rowType, table);
        return rows.isEmpty() ? null : rows.get(0);
    }

    private String tableUrl(String table) {
        String base = properties.getUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + REST_PATH + table;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
