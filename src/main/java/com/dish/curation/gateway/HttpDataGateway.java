package com.dish.curation.gateway;

import com.dish.curation.core.model.CuratedItem;
import com.dish.curation.core.model.ItemKind;
import com.dish.curation.core.model.LinkMetadata;
import com.dish.curation.core.model.LinkedItemRef;
import com.dish.curation.core.model.Municipality;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link RemoteDataGateway} backed by the public and admin REST APIs.
 *
 * <p>Reads go to the public API ({@code /api/...}); writes and association reads
 * go to the admin API ({@code /admin/...}). Any non-2xx response becomes a
 * {@link RemoteGatewayException} with the response status and the server's
 * {@code error}/{@code detail} message; I/O failures use status 0.</p>
 *
 * Usage:
 * <pre>
 * RemoteDataGateway gateway = new HttpDataGateway(HttpGatewayConfig.localDefaults());
 * List&lt;CuratedItem&gt; dishes = gateway.fetchItems(ItemQuery.inMunicipality(ItemKind.DISH, 3));
 * </pre>
 */
public class HttpDataGateway implements RemoteDataGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpDataGateway.class);

    private static final String PUBLIC_PREFIX = "/api";
    private static final String ADMIN_PREFIX = "/admin";

    private final HttpGatewayConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ItemJsonMapper mapper;

    public HttpDataGateway(HttpGatewayConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build(), new ObjectMapper());
    }

    public HttpDataGateway(HttpGatewayConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.mapper = new ItemJsonMapper(new ListFieldNormalizer(objectMapper));
    }

    @Override
    public List<CuratedItem> fetchItems(ItemQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        if (query.municipalityId() != null) {
            params.put("municipalityId", String.valueOf(query.municipalityId()));
        }
        if (query.category() != null) {
            params.put("category", query.category());
        }
        if (query.text() != null) {
            params.put("q", query.text());
        }
        if (query.flaggedOnly()) {
            params.put(query.kind() == ItemKind.DISH ? "signature" : "featured", "1");
        }
        if (query.limit() > 0) {
            params.put("limit", String.valueOf(query.limit()));
        }
        String url = config.publicBaseUrl() + PUBLIC_PREFIX + "/" + collection(query.kind()) + queryString(params);
        JsonNode body = send(HttpRequest.newBuilder(URI.create(url)).GET());
        return mapArray(body, row -> mapper.toItem(query.kind(), row));
    }

    @Override
    public CuratedItem updateItem(CuratedItem current, ItemPatch patch) {
        ItemKind kind = current.getKind();
        Map<String, Object> fields = patch.toFields(ItemJsonMapper.rankField(kind), ItemJsonMapper.flagField(kind));
        String url = config.adminBaseUrl() + ADMIN_PREFIX + "/" + collection(kind) + "/" + current.getId();
        JsonNode body = send(jsonRequest(url, "PATCH", fields));
        if (body != null && body.hasNonNull("id")) {
            return mapper.toItem(kind, body);
        }
        // {ok:true} only: the row is not echoed back
        return patch.applyTo(current);
    }

    @Override
    public void createLink(long dishId, long restaurantId, LinkMetadata metadata) {
        LinkMetadata meta = metadata != null ? metadata : LinkMetadata.defaults();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("dish_id", dishId);
        fields.put("restaurant_id", restaurantId);
        fields.put("price_note", meta.priceNote());
        fields.put("availability", meta.availability().wireValue());
        send(jsonRequest(config.adminBaseUrl() + ADMIN_PREFIX + "/dish-restaurants", "POST", fields));
    }

    @Override
    public void deleteLink(long dishId, long restaurantId) {
        String url = config.adminBaseUrl() + ADMIN_PREFIX + "/dish-restaurants"
                + "?dish_id=" + dishId + "&restaurant_id=" + restaurantId;
        send(HttpRequest.newBuilder(URI.create(url)).DELETE());
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedRestaurants(long dishId) {
        String url = config.adminBaseUrl() + ADMIN_PREFIX + "/dishes/" + dishId + "/restaurants";
        return mapArray(send(HttpRequest.newBuilder(URI.create(url)).GET()),
                row -> mapper.toLinkedRef(ItemKind.RESTAURANT, row));
    }

    @Override
    public List<LinkedItemRef> fetchAssociatedDishes(long restaurantId) {
        String url = config.adminBaseUrl() + ADMIN_PREFIX + "/restaurants/" + restaurantId + "/dishes";
        return mapArray(send(HttpRequest.newBuilder(URI.create(url)).GET()),
                row -> mapper.toLinkedRef(ItemKind.DISH, row));
    }

    @Override
    public List<Municipality> fetchMunicipalities() {
        String url = config.publicBaseUrl() + PUBLIC_PREFIX + "/municipalities";
        return mapArray(send(HttpRequest.newBuilder(URI.create(url)).GET()), mapper::toMunicipality);
    }

    @Override
    public CuratedItem createItem(CuratedItem item) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", item.getName());
        fields.put("slug", item.getSlug());
        fields.put("municipality_id", item.getMunicipalityId());
        fields.put(item.getKind() == ItemKind.DISH ? "category" : "kind", item.getCategory());
        fields.put("description", item.getDescription());
        if (item.getKind() == ItemKind.DISH) {
            fields.put("ingredients", item.getIngredients());
        }
        String url = config.adminBaseUrl() + ADMIN_PREFIX + "/" + collection(item.getKind());
        JsonNode body = send(jsonRequest(url, "POST", fields));
        if (body != null && body.hasNonNull("id")) {
            long id = body.path("id").asLong();
            return body.hasNonNull("name") ? mapper.toItem(item.getKind(), body) : item.toBuilder().id(id).build();
        }
        log.warn("Create {} returned no id, returning the submitted item", item.getKind());
        return item;
    }

    @Override
    public void deleteItem(ItemKind kind, long id) {
        String url = config.adminBaseUrl() + ADMIN_PREFIX + "/" + collection(kind) + "/" + id;
        send(HttpRequest.newBuilder(URI.create(url)).DELETE());
    }

    private HttpRequest.Builder jsonRequest(String url, String method, Map<String, Object> fields) {
        String json;
        try {
            json = objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize request body", e);
        }
        return HttpRequest.newBuilder(URI.create(url))
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(json));
    }

    private JsonNode send(HttpRequest.Builder requestBuilder) {
        HttpRequest request = requestBuilder.timeout(config.timeout()).build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("gateway.unreachable method={} uri={} error={}", request.method(), request.uri(), e.getMessage());
            throw new RemoteGatewayException(RemoteGatewayException.STATUS_UNREACHABLE, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteGatewayException(RemoteGatewayException.STATUS_UNREACHABLE, "interrupted", e);
        }

        String body = response.body();
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("gateway.failed method={} uri={} status={}", request.method(), request.uri(), status);
            throw new RemoteGatewayException(status, errorMessage(body));
        }
        log.debug("gateway.ok method={} uri={} status={}", request.method(), request.uri(), status);
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteGatewayException(status, "Malformed JSON response: " + e.getOriginalMessage(), e);
        }
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no response body";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.hasNonNull("error")) {
                String error = node.get("error").asText();
                return node.hasNonNull("detail") ? error + ": " + node.get("detail").asText() : error;
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return body;
    }

    private static <T> List<T> mapArray(JsonNode body, Function<JsonNode, T> rowMapper) {
        if (body == null || !body.isArray()) {
            return List.of();
        }
        List<T> out = new ArrayList<>(body.size());
        for (JsonNode row : body) {
            out.add(rowMapper.apply(row));
        }
        return List.copyOf(out);
    }

    private static String collection(ItemKind kind) {
        return kind == ItemKind.DISH ? "dishes" : "restaurants";
    }

    private static String queryString(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&", "?", ""));
    }
}
