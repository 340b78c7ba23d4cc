package com.spanlens.engine.elasticsearch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spanlens.engine.StoreSession;
import com.spanlens.exception.StoreConnectionException;
import com.spanlens.model.SpanDocument;
import com.spanlens.model.SpanQuery;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One run's connection to Elasticsearch.
 */
@Slf4j
class ElasticsearchSession implements StoreSession {

    private static final TypeReference<Map<String, Object>> SOURCE_TYPE = new TypeReference<>() {
    };

    private final CloseableHttpClient httpClient;
    private final String baseUrl;
    private final String authorization;
    private final ObjectMapper objectMapper;

    ElasticsearchSession(CloseableHttpClient httpClient, String baseUrl, String authorization,
                         ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.authorization = authorization;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<SpanDocument> search(SpanQuery query) {
        String index = query.getIndexName().startsWith("/")
                ? query.getIndexName().substring(1) : query.getIndexName();
        HttpPost request = new HttpPost(baseUrl + "/" + index + "/_search");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }

        String body = buildQueryBody(query);
        request.setEntity(new StringEntity(body, ContentType.APPLICATION_JSON));

        log.info("Fetching data from index {} for the last {} hours...", index, query.getHours());
        log.debug("Search body: {}", body);

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getStatusLine().getStatusCode();
            String content = response.getEntity() == null
                    ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);

            if (statusCode == HttpStatus.SC_NOT_FOUND) {
                log.warn("Index {} does not exist", index);
                return List.of();
            }
            if (statusCode < 200 || statusCode >= 300) {
                log.error("HTTP Error {}: {}", statusCode, content);
                throw new StoreConnectionException(String.format(
                        "Search on index %s failed: HTTP %d", index, statusCode));
            }

            List<SpanDocument> documents = parseHits(content);
            log.info("Retrieved {} documents", documents.size());
            return documents;
        } catch (IOException e) {
            throw new StoreConnectionException("Error fetching data from " + index + ": " + e.getMessage(), e);
        }
    }

    String buildQueryBody(SpanQuery query) {
        ObjectNode root = objectMapper.createObjectNode();
        root.putObject("query")
                .putObject("range")
                .putObject(SpanDocument.START_FIELD)
                .put("gte", "now-" + query.getHours() + "h");
        root.put("size", query.getMaxDocs());
        ArrayNode source = root.putArray("_source");
        query.getFields().forEach(source::add);
        return root.toString();
    }

    List<SpanDocument> parseHits(String content) throws IOException {
        JsonNode hits = objectMapper.readTree(content).path("hits").path("hits");
        List<SpanDocument> documents = new ArrayList<>();
        for (JsonNode hit : hits) {
            JsonNode source = hit.path("_source");
            if (source.isObject()) {
                documents.add(SpanDocument.of(objectMapper.convertValue(source, SOURCE_TYPE)));
            }
        }
        return documents;
    }

    @Override
    public void close() {
        ElasticsearchSpanStore.closeQuietly(httpClient);
    }
}
