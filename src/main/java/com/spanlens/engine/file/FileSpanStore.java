package com.spanlens.engine.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spanlens.config.StoreProperties;
import com.spanlens.engine.SpanStore;
import com.spanlens.engine.StoreSession;
import com.spanlens.exception.StoreConnectionException;
import com.spanlens.model.SpanDocument;
import com.spanlens.model.SpanQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads spans from a JSON export instead of a live cluster.
 * Accepts a saved Elasticsearch search response, a JSON array of hits, or a JSON array
 * of span sources. The lookback window is not applied; the export is taken as the batch,
 * cut at {@code max-docs}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "store.type", havingValue = "file")
public class FileSpanStore implements SpanStore {

    private static final TypeReference<Map<String, Object>> SOURCE_TYPE = new TypeReference<>() {
    };

    private final StoreProperties storeProperties;
    private final ObjectMapper objectMapper;

    @Override
    public String getEngineType() {
        return "JSON file";
    }

    @Override
    public StoreSession connect() {
        String file = storeProperties.getFile();
        if (file == null || file.isBlank()) {
            throw new StoreConnectionException("store.file must be set when store.type=file");
        }
        Path path = Paths.get(file);
        if (!Files.isReadable(path)) {
            throw new StoreConnectionException("Span export not readable: " + path.toAbsolutePath());
        }
        log.info("Reading spans from {}", path.toAbsolutePath());
        return new FileSession(path);
    }

    private class FileSession implements StoreSession {

        private final Path path;

        FileSession(Path path) {
            this.path = path;
        }

        @Override
        public List<SpanDocument> search(SpanQuery query) {
            JsonNode root;
            try {
                root = objectMapper.readTree(path.toFile());
            } catch (IOException e) {
                throw new StoreConnectionException("Error reading " + path + ": " + e.getMessage(), e);
            }

            JsonNode entries = root.isArray() ? root : root.path("hits").path("hits");
            List<SpanDocument> documents = new ArrayList<>();
            for (JsonNode entry : entries) {
                if (documents.size() >= query.getMaxDocs()) {
                    break;
                }
                JsonNode source = entry.has("_source") ? entry.get("_source") : entry;
                if (source.isObject()) {
                    documents.add(SpanDocument.of(objectMapper.convertValue(source, SOURCE_TYPE)));
                }
            }

            log.info("Retrieved {} documents", documents.size());
            return documents;
        }

        @Override
        public void close() {
            // nothing held open between reads
        }
    }
}
