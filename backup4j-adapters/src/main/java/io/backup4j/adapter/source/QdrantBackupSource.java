package io.backup4j.adapter.source;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.backup4j.Credentials;
import io.backup4j.adapter.JsonHttpClient;
import io.backup4j.core.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Qdrant vector store exported over the REST API: one {@code <collection>.json} per collection
 * with its vector config and every point (id, vector, payload).
 */
public class QdrantBackupSource extends ArchiveBackupSource {
    private static final Logger log = LoggerFactory.getLogger(QdrantBackupSource.class);

    static final String ARCHIVE_ROOT = "qdrant_backup";
    static final int PAGE_SIZE = 1000;

    private final String url;
    private final JsonHttpClient http;
    private final ObjectMapper mapper;

    public QdrantBackupSource(Credentials credentials, Path workDir, Clock clock, ObjectMapper mapper) {
        this(credentials.url(), new JsonHttpClient(credentials.url(), authHeaders(credentials), mapper), workDir, clock);
    }

    QdrantBackupSource(String url, JsonHttpClient http, Path workDir, Clock clock) {
        super(SourceType.QDRANT, ARCHIVE_ROOT, workDir, clock);
        this.url = url;
        this.http = http;
        this.mapper = http.objectMapper();
    }

    static Map<String, String> authHeaders(Credentials credentials) {
        if (credentials.hasApiKey()) {
            return Map.of("api-key", credentials.apiKey());
        }
        if (credentials.login() != null && !credentials.login().isBlank()) {
            return Map.of("api-key", credentials.login());
        }
        return Map.of();
    }

    @Override
    protected void exportTo(Path dir) throws IOException, InterruptedException {
        List<String> names = new ArrayList<>();
        for (JsonNode c : http.get("/collections").path("result").path("collections")) {
            names.add(c.path("name").asText());
        }
        if (names.isEmpty()) {
            throw new IOException("No collections found in Qdrant");
        }

        for (String name : names) {
            JsonNode params = http.get("/collections/" + encode(name)).path("result").path("config").path("params");
            ObjectNode config = mapper.createObjectNode();
            config.set("vectors", params.path("vectors"));
            if (params.has("shard_number")) {
                config.set("shard_number", params.get("shard_number"));
            }
            if (params.has("replication_factor")) {
                config.set("replication_factor", params.get("replication_factor"));
            }

            long count;
            try (OutputStream out = Files.newOutputStream(dir.resolve(name + ".json"));
                 JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
                gen.writeStartObject();
                gen.writeStringField("name", name);
                gen.writeFieldName("config");
                mapper.writeTree(gen, config);
                gen.writeArrayFieldStart("points");
                count = scrollPoints(name, gen);
                gen.writeEndArray();
                gen.writeEndObject();
            }
            log.debug("Exported collection={} points={}", name, count);
        }
    }

    private long scrollPoints(String collection, JsonGenerator gen) throws IOException, InterruptedException {
        JsonNode offset = null;
        long count = 0;
        do {
            ObjectNode request = mapper.createObjectNode();
            request.put("limit", PAGE_SIZE);
            request.put("with_payload", true);
            request.put("with_vector", true);
            if (offset != null) {
                request.set("offset", offset);
            }
            JsonNode result = http.post("/collections/" + encode(collection) + "/points/scroll", request).path("result");
            for (JsonNode point : result.path("points")) {
                ObjectNode p = mapper.createObjectNode();
                p.set("id", point.path("id"));
                p.set("vector", point.path("vector"));
                p.set("payload", point.has("payload") ? point.get("payload") : mapper.createObjectNode());
                mapper.writeTree(gen, p);
                count++;
            }
            JsonNode next = result.path("next_page_offset");
            offset = next.isMissingNode() || next.isNull() ? null : next;
        } while (offset != null);
        return count;
    }

    @Override
    protected void importFrom(Path dir) throws IOException, InterruptedException {
        List<Path> files;
        try (Stream<Path> list = Files.list(dir)) {
            files = list.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            restoreCollection(mapper.readTree(file.toFile()));
        }
    }

    private void restoreCollection(JsonNode data) throws IOException, InterruptedException {
        String name = data.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new IOException("Collection file without a name");
        }
        String path = "/collections/" + encode(name);
        try {
            http.delete(path);
        } catch (JsonHttpClient.HttpStatusException e) {
            if (e.status() != 404) {
                throw e;
            }
        }
        http.put(path, data.path("config"));

        ArrayNode batch = mapper.createArrayNode();
        long total = 0;
        for (JsonNode point : data.path("points")) {
            batch.add(point);
            total++;
            if (batch.size() == PAGE_SIZE) {
                upsert(path, batch);
                batch = mapper.createArrayNode();
            }
        }
        if (batch.size() > 0) {
            upsert(path, batch);
        }
        log.debug("Restored collection={} points={}", name, total);
    }

    private void upsert(String collectionPath, ArrayNode points) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.set("points", points);
        http.put(collectionPath + "/points?wait=true", body);
    }

    @Override
    protected String describe() {
        return "qdrant:" + url;
    }

    @Override
    public boolean testConnection() {
        try {
            http.get("/collections");
            return true;
        } catch (IOException e) {
            log.warn("Connection test failed source={} msg={}", describe(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
