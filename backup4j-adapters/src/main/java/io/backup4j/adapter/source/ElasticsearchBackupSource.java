package io.backup4j.adapter.source;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Elasticsearch cluster exported over the REST API.
 *
 * <p>Each non-system index becomes {@code <index>.json} holding its settings, mappings and every
 * document ({@code _id} and {@code _source}) read with a scroll. Restore deletes and recreates
 * each index, then bulk-loads the documents.
 */
public class ElasticsearchBackupSource extends ArchiveBackupSource {
    private static final Logger log = LoggerFactory.getLogger(ElasticsearchBackupSource.class);

    static final String ARCHIVE_ROOT = "elasticsearch_backup";
    static final int PAGE_SIZE = 1000;
    private static final String SCROLL_KEEP_ALIVE = "2m";
    private static final List<String> GENERATED_SETTINGS = List.of("uuid", "creation_date", "version", "provided_name");

    private final String url;
    private final JsonHttpClient http;
    private final ObjectMapper mapper;

    public ElasticsearchBackupSource(Credentials credentials, Path workDir, Clock clock, ObjectMapper mapper) {
        this(credentials.url(), new JsonHttpClient(credentials.url(), authHeaders(credentials), mapper), workDir, clock);
    }

    ElasticsearchBackupSource(String url, JsonHttpClient http, Path workDir, Clock clock) {
        super(SourceType.ELASTICSEARCH, ARCHIVE_ROOT, workDir, clock);
        this.url = url;
        this.http = http;
        this.mapper = http.objectMapper();
    }

    static Map<String, String> authHeaders(Credentials credentials) {
        if (credentials.hasApiKey()) {
            return Map.of("Authorization", "ApiKey " + credentials.apiKey());
        }
        if (credentials.hasLogin()) {
            return JsonHttpClient.basicAuth(credentials.login(), credentials.password());
        }
        return Map.of();
    }

    @Override
    protected void exportTo(Path dir) throws IOException, InterruptedException {
        JsonNode indices = http.get("/*");
        List<String> names = new ArrayList<>();
        indices.fieldNames().forEachRemaining(n -> {
            if (!n.startsWith(".")) {
                names.add(n);
            }
        });
        if (names.isEmpty()) {
            throw new IOException("No indices found in Elasticsearch cluster");
        }

        for (String name : names) {
            JsonNode index = indices.get(name);
            Path file = dir.resolve(name + ".json");
            long count;
            try (OutputStream out = Files.newOutputStream(file);
                 JsonGenerator gen = mapper.getFactory().createGenerator(out)) {
                gen.writeStartObject();
                gen.writeStringField("index", name);
                gen.writeFieldName("settings");
                mapper.writeTree(gen, objectOrEmpty(index.get("settings")));
                gen.writeFieldName("mappings");
                mapper.writeTree(gen, objectOrEmpty(index.get("mappings")));
                gen.writeArrayFieldStart("documents");
                count = scrollDocuments(name, gen);
                gen.writeEndArray();
                gen.writeEndObject();
            }
            log.debug("Exported index={} documents={}", name, count);
        }
    }

    private long scrollDocuments(String index, JsonGenerator gen) throws IOException, InterruptedException {
        ObjectNode query = mapper.createObjectNode();
        query.put("size", PAGE_SIZE);
        query.putObject("query").putObject("match_all");

        JsonNode page = http.post("/" + encode(index) + "/_search?scroll=" + SCROLL_KEEP_ALIVE, query);
        String scrollId = page.path("_scroll_id").asText(null);
        long count = 0;
        try {
            while (page.path("hits").path("hits").size() > 0) {
                for (JsonNode hit : page.path("hits").path("hits")) {
                    gen.writeStartObject();
                    gen.writeStringField("_id", hit.path("_id").asText());
                    gen.writeFieldName("_source");
                    mapper.writeTree(gen, objectOrEmpty(hit.get("_source")));
                    gen.writeEndObject();
                    count++;
                }
                if (scrollId == null) {
                    break;
                }
                page = http.post("/_search/scroll", Map.of("scroll", SCROLL_KEEP_ALIVE, "scroll_id", scrollId));
                scrollId = page.path("_scroll_id").asText(scrollId);
            }
        } finally {
            if (scrollId != null) {
                clearScroll(scrollId);
            }
        }
        return count;
    }

    private void clearScroll(String scrollId) throws InterruptedException {
        try {
            http.sendRaw("DELETE", "/_search/scroll",
                    mapper.writeValueAsString(Map.of("scroll_id", scrollId)), "application/json");
        } catch (IOException e) {
            log.warn("Could not clear scroll source={} msg={}", describe(), e.getMessage());
        }
    }

    @Override
    protected void importFrom(Path dir) throws IOException, InterruptedException {
        List<Path> files;
        try (Stream<Path> list = Files.list(dir)) {
            files = list.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().collect(Collectors.toList());
        }
        for (Path file : files) {
            JsonNode data = mapper.readTree(file.toFile());
            String fileName = file.getFileName().toString();
            String name = data.path("index").asText(fileName.substring(0, fileName.length() - ".json".length()));
            restoreIndex(name, data);
        }
    }

    private void restoreIndex(String name, JsonNode data) throws IOException, InterruptedException {
        try {
            http.delete("/" + encode(name));
        } catch (JsonHttpClient.HttpStatusException e) {
            if (e.status() != 404) {
                throw e;
            }
        }

        ObjectNode body = mapper.createObjectNode();
        ObjectNode settings = objectOrEmpty(data.get("settings"));
        if (settings.get("index") instanceof ObjectNode indexSettings) {
            GENERATED_SETTINGS.forEach(indexSettings::remove);
        }
        body.set("settings", settings);
        body.set("mappings", objectOrEmpty(data.get("mappings")));
        http.put("/" + encode(name), body);

        Iterator<JsonNode> docs = data.path("documents").elements();
        StringBuilder bulk = new StringBuilder();
        int batch = 0;
        long total = 0;
        while (docs.hasNext()) {
            JsonNode doc = docs.next();
            ObjectNode action = mapper.createObjectNode();
            ObjectNode meta = action.putObject("index");
            meta.put("_index", name);
            if (doc.hasNonNull("_id")) {
                meta.put("_id", doc.get("_id").asText());
            }
            bulk.append(mapper.writeValueAsString(action)).append('\n')
                    .append(mapper.writeValueAsString(doc.path("_source"))).append('\n');
            batch++;
            total++;
            if (batch == PAGE_SIZE) {
                sendBulk(bulk.toString());
                bulk.setLength(0);
                batch = 0;
            }
        }
        if (batch > 0) {
            sendBulk(bulk.toString());
        }
        log.debug("Restored index={} documents={}", name, total);
    }

    private void sendBulk(String ndjson) throws IOException, InterruptedException {
        JsonNode result = http.sendRaw("POST", "/_bulk?refresh=true", ndjson, "application/x-ndjson");
        if (result.path("errors").asBoolean(false)) {
            for (JsonNode item : result.path("items")) {
                JsonNode error = item.path("index").path("error");
                if (!error.isMissingNode()) {
                    throw new IOException("Bulk load failed: " + error.path("reason").asText(error.toString()));
                }
            }
            throw new IOException("Bulk load reported errors");
        }
    }

    @Override
    protected String describe() {
        return "elasticsearch:" + url;
    }

    @Override
    public boolean testConnection() {
        try {
            http.get("/");
            return true;
        } catch (IOException e) {
            log.warn("Connection test failed source={} msg={}", describe(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ObjectNode objectOrEmpty(JsonNode node) {
        return node instanceof ObjectNode o ? o.deepCopy() : mapper.createObjectNode();
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }
}
