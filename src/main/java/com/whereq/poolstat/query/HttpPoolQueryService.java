package com.whereq.poolstat.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.poolstat.config.PoolStatProperties;
import com.whereq.poolstat.exception.PoolQueryException;
import com.whereq.poolstat.exception.TransientQueryException;
import com.whereq.poolstat.model.Expression;
import com.whereq.poolstat.model.SourceRef;
import com.whereq.poolstat.model.SourceType;
import com.whereq.poolstat.model.StateRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Pool query service backed by an HTTP pool query gateway
 *
 * The gateway speaks the pool's native protocol; this adapter only deals in JSON:
 * source listings as [{name, address, type}] and records as flat objects, with
 * expressions encoded as {"expr": text, "value": evaluated}.
 */
@Slf4j
@Service
public class HttpPoolQueryService implements PoolQueryService {

    private static final String SOURCES_PATH = "/api/v1/pools/{pool}/sources";
    private static final String QUERY_PATH = "/api/v1/query";

    private final WebClient webClient;
    private final Duration timeout;

    @Autowired
    public HttpPoolQueryService(WebClient poolQueryWebClient, PoolStatProperties properties) {
        this(poolQueryWebClient, properties.getQuery().getTimeout());
    }

    public HttpPoolQueryService(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    @Override
    public Mono<List<SourceRef>> listSources(String pool, SourceType type, String constraint) {
        String operation = "list " + type + " sources of " + pool;
        return webClient.get()
            .uri(uri -> uri.path(SOURCES_PATH)
                .queryParam("type", "{type}")
                .queryParam("constraint", "{constraint}")
                .build(Map.of("pool", pool, "type", type.name(), "constraint", constraint)))
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(body -> toSources(body, type))
            .onErrorMap(e -> translate(operation, e));
    }

    @Override
    public Mono<List<StateRecord>> query(SourceRef source, String constraint, List<String> attributes) {
        String operation = "query " + source.getName();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("source", source.getAddress());
        request.put("type", source.getType() != null ? source.getType().name() : SourceType.SCHEDD.name());
        request.put("constraint", constraint);
        request.put("attributes", attributes);

        return webClient.post()
            .uri(QUERY_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(this::toRecords)
            .doOnNext(records -> log.debug("{} returned {} records", operation, records.size()))
            .onErrorMap(e -> translate(operation, e));
    }

    private List<SourceRef> toSources(JsonNode body, SourceType type) {
        requireArray(body);
        List<SourceRef> sources = new ArrayList<>(body.size());
        for (JsonNode node : body) {
            String name = node.path("name").asText(null);
            if (name == null) {
                throw new PoolQueryException("Source entry without a name: " + node);
            }
            sources.add(SourceRef.builder()
                .name(name)
                .address(node.path("address").asText(name))
                .type(type)
                .build());
        }
        return sources;
    }

    private List<StateRecord> toRecords(JsonNode body) {
        requireArray(body);
        List<StateRecord> records = new ArrayList<>(body.size());
        for (JsonNode node : body) {
            if (!node.isObject()) {
                throw new PoolQueryException("Record is not an object: " + node);
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Object value = toValue(field.getValue());
                if (value != null) {
                    attributes.put(field.getKey(), value);
                }
            }
            records.add(StateRecord.of(attributes));
        }
        return records;
    }

    /**
     * JSON attribute value to record value; null for JSON null
     */
    static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject() && node.has("expr")) {
            return new Expression(node.get("expr").asText(), toValue(node.get("value")));
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    private static void requireArray(JsonNode body) {
        if (body == null || !body.isArray()) {
            throw new PoolQueryException("Expected a JSON array from the gateway, got "
                + (body == null ? "nothing" : body.getNodeType()));
        }
    }

    /**
     * Communication failures, timeouts and gateway-side 5xx are transient; everything else is final
     */
    static Throwable translate(String operation, Throwable e) {
        if (e instanceof TransientQueryException || e instanceof PoolQueryException) {
            return e;
        }
        if (e instanceof WebClientResponseException response) {
            if (response.getStatusCode().is5xxServerError()) {
                return new TransientQueryException(operation + ": gateway returned " + response.getStatusCode(), e);
            }
            return new PoolQueryException(operation + ": gateway returned " + response.getStatusCode(), e);
        }
        if (e instanceof WebClientRequestException || e instanceof TimeoutException || hasIoCause(e)) {
            return new TransientQueryException(operation + ": " + e.getMessage(), e);
        }
        return new PoolQueryException(operation + ": " + e.getMessage(), e);
    }

    private static boolean hasIoCause(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return true;
            }
        }
        return false;
    }
}
