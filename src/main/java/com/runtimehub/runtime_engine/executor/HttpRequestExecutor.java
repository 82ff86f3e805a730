package com.runtimehub.runtime_engine.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Performs an HTTP call and reports the response as data. Error statuses are returned like
 * any other response; transport failures come back with status 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpRequestExecutor implements NodeExecutor {

    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT", "PATCH");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public String supportedType() {
        return "HTTP Request";
    }

    /*
     * Config shape:
     * {
     *   "url":     "https://api.example.com/users",
     *   "method":  "POST",
     *   "headers": { "Authorization": "Bearer abc" },
     *   "body":    { "userId": 42 }
     * }
     */
    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) throws JsonProcessingException {
        String url = NodeConfig.string(node, inputs, "url", "");
        String method = NodeConfig.string(node, inputs, "method", "GET").toUpperCase();
        Object body = NodeConfig.value(node, inputs, "body");

        HttpHeaders headers = new HttpHeaders();
        if (node.config().get("headers") instanceof Map<?, ?> configured) {
            configured.forEach((k, v) -> headers.set(String.valueOf(k), String.valueOf(v)));
        }
        String payload = null;
        if (body != null && METHODS_WITH_BODY.contains(method)) {
            payload = body instanceof String text ? text : objectMapper.writeValueAsString(body);
            if (headers.getContentType() == null) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
        }

        log.debug("HTTP {} {} for node {}", method, url, node.id());
        Map<String, Object> outputs = new LinkedHashMap<>();
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.valueOf(method), new HttpEntity<>(payload, headers), String.class);
            fillResponse(outputs, response.getStatusCode().value(), response.getHeaders(), response.getBody());
        } catch (HttpStatusCodeException e) {
            fillResponse(outputs, e.getStatusCode().value(), e.getResponseHeaders(), e.getResponseBodyAsString());
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("HTTP request from node {} failed: {}", node.id(), e.getMessage());
            outputs.put("status", 0);
            outputs.put("statusText", "Request Failed");
            outputs.put("error", e.getMessage());
            outputs.put("status_code", 0);
        }
        outputs.put("url", url);
        outputs.put("method", method);
        return NodeOutcome.next(outputs);
    }

    private static void fillResponse(Map<String, Object> outputs, int status, HttpHeaders headers, String body) {
        HttpStatus resolved = HttpStatus.resolve(status);
        outputs.put("status", status);
        outputs.put("statusText", resolved != null ? resolved.getReasonPhrase() : "");
        outputs.put("headers", headers != null ? headers.toSingleValueMap() : Map.of());
        outputs.put("data", body != null ? body : "");
        outputs.put("response", body != null ? body : "");
        outputs.put("status_code", status);
    }
}
