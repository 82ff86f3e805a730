package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class DownloadFileExecutor implements NodeExecutor {

    private final RestTemplate restTemplate;

    @Override
    public String supportedType() {
        return "Download File";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        String url = NodeConfig.string(node, inputs, "url", "");
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("url", url);
        if (url.isBlank()) {
            outputs.put("success", false);
            outputs.put("error", "No URL provided");
            return NodeOutcome.next(outputs);
        }

        Path destination = resolveDestination(node, run, inputs);
        try {
            ResponseEntity<byte[]> response = restTemplate.getForEntity(url, byte[].class);
            byte[] content = response.getBody() != null ? response.getBody() : new byte[0];
            if (destination.getParent() != null) {
                Files.createDirectories(destination.getParent());
            }
            Files.write(destination, content);
            log.debug("Downloaded {} bytes from {} to {}", content.length, url, destination);

            outputs.put("success", true);
            outputs.put("destination", destination.toString());
            outputs.put("file_path", destination.toString());
            outputs.put("size", content.length);
        } catch (RestClientException | IOException e) {
            outputs.put("success", false);
            outputs.put("error", e.getMessage());
        }
        return NodeOutcome.next(outputs);
    }

    private static Path resolveDestination(NodeDefinition node, WorkflowRun run, Map<String, Object> inputs) {
        Object savePath = inputs.get("save_path");
        String configured = savePath != null ? String.valueOf(savePath) : NodeConfig.string(node, "destination", null);
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        Path assets = run.getContext().getAssetsDir();
        Path base = assets != null ? assets : Path.of("downloads");
        return base.resolve("downloads").resolve("file_" + System.currentTimeMillis());
    }
}
