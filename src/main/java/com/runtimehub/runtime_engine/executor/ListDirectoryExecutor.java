package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Component
public class ListDirectoryExecutor implements NodeExecutor {

    @Override
    public String supportedType() {
        return "List Directory";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        Object fromInput = inputs.get("directory_path");
        String dirPath = fromInput != null ? String.valueOf(fromInput) : NodeConfig.string(node, "path", ".");

        List<Map<String, Object>> files = new ArrayList<>();
        List<Map<String, Object>> directories = new ArrayList<>();
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("path", dirPath);

        try (Stream<Path> entries = Files.list(Path.of(dirPath))) {
            for (Path entry : entries.sorted(Comparator.comparing(Path::getFileName)).toList()) {
                BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class);
                String name = entry.getFileName().toString();
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("name", name);
                item.put("path", entry.toString());
                item.put("size", attrs.size());
                item.put("modified", attrs.lastModifiedTime().toInstant().toString());
                if (attrs.isDirectory()) {
                    directories.add(item);
                } else {
                    int dot = name.lastIndexOf('.');
                    item.put("extension", dot > 0 ? name.substring(dot) : "");
                    files.add(item);
                }
            }
        } catch (IOException e) {
            outputs.put("error", e.getMessage());
            files.clear();
            directories.clear();
        }

        outputs.put("files", files);
        outputs.put("directories", directories);
        outputs.put("total", files.size() + directories.size());
        return NodeOutcome.next(outputs);
    }
}
