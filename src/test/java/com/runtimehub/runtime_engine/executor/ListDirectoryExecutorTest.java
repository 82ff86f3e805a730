package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ListDirectoryExecutorTest {

    @TempDir
    Path dir;

    private final ListDirectoryExecutor executor = new ListDirectoryExecutor();

    @Test
    @SuppressWarnings("unchecked")
    void shouldSeparateFilesFromDirectories() throws Exception {
        Files.writeString(dir.resolve("b.txt"), "bb");
        Files.writeString(dir.resolve("a.csv"), "a");
        Files.createDirectory(dir.resolve("sub"));
        NodeDefinition node = NodeDefinition.of("ls", "List Directory");

        Map<String, Object> out = executor.execute(node, new WorkflowRun("r", List.of(node), List.of()),
                List.of(), Map.of("directory_path", dir.toString())).outputs();

        List<Map<String, Object>> files = (List<Map<String, Object>>) out.get("files");
        assertThat(files).extracting(f -> f.get("name")).containsExactly("a.csv", "b.txt");
        assertThat(files.get(1)).containsEntry("extension", ".txt").containsEntry("size", 2L);
        assertThat((List<?>) out.get("directories")).hasSize(1);
        assertThat(out).containsEntry("total", 3).doesNotContainKey("error");
    }

    @Test
    void shouldReportMissingDirectory() {
        NodeDefinition node = NodeDefinition.of("ls", "List Directory",
                Map.of("path", dir.resolve("absent").toString()));

        Map<String, Object> out = executor.execute(node, new WorkflowRun("r", List.of(node), List.of()),
                List.of(), Map.of()).outputs();

        assertThat(out).containsKey("error").containsEntry("total", 0);
    }
}
