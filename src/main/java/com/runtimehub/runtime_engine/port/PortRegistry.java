package com.runtimehub.runtime_engine.port;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Port names per node type. Built-in types are seeded at construction; plugins add
 * their own through {@link #register(String, PortMap)}.
 */
@Slf4j
@Component
public class PortRegistry {

    /** Output ports that signal control flow only and never carry data downstream. */
    public static final Set<String> CONTROL_FLOW_OUTPUT_PORTS =
            Set.of("main", "item", "loop_complete", "completed", "shown", "logged", "sent");

    private final Map<String, PortMap> ports = new LinkedHashMap<>();

    public PortRegistry() {
        seed("Start", List.of(), List.of("main"));
        seed("End", List.of("main"), List.of());
        seed("Condition", List.of("condition", "true_path", "false_path"), List.of("true", "false"));
        seed("Loop", List.of("input", "loop_body"), List.of("item", "loop_complete"));
        seed("Delay", List.of("duration"), List.of("completed"));
        seed("Wait", List.of("duration"), List.of("completed"));
        seed("Execute Python", List.of("code", "args"), List.of("result", "error"));
        seed("List Directory", List.of("directory_path"), List.of("files", "directories", "error"));
        seed("HTTP Request", List.of("url", "method", "body"), List.of("response", "status_code", "error"));
        seed("Download File", List.of("url", "save_path"), List.of("file_path", "size", "error"));
        seed("Transform JSON", List.of("data", "transformation"), List.of("result", "error"));
        seed("Parse Text", List.of("text", "pattern"), List.of("matches", "error"));
        seed("SQL Query", List.of("query", "parameters"), List.of("results", "error"));
        seed("Show Message", List.of("title", "message"), List.of("shown", "error"));
        seed("Write Log", List.of("level", "message"), List.of("logged", "error"));
        seed("Encrypt Data", List.of("data", "key"), List.of("encrypted", "error"));
    }

    private void seed(String type, List<String> inputs, List<String> outputs) {
        ports.put(type, PortMap.of(inputs, outputs));
    }

    /** Ports for the type, or null when the type is unknown. */
    public synchronized PortMap portsFor(String type) {
        return ports.get(type);
    }

    /**
     * Adds ports for a new type. An existing entry is kept.
     *
     * @return true when the entry was added
     */
    public synchronized boolean register(String type, PortMap portMap) {
        if (ports.containsKey(type)) {
            log.warn("Port map for node type '{}' already registered, keeping the existing one", type);
            return false;
        }
        ports.put(type, portMap);
        return true;
    }

    public String inputName(String type, int index) {
        PortMap map = portsFor(type);
        return map != null ? map.inputName(index) : "input_" + index;
    }

    public String outputName(String type, int index) {
        PortMap map = portsFor(type);
        return map != null ? map.outputName(index) : "output_" + index;
    }

    public static boolean isControlFlowOutput(String port) {
        return CONTROL_FLOW_OUTPUT_PORTS.contains(port);
    }

    public synchronized Map<String, PortMap> all() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(ports));
    }
}
