package com.runtimehub.runtime_engine.executor;

import com.runtimehub.runtime_engine.model.Connection;
import com.runtimehub.runtime_engine.model.NodeDefinition;
import com.runtimehub.runtime_engine.model.WorkflowRun;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only SQL against {@code config.jdbcUrl}, or the SQLite file at {@code config.dbPath}.
 * Only SELECT, PRAGMA and WITH statements are accepted.
 */
@Slf4j
@Component
public class SqlQueryExecutor implements NodeExecutor {

    static final String DEFAULT_DB_PATH = "data/runtime_monitor.db";
    private static final List<String> READ_ONLY_PREFIXES = List.of("SELECT", "PRAGMA", "WITH");

    @Override
    public String supportedType() {
        return "SQL Query";
    }

    @Override
    public NodeOutcome execute(NodeDefinition node, WorkflowRun run, List<Connection> connections,
                               Map<String, Object> inputs) {
        String query = NodeConfig.string(node, inputs, "query", "").trim();
        Map<String, Object> outputs = new LinkedHashMap<>();
        outputs.put("query", query);

        if (query.isEmpty()) {
            return failed(outputs, "No SQL query provided");
        }
        String head = query.toUpperCase(Locale.ROOT);
        if (READ_ONLY_PREFIXES.stream().noneMatch(head::startsWith)) {
            return failed(outputs, "Only SELECT queries allowed in SQL Query node");
        }

        String jdbcUrl = NodeConfig.string(node, "jdbcUrl", null);
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            jdbcUrl = "jdbc:sqlite:" + NodeConfig.string(node, "dbPath", DEFAULT_DB_PATH);
        }

        try {
            JdbcTemplate jdbc = new JdbcTemplate(new DriverManagerDataSource(jdbcUrl));
            List<Map<String, Object>> rows = jdbc.queryForList(query, parameters(node, inputs));
            outputs.put("success", true);
            outputs.put("rows", rows);
            outputs.put("results", rows);
            outputs.put("count", rows.size());
        } catch (DataAccessException e) {
            log.warn("SQL query from node {} failed: {}", node.id(), e.getMessage());
            return failed(outputs, e.getMostSpecificCause().getMessage());
        }
        return NodeOutcome.next(outputs);
    }

    private static Object[] parameters(NodeDefinition node, Map<String, Object> inputs) {
        Object raw = NodeConfig.value(node, inputs, "parameters");
        if (raw instanceof List<?> list) {
            return list.toArray();
        }
        return raw != null ? new Object[] {raw} : new Object[0];
    }

    private static NodeOutcome failed(Map<String, Object> outputs, String error) {
        outputs.put("success", false);
        outputs.put("error", error);
        return NodeOutcome.next(outputs);
    }
}
