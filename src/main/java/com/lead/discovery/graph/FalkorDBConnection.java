package com.lead.discovery.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link GraphConnection} over the JFalkorDB client.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String processed = processParams(query, params);
        log.debug("falkordb.execute query={}", processed);
        graph.query(processed);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String processed = processParams(query, params);
        log.debug("falkordb.query query={}", processed);

        ResultSet resultSet = graph.query(processed);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        log.debug("falkordb.query rows={}", rows.size());
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("falkordb.ping failed graph={}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("falkordb.indexes creating graph={}", graphName);
        safeExecute("CREATE INDEX FOR (i:Identifier) ON (i.id)");
        safeExecute("CREATE INDEX FOR (i:Identifier) ON (i.hash)");
        safeExecute("CREATE INDEX FOR (i:Identifier) ON (i.profileId)");
        safeExecute("CREATE INDEX FOR (p:Profile) ON (p.id)");
        safeExecute("CREATE INDEX FOR (p:Profile) ON (p.profileHash)");
        safeExecute("CREATE INDEX FOR (l:Lead) ON (l.id)");
        safeExecute("CREATE INDEX FOR (l:Lead) ON (l.profileId)");
        safeExecute("CREATE INDEX FOR (m:Match) ON (m.leadId)");
        safeExecute("CREATE INDEX FOR (m:Match) ON (m.serviceId)");
        safeExecute("CREATE INDEX FOR (a:Alert) ON (a.id)");
        safeExecute("CREATE INDEX FOR (a:Alert) ON (a.status)");
        log.info("falkordb.indexes done graph={}", graphName);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // index may already exist
            log.debug("falkordb.index query={} result={}", query, e.getMessage());
        }
    }

    /**
     * Substitutes {@code $param} placeholders with Cypher literals. Longer names are
     * replaced first so {@code $id} never clobbers {@code $identifierId}.
     */
    String processParams(String query, Map<String, Object> params) {
        String result = query;
        List<Map.Entry<String, Object>> ordered = params.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Object> e) -> e.getKey().length()).reversed())
                .toList();
        for (Map.Entry<String, Object> entry : ordered) {
            result = result.replace("$" + entry.getKey(), formatValue(entry.getValue()));
        }
        return result;
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> values) {
            return values.stream()
                    .map(FalkorDBConnection::formatValue)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return quote(value.toString());
    }

    private static String quote(String raw) {
        return "'" + raw.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.close failed graph={}", graphName, e);
        }
        log.info("falkordb.closed graph={}", graphName);
    }
}
