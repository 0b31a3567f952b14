package com.lead.discovery.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph store that acts as the system of record.
 * Queries are Cypher with {@code $name} parameters.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Runs a Cypher statement that modifies the graph.
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Runs a Cypher query and returns one map per result row, keyed by column alias.
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes lead discovery relies on. Safe to call repeatedly.
     */
    void createIndexes();

    @Override
    void close();
}
