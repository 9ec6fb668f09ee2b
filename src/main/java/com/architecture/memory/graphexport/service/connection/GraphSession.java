package com.architecture.memory.graphexport.service.connection;

import com.architecture.memory.graphexport.model.graph.CodeNode;

import java.util.Collection;

/**
 * A live, authenticated handle to the graph database.
 */
public interface GraphSession extends AutoCloseable {

    /**
     * Removes every node and relationship from the database. Irreversible.
     */
    void purgeDatabase();

    /**
     * Opens the transaction that subsequent {@link #save} calls write into.
     *
     * @throws IllegalStateException if a transaction is already open
     */
    GraphTransaction beginTransaction();

    /**
     * Writes the given nodes and the relationships found within {@code depth} hops of them.
     *
     * @param nodes nodes to write, each one as a node record
     * @param depth relationship hops to follow from every node, -1 for no limit
     * @throws IllegalStateException if no transaction is open
     */
    void save(Collection<CodeNode> nodes, int depth);

    /**
     * Forgets which nodes this session has already written.
     */
    void clear();

    @Override
    void close();
}
