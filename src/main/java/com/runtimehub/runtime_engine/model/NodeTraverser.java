package com.runtimehub.runtime_engine.model;

/**
 * Callback into the graph executor for executors that drive traversal themselves (Loop).
 */
@FunctionalInterface
public interface NodeTraverser {

    void traverse(WorkflowRun run, NodeDefinition node);
}
