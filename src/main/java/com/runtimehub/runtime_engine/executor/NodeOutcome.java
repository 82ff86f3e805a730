package com.runtimehub.runtime_engine.executor;

import java.util.Map;

/**
 * What an executor produced and how traversal continues from the node.
 */
public sealed interface NodeOutcome permits NodeOutcome.Continue, NodeOutcome.Branch, NodeOutcome.Handled {

    Map<String, Object> outputs();

    static NodeOutcome next(Map<String, Object> outputs) {
        return new Continue(outputs);
    }

    static NodeOutcome branch(String port, Map<String, Object> outputs) {
        return new Branch(port, outputs);
    }

    static NodeOutcome handled(Map<String, Object> outputs) {
        return new Handled(outputs);
    }

    /** Traverse every outgoing connection. */
    record Continue(Map<String, Object> outputs) implements NodeOutcome {
        public Continue {
            outputs = outputs != null ? outputs : Map.of();
        }
    }

    /** Traverse only connections leaving the named output port. */
    record Branch(String port, Map<String, Object> outputs) implements NodeOutcome {
        public Branch {
            outputs = outputs != null ? outputs : Map.of();
        }
    }

    /** The executor already continued the graph itself. */
    record Handled(Map<String, Object> outputs) implements NodeOutcome {
        public Handled {
            outputs = outputs != null ? outputs : Map.of();
        }
    }
}
