package org.javai.dygram.exec;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed set of tools that read the context store or edit the runtime graph.
 */
public enum MetaTool {
	ADD_NODE("add_node", "Add a node to the running machine"),
	REMOVE_NODE("remove_node", "Remove a node, its children and their edges from the running machine"),
	MODIFY_EDGE("modify_edge", "Add, remove or retarget an edge of the running machine"),
	GET_CONTEXT_VALUE("get_context_value", "Read a value, or all values, of a context node"),
	SET_CONTEXT_VALUE("set_context_value", "Write one or more values of a context node; all values are applied or none"),
	LIST_CONTEXT_NODES("list_context_nodes", "List the accessible context nodes and their current values");

	private final String toolName;
	private final String description;

	MetaTool(String toolName, String description) {
		this.toolName = toolName;
		this.description = description;
	}

	public String toolName() {
		return toolName;
	}

	public String description() {
		return description;
	}

	public boolean modifiesGraph() {
		return this == ADD_NODE || this == REMOVE_NODE || this == MODIFY_EDGE;
	}

	public static Optional<MetaTool> fromToolName(String name) {
		return Arrays.stream(values()).filter(t -> t.toolName.equals(name)).findFirst();
	}
}
