package org.javai.dygram.exec;

import org.javai.dygram.model.NodeId;

/**
 * What invoking a tool does.
 */
public sealed interface ToolBinding {

	/**
	 * Move to {@code target}.
	 */
	record Transition(NodeId target, String targetPath) implements ToolBinding {
	}

	record Meta(MetaTool tool) implements ToolBinding {
	}
}
