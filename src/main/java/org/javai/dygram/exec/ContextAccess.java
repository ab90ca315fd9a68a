package org.javai.dygram.exec;

import java.util.List;
import java.util.Set;

/**
 * Context nodes the current node may read and write. {@code unrestricted} grants access to
 * every node of the running machine.
 */
public record ContextAccess(boolean unrestricted, Set<String> readable, Set<String> writable) {

	public static final ContextAccess NONE = new ContextAccess(false, Set.of(), Set.of());

	public ContextAccess {
		readable = Set.copyOf(readable);
		writable = Set.copyOf(writable);
	}

	public static ContextAccess unrestrictedAccess() {
		return new ContextAccess(true, Set.of(), Set.of());
	}

	public boolean canRead(String nodePath) {
		return unrestricted || readable.contains(nodePath) || writable.contains(nodePath);
	}

	public boolean canWrite(String nodePath) {
		return unrestricted || writable.contains(nodePath);
	}

	public boolean hasRead() {
		return unrestricted || !readable.isEmpty() || !writable.isEmpty();
	}

	public boolean hasWrite() {
		return unrestricted || !writable.isEmpty();
	}

	public List<String> readableSorted() {
		return readable.stream().sorted().toList();
	}

	public List<String> writableSorted() {
		return writable.stream().sorted().toList();
	}
}
