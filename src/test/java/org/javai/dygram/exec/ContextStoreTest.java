package org.javai.dygram.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.dygram.build.MachineCompiler;
import org.javai.dygram.model.AttributeValue;
import org.junit.jupiter.api.Test;

class ContextStoreTest {

	private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

	private final ContextStore store = ContextStore.seededFrom(RuntimeGraph.of(new MachineCompiler().compile("""
			init start;
			Data {
			    context settings { retries<integer>: 1; mode: "fast"; }
			}
			state other { retries: 9; }
			start -> other;
			""").machine()));

	@Test
	void seedsOnlyContextNodesByQualifiedPath() {
		assertThat(store.nodes()).containsExactly("Data.settings");
		assertThat(store.get("Data.settings", "retries")).contains(AttributeValue.number(1));
		assertThat(store.declaredType("Data.settings", "retries")).contains("integer");
		assertThat(store.get("other", "retries")).isEmpty();
	}

	@Test
	void writeKeepsDeclaredTypeAndAddsNewAttributes() {
		Map<String, JsonNode> updates = new LinkedHashMap<>();
		updates.put("retries", NODES.textNode("3"));
		updates.put("owner", NODES.textNode("ops"));

		store.writeAll("Data.settings", updates);

		assertThat(store.get("Data.settings", "retries")).contains(AttributeValue.number(3));
		assertThat(store.declaredType("Data.settings", "retries")).contains("integer");
		assertThat(store.get("Data.settings", "owner")).contains(AttributeValue.text("ops"));
		assertThat(store.asMap().get("Data.settings")).containsEntry("retries", new BigDecimal("3"));
	}

	@Test
	void failedWriteChangesNothing() {
		Map<String, JsonNode> updates = new LinkedHashMap<>();
		updates.put("mode", NODES.textNode("slow"));
		updates.put("retries", NODES.textNode("often"));

		assertThatThrownBy(() -> store.writeAll("Data.settings", updates))
				.isInstanceOf(ToolInvocationException.class)
				.hasMessageContaining("Rejected write to 'Data.settings'")
				.hasMessageContaining("retries");
		assertThat(store.get("Data.settings", "mode")).contains(AttributeValue.text("fast"));
	}

	@Test
	void emptyWriteIsRejected() {
		assertThatThrownBy(() -> store.writeAll("Data.settings", Map.of()))
				.isInstanceOf(ToolInvocationException.class);
	}

	@Test
	void snapshotIsIndependent() {
		ContextStore snapshot = store.snapshot();

		store.writeAll("Data.settings", Map.of("mode", NODES.textNode("slow")));

		assertThat(snapshot.get("Data.settings", "mode")).contains(AttributeValue.text("fast"));
		assertThat(store.get("Data.settings", "mode")).contains(AttributeValue.text("slow"));
	}
}
