package org.javai.dygram.exec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.FutureTask;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Asks a chat model for the next tool through Spring AI's {@link ChatClient}.
 * <p>
 * The tools are listed in the user message and the model answers with a JSON object
 * {@code {"tool": "...", "input": {...}, "reasoning": "..."}}, optionally inside a markdown
 * code block. A {@code null} tool means the model chose to stop. Cancelling the returned
 * stage interrupts the thread running the model call.
 */
public class ChatClientDecisionMaker implements DecisionMaker {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientDecisionMaker.class);
	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	static final String RESPONSE_INSTRUCTIONS = """
			Respond with a single JSON object and nothing else:
			{"tool": "<tool name>", "input": { ... }, "reasoning": "<one sentence>"}
			Use only the tool names listed above and inputs that match their schema.
			If no tool should be used, respond with {"tool": null, "reasoning": "<why>"}.""";

	private final ChatClient chatClient;
	private final Executor executor;

	public ChatClientDecisionMaker(ChatClient chatClient) {
		this(chatClient, ForkJoinPool.commonPool());
	}

	public ChatClientDecisionMaker(ChatClient chatClient, Executor executor) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
	}

	@Override
	public CompletionStage<DecisionResponse> decide(DecisionRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		CompletableFuture<DecisionResponse> result = new CompletableFuture<>();
		FutureTask<Void> task = new FutureTask<>(() -> {
			try {
				result.complete(parse(invokeModel(request)));
			} catch (Throwable e) {
				result.completeExceptionally(e);
			}
		}, null);
		result.whenComplete((response, failure) -> {
			if (result.isCancelled()) {
				task.cancel(true);
			}
		});
		executor.execute(task);
		return result;
	}

	private String invokeModel(DecisionRequest request) {
		String user = userMessage(request);
		logger.debug("System message:\n{}", request.systemPrompt());
		logger.debug("User message:\n{}", user);
		String content = chatClient.prompt()
				.system(request.systemPrompt())
				.user(user)
				.call()
				.content();
		logger.debug("LLM response:\n{}", content);
		return content;
	}

	String userMessage(DecisionRequest request) {
		ArrayNode tools = JSON_MAPPER.createArrayNode();
		for (ToolDefinition definition : request.tools()) {
			ObjectNode tool = tools.addObject();
			tool.put("name", definition.name());
			tool.put("description", definition.description());
			tool.set("input_schema", definition.inputSchema());
		}
		StringBuilder sb = new StringBuilder();
		sb.append("Available tools:\n").append(tools.toPrettyString()).append("\n\n");
		if (!request.context().isEmpty()) {
			sb.append("Context:\n").append(JSON_MAPPER.valueToTree(request.context()).toPrettyString()).append("\n\n");
		}
		sb.append(RESPONSE_INSTRUCTIONS);
		return sb.toString();
	}

	DecisionResponse parse(String response) {
		if (response == null || response.isBlank()) {
			throw new DecisionException("LLM returned an empty response");
		}
		String json = extractJsonContent(response)
				.orElseThrow(() -> new DecisionException("LLM response does not contain a JSON object"));
		JsonNode node;
		try {
			node = JSON_MAPPER.readTree(json);
		} catch (JsonProcessingException e) {
			throw new DecisionException("Failed to parse LLM decision: " + e.getOriginalMessage(), e);
		}
		String reasoning = node.hasNonNull("reasoning") ? node.get("reasoning").asText() : null;
		JsonNode tool = node.get("tool");
		if (tool == null || tool.isNull() || tool.asText().isBlank()) {
			return new DecisionResponse(reasoning, List.of(new DecisionResponse.Text(
					reasoning == null ? "" : reasoning)), DecisionResponse.STOP_END_TURN);
		}
		JsonNode input = node.get("input");
		return DecisionResponse.toolUse(tool.asText(), input instanceof ObjectNode object ? object : null, reasoning);
	}

	private Optional<String> extractJsonContent(String response) {
		String trimmed = response.trim();
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(trimmed);
		if (matcher.find()) {
			return Optional.of(matcher.group(1).trim());
		}
		if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
			return Optional.of(trimmed);
		}
		return Optional.empty();
	}
}
