package io.evitadb.pdftranslator.llm;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wraps a ChatModel with request throttling, token accounting and permanent failure detection.
 *
 * LangChain4j retries transient failures internally. This client adds:
 * - spacing of requests according to the configured requests-per-second limit
 * - detection of permanent failures (authentication, invalid request, etc.)
 * - fast-fail for subsequent calls after a permanent failure
 *
 * Exception handling:
 * - {@link NonRetriableException}: remembered and propagated; the run cannot continue
 * - Other exceptions: propagated as-is; only the current request failed
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final RequestThrottle throttle;
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();
	private final AtomicLong requestCount = new AtomicLong(0);
	private final AtomicLong inputTokenCount = new AtomicLong(0);
	private final AtomicLong outputTokenCount = new AtomicLong(0);

	/**
	 * Creates a client.
	 *
	 * @param model    the underlying chat model
	 * @param throttle limits the request rate
	 */
	public LlmClient(@Nonnull ChatModel model, @Nonnull RequestThrottle throttle) {
		this.model = Objects.requireNonNull(model, "model must not be null");
		this.throttle = Objects.requireNonNull(throttle, "throttle must not be null");
	}

	/**
	 * Sends the messages and returns the text of the model's answer.
	 *
	 * @param messages the messages to send
	 * @return answer text, empty if the model returned no text
	 * @throws NonRetriableException if a permanent failure occurs
	 * @throws LangChain4jException  for other model errors, or when a permanent failure happened before
	 */
	@Nonnull
	public String chat(@Nonnull List<ChatMessage> messages) {
		Objects.requireNonNull(messages, "messages must not be null");

		final NonRetriableException previous = this.failureCause.get();
		if (previous != null) {
			throw new LangChain4jException(
				"LLM client shut down due to previous permanent failure: " + previous.getMessage(), previous
			);
		}

		try {
			this.throttle.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new LangChain4jException("Interrupted while waiting for a request slot", e);
		}

		final ChatResponse response;
		try {
			this.requestCount.incrementAndGet();
			response = this.model.chat(messages);
		} catch (NonRetriableException e) {
			this.failureCause.compareAndSet(null, e);
			throw e;
		}

		final TokenUsage usage = response.tokenUsage();
		if (usage != null) {
			this.inputTokenCount.addAndGet(usage.inputTokenCount() == null ? 0 : usage.inputTokenCount());
			this.outputTokenCount.addAndGet(usage.outputTokenCount() == null ? 0 : usage.outputTokenCount());
		}
		final String text = response.aiMessage() == null ? null : response.aiMessage().text();
		return text == null ? "" : text;
	}

	/**
	 * Checks if a permanent failure has occurred.
	 *
	 * @return true if all further calls fail immediately
	 */
	public boolean hasPermanentFailure() {
		return this.failureCause.get() != null;
	}

	/**
	 * Returns the permanent failure, if any.
	 *
	 * @return the permanent failure or null
	 */
	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}

	/**
	 * Returns the number of requests sent to the model.
	 *
	 * @return request count
	 */
	public long getRequestCount() {
		return this.requestCount.get();
	}

	/**
	 * Returns the total input tokens reported by the model.
	 *
	 * @return input token count
	 */
	public long getInputTokenCount() {
		return this.inputTokenCount.get();
	}

	/**
	 * Returns the total output tokens reported by the model.
	 *
	 * @return output token count
	 */
	public long getOutputTokenCount() {
		return this.outputTokenCount.get();
	}
}
