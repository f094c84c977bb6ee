package io.evitadb.pdftranslator;

import io.evitadb.pdftranslator.event.EventStream;
import io.evitadb.pdftranslator.event.TranslationEvent;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event stream replaying a fixed script. A {@link RuntimeException} in the script is thrown from
 * {@code hasNext()} when reached, null entries are delivered as empty placeholders.
 */
class ScriptedEventStream implements EventStream {
	private final List<Object> script;
	private final AtomicInteger closeCount = new AtomicInteger();
	private int position;
	private int delivered;

	ScriptedEventStream(Object... script) {
		this.script = Arrays.asList(script);
	}

	@Override
	public boolean isReady() {
		return true;
	}

	@Override
	public boolean hasNext() {
		if (position >= script.size()) {
			return false;
		}
		final Object item = script.get(position);
		if (item instanceof RuntimeException) {
			position++;
			throw (RuntimeException) item;
		}
		return true;
	}

	@Override
	public TranslationEvent next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		delivered++;
		return (TranslationEvent) script.get(position++);
	}

	@Override
	public void close() {
		closeCount.incrementAndGet();
	}

	int getCloseCount() { return closeCount.get(); }
	int getDelivered() { return delivered; }
}
