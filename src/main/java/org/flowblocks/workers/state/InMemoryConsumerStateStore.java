package org.flowblocks.workers.state;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link ConsumerStateStore} that lives only as long as the worker process.
 *
 */
public class InMemoryConsumerStateStore implements ConsumerStateStore {

	private final Map<String, String> values = new ConcurrentHashMap<>();

	@Override
	public String get(String key) {
		return values.get(key);
	}

	@Override
	public void set(String key, String value) {
		if (value == null) {
			values.remove(key);
		} else {
			values.put(key, value);
		}
	}

	@Override
	public void deleteAll(Collection<String> keys) {
		for (String key : keys) {
			values.remove(key);
		}
	}
}
