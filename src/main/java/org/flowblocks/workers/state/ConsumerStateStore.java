package org.flowblocks.workers.state;

import java.util.Collection;

/**
 * A minimal durable key-value store scoped to one block instance. Writes are
 * last-write-wins.
 *
 */
public interface ConsumerStateStore {

	/**
	 * @param key
	 * @return The stored value or null.
	 */
	String get(String key);

	void set(String key, String value);

	/**
	 * Remove every listed key. Missing keys are ignored.
	 * 
	 * @param keys
	 */
	void deleteAll(Collection<String> keys);
}
