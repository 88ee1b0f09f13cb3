package org.flowblocks.workers.poll;

/**
 * Why a poll cycle or probe failed.
 *
 */
public enum ErrorKind {

	/**
	 * Missing or invalid queue name, credential or numeric setting. Not retried
	 * automatically.
	 */
	CONFIGURATION,
	/**
	 * Transport or authentication failure opening a session or receiving.
	 */
	CONNECTIVITY,
	/**
	 * The provider rejected the completion of a message.
	 */
	ACKNOWLEDGMENT
}
