package org.flowblocks.workers.session;

/**
 * Opens sessions against one queue provider.
 *
 */
public interface QueueSessionFactory {

	/**
	 * Open a new session for the named queue. The caller owns the returned
	 * session and must close it.
	 * 
	 * @param credential
	 * @param queueName
	 * @return
	 * @throws ConnectivityException When the connection cannot be established.
	 */
	QueueSession open(ConsumerCredential credential, String queueName) throws ConnectivityException;

	/**
	 * The provider behind this factory.
	 * 
	 * @return
	 */
	QueueProvider getProvider();
}
