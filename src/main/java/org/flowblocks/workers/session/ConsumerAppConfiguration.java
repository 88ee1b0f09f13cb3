package org.flowblocks.workers.session;

import org.flowblocks.workers.Clock;
import org.flowblocks.workers.InvalidConfigurationException;

/**
 * Application wide connection settings shared by every block.
 * <p>
 * When a connection string is set it is used. Otherwise the namespace and
 * access token are required.
 *
 */
public class ConsumerAppConfiguration {

	String namespace;
	String accessToken;
	Long accessTokenExpiry;
	String connectionString;

	/**
	 * Fully qualified namespace, for example my-namespace.servicebus.windows.net
	 * 
	 * @return
	 */
	public String getNamespace() {
		return namespace;
	}

	public void setNamespace(String namespace) {
		this.namespace = namespace;
	}

	/**
	 * Access token with scope https://servicebus.azure.net/.default
	 * 
	 * @return
	 */
	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(String accessToken) {
		this.accessToken = accessToken;
	}

	/**
	 * Optional epoch millis when the access token expires.
	 * 
	 * @return
	 */
	public Long getAccessTokenExpiry() {
		return accessTokenExpiry;
	}

	public void setAccessTokenExpiry(Long accessTokenExpiry) {
		this.accessTokenExpiry = accessTokenExpiry;
	}

	/**
	 * Optional connection string. Takes precedence over the token settings.
	 * 
	 * @return
	 */
	public String getConnectionString() {
		return connectionString;
	}

	public void setConnectionString(String connectionString) {
		this.connectionString = connectionString;
	}

	/**
	 * Build the credential described by this configuration.
	 * 
	 * @param clock Used to compute the default token expiry.
	 * @return
	 * @throws InvalidConfigurationException
	 */
	public ConsumerCredential toCredential(Clock clock) {
		if (connectionString != null && !connectionString.trim().isEmpty()) {
			return ConsumerCredential.forConnectionString(connectionString);
		}
		return ConsumerCredential.forAccessToken(namespace, accessToken, accessTokenExpiry, clock);
	}
}
