package org.flowblocks.workers.session;

import org.flowblocks.workers.Clock;
import org.flowblocks.workers.InvalidConfigurationException;

/**
 * The credential a session is opened with. Either a long lived connection
 * string, or a short lived bearer token for a namespace together with the time
 * it expires.
 *
 */
public class ConsumerCredential {

	/**
	 * Token lifetime assumed when the token was issued without an expiry.
	 */
	public static final long DEFAULT_TOKEN_LIFETIME_MS = 60 * 60 * 1000L;

	public enum Type {
		CONNECTION_STRING, ACCESS_TOKEN
	}

	private final Type type;
	private final String connectionString;
	private final String namespace;
	private final String accessToken;
	private final long expiresOnMillis;

	private ConsumerCredential(Type type, String connectionString, String namespace, String accessToken,
			long expiresOnMillis) {
		this.type = type;
		this.connectionString = connectionString;
		this.namespace = namespace;
		this.accessToken = accessToken;
		this.expiresOnMillis = expiresOnMillis;
	}

	/**
	 * 
	 * @param connectionString
	 * @return
	 * @throws InvalidConfigurationException When the connection string is blank.
	 */
	public static ConsumerCredential forConnectionString(String connectionString) {
		if (isBlank(connectionString)) {
			throw new InvalidConfigurationException("Connection string cannot be empty");
		}
		return new ConsumerCredential(Type.CONNECTION_STRING, connectionString, null, null, -1);
	}

	/**
	 * 
	 * @param namespace       Fully qualified namespace, for example
	 *                        my-namespace.servicebus.windows.net
	 * @param accessToken     The bearer token.
	 * @param expiresOnMillis Epoch millis the token expires, or null to assume
	 *                        {@link #DEFAULT_TOKEN_LIFETIME_MS} from now.
	 * @param clock
	 * @return
	 * @throws InvalidConfigurationException When the namespace or token is blank.
	 */
	public static ConsumerCredential forAccessToken(String namespace, String accessToken, Long expiresOnMillis,
			Clock clock) {
		if (isBlank(namespace)) {
			throw new InvalidConfigurationException("Namespace cannot be empty");
		}
		if (isBlank(accessToken)) {
			throw new InvalidConfigurationException("Access token cannot be empty");
		}
		long expiry = expiresOnMillis != null ? expiresOnMillis
				: clock.currentTimeMillis() + DEFAULT_TOKEN_LIFETIME_MS;
		return new ConsumerCredential(Type.ACCESS_TOKEN, null, namespace, accessToken, expiry);
	}

	public Type getType() {
		return type;
	}

	public String getConnectionString() {
		return connectionString;
	}

	public String getNamespace() {
		return namespace;
	}

	public String getAccessToken() {
		return accessToken;
	}

	/**
	 * Epoch millis the access token expires. -1 for connection strings.
	 * 
	 * @return
	 */
	public long getExpiresOnMillis() {
		return expiresOnMillis;
	}

	@Override
	public String toString() {
		if (type == Type.CONNECTION_STRING) {
			return "ConsumerCredential [type=" + type + "]";
		}
		return "ConsumerCredential [type=" + type + ", namespace=" + namespace + ", expiresOnMillis="
				+ expiresOnMillis + "]";
	}

	private static boolean isBlank(String value) {
		return value == null || value.trim().isEmpty();
	}
}
