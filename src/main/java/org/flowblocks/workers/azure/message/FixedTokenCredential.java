package org.flowblocks.workers.azure.message;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenCredential;
import com.azure.core.credential.TokenRequestContext;

import reactor.core.publisher.Mono;

/**
 * A TokenCredential that always hands out a single pre-fetched access token.
 * The token is not refreshed. Once it expires the provider rejects the
 * connection and the block's next probe reports the failure.
 *
 */
public class FixedTokenCredential implements TokenCredential {

	private final AccessToken accessToken;

	/**
	 * @param token           The bearer token.
	 * @param expiresOnMillis Epoch millis the token expires.
	 */
	public FixedTokenCredential(String token, long expiresOnMillis) {
		if (token == null) {
			throw new IllegalArgumentException("Token cannot be null");
		}
		this.accessToken = new AccessToken(token,
				OffsetDateTime.ofInstant(Instant.ofEpochMilli(expiresOnMillis), ZoneOffset.UTC));
	}

	@Override
	public Mono<AccessToken> getToken(TokenRequestContext request) {
		return Mono.just(accessToken);
	}

}
