package org.flowblocks.workers.azure.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.azure.core.credential.AccessToken;
import com.azure.core.credential.TokenRequestContext;

public class FixedTokenCredentialTest {

	@Test
	public void testGetToken() {
		FixedTokenCredential credential = new FixedTokenCredential("bearer", 1737981296789L);
		// call under test
		AccessToken token = credential
				.getToken(new TokenRequestContext().addScopes("https://servicebus.azure.net/.default")).block();
		assertEquals("bearer", token.getToken());
		assertEquals(1737981296789L, token.getExpiresAt().toInstant().toEpochMilli());
	}

	@Test
	public void testSameTokenEveryTime() {
		FixedTokenCredential credential = new FixedTokenCredential("bearer", 1000L);
		AccessToken first = credential.getToken(new TokenRequestContext()).block();
		AccessToken second = credential.getToken(new TokenRequestContext()).block();
		assertEquals(first.getToken(), second.getToken());
		assertEquals(first.getExpiresAt(), second.getExpiresAt());
	}

	@Test
	public void testNullToken() {
		assertThrows(IllegalArgumentException.class, () -> new FixedTokenCredential(null, 1000L));
	}
}
