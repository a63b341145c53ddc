package org.springaicommunity.shopify.connector;

import java.time.Duration;

/**
 * Blocks the calling thread. Abstracted so tests can record waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Block for the given duration.
	 * @param duration how long to wait
	 * @throws ShopifyApiException if the thread is interrupted while waiting
	 */
	void sleep(Duration duration);

	/**
	 * Returns a sleeper backed by {@link Thread#sleep(long)}.
	 * @return the default sleeper
	 */
	static Sleeper threadSleeper() {
		return duration -> {
			try {
				Thread.sleep(duration.toMillis());
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new ShopifyApiException("Interrupted while waiting between requests", e);
			}
		};
	}

}
