package org.scriptonbasestar.loader.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Time window in which a profile is active. Either bound may be {@code null} (open).
 *
 * @author archmagece
 * @since 2025-03
 */
public final class ActivationInterval {

	private final Instant activationTime;
	private final Instant expiryTime;

	public ActivationInterval(Instant activationTime, Instant expiryTime) {
		if (activationTime != null && expiryTime != null && expiryTime.isBefore(activationTime)) {
			throw new IllegalArgumentException("expiryTime before activationTime");
		}
		this.activationTime = activationTime;
		this.expiryTime = expiryTime;
	}

	public Instant getActivationTime() {
		return activationTime;
	}

	public Instant getExpiryTime() {
		return expiryTime;
	}

	public boolean isActiveAt(Instant time) {
		if (activationTime != null && time.isBefore(activationTime)) {
			return false;
		}
		return expiryTime == null || time.isBefore(expiryTime);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ActivationInterval)) {
			return false;
		}
		ActivationInterval other = (ActivationInterval) o;
		return Objects.equals(activationTime, other.activationTime)
			&& Objects.equals(expiryTime, other.expiryTime);
	}

	@Override
	public int hashCode() {
		return Objects.hash(activationTime, expiryTime);
	}

	@Override
	public String toString() {
		return "ActivationInterval{" + activationTime + " -> " + expiryTime + '}';
	}
}
