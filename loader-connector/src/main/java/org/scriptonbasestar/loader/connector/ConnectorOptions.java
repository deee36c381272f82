package org.scriptonbasestar.loader.connector;

import java.time.Duration;

/**
 * 커넥터 생성/호출 옵션
 *
 * <ul>
 *   <li>connectTimeout - 원격 연결 제한 시간 (기본 1초)</li>
 *   <li>replyTimeout - 응답 대기 제한 시간 (기본 2초)</li>
 *   <li>acquireTimeout - 내부 커넥터 핸들 대기 시간 (기본 2초)</li>
 *   <li>internalCapacity - 내부 커넥터 동시 핸들 수 (기본 1)</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
public final class ConnectorOptions {

	private static final ConnectorOptions DEFAULTS = builder().build();

	private final Duration connectTimeout;
	private final Duration replyTimeout;
	private final Duration acquireTimeout;
	private final int internalCapacity;

	private ConnectorOptions(Builder builder) {
		this.connectTimeout = builder.connectTimeout;
		this.replyTimeout = builder.replyTimeout;
		this.acquireTimeout = builder.acquireTimeout;
		this.internalCapacity = builder.internalCapacity;
	}

	public static ConnectorOptions defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public Duration getReplyTimeout() {
		return replyTimeout;
	}

	public Duration getAcquireTimeout() {
		return acquireTimeout;
	}

	public int getInternalCapacity() {
		return internalCapacity;
	}

	@Override
	public String toString() {
		return "ConnectorOptions{connectTimeout=" + connectTimeout + ", replyTimeout=" + replyTimeout
			+ ", acquireTimeout=" + acquireTimeout + ", internalCapacity=" + internalCapacity + '}';
	}

	public static class Builder {
		private Duration connectTimeout = Duration.ofSeconds(1);
		private Duration replyTimeout = Duration.ofSeconds(2);
		private Duration acquireTimeout = Duration.ofSeconds(2);
		private int internalCapacity = 1;

		public Builder connectTimeout(Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder replyTimeout(Duration replyTimeout) {
			this.replyTimeout = replyTimeout;
			return this;
		}

		public Builder acquireTimeout(Duration acquireTimeout) {
			this.acquireTimeout = acquireTimeout;
			return this;
		}

		public Builder internalCapacity(int internalCapacity) {
			this.internalCapacity = internalCapacity;
			return this;
		}

		public ConnectorOptions build() {
			requirePositive("connectTimeout", connectTimeout);
			requirePositive("replyTimeout", replyTimeout);
			requirePositive("acquireTimeout", acquireTimeout);
			if (internalCapacity < 1) {
				throw new IllegalArgumentException("internalCapacity must be at least 1: " + internalCapacity);
			}
			return new ConnectorOptions(this);
		}

		private static void requirePositive(String name, Duration value) {
			if (value == null || value.isNegative() || value.isZero()) {
				throw new IllegalArgumentException(name + " must be positive: " + value);
			}
		}
	}
}
