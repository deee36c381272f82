package org.scriptonbasestar.loader.engine.report;

import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.engine.processor.BatchState;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one batch, handed to every {@link BatchListener}.
 * <p>
 * A failed batch names the state it failed in and, when known, the key being processed.
 * A failure in {@link BatchState#CACHE_NOTIFIED} means the store already holds the change
 * while the cache tier was not told about it.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public final class BatchReport {

	private final String loaderId;
	private final BatchOperation operation;
	private final ProfileType profileType;
	private final String cacheAction;
	private final List<String> cacheConns;
	private final int records;
	private final BatchState failedState;
	private final TenantID failedKey;
	private final RuntimeException failure;
	private final Duration duration;

	private BatchReport(Builder builder) {
		this.loaderId = builder.loaderId;
		this.operation = builder.operation;
		this.profileType = builder.profileType;
		this.cacheAction = builder.cacheAction;
		this.cacheConns = builder.cacheConns == null ? List.of() : List.copyOf(builder.cacheConns);
		this.records = builder.records;
		this.failedState = builder.failedState;
		this.failedKey = builder.failedKey;
		this.failure = builder.failure;
		this.duration = builder.duration == null ? Duration.ZERO : builder.duration;
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isSuccess() {
		return failure == null;
	}

	/**
	 * @return true when the store holds a change the cache tier was not notified about
	 */
	public boolean isCacheOutOfSync() {
		return failedState == BatchState.CACHE_NOTIFIED;
	}

	public boolean isUnsupportedServiceMethod() {
		return failure instanceof UnsupportedServiceMethodException;
	}

	public String getLoaderId() {
		return loaderId;
	}

	public BatchOperation getOperation() {
		return operation;
	}

	public ProfileType getProfileType() {
		return profileType;
	}

	public String getCacheAction() {
		return cacheAction;
	}

	public List<String> getCacheConns() {
		return cacheConns;
	}

	/**
	 * @return records fully processed, cache notification included
	 */
	public int getRecords() {
		return records;
	}

	public BatchState getFailedState() {
		return failedState;
	}

	public TenantID getFailedKey() {
		return failedKey;
	}

	public RuntimeException getFailure() {
		return failure;
	}

	public Duration getDuration() {
		return duration;
	}

	@Override
	public String toString() {
		return "BatchReport{" + loaderId + ' ' + operation.getTag() + ' ' + profileType + ' ' + cacheAction
			+ ", records=" + records
			+ (isSuccess() ? "" : ", failedState=" + failedState + ", failedKey=" + failedKey + ", failure=" + failure)
			+ ", duration=" + duration + '}';
	}

	public static class Builder {
		private String loaderId;
		private BatchOperation operation;
		private ProfileType profileType;
		private String cacheAction;
		private List<String> cacheConns;
		private int records;
		private BatchState failedState;
		private TenantID failedKey;
		private RuntimeException failure;
		private Duration duration;

		public Builder loaderId(String loaderId) {
			this.loaderId = loaderId;
			return this;
		}

		public Builder operation(BatchOperation operation) {
			this.operation = operation;
			return this;
		}

		public Builder profileType(ProfileType profileType) {
			this.profileType = profileType;
			return this;
		}

		public Builder cacheAction(String cacheAction) {
			this.cacheAction = cacheAction;
			return this;
		}

		public Builder cacheConns(List<String> cacheConns) {
			this.cacheConns = cacheConns;
			return this;
		}

		public Builder records(int records) {
			this.records = records;
			return this;
		}

		public Builder failure(BatchState failedState, TenantID failedKey, RuntimeException failure) {
			this.failedState = failedState;
			this.failedKey = failedKey;
			this.failure = failure;
			return this;
		}

		public Builder duration(Duration duration) {
			this.duration = duration;
			return this;
		}

		public BatchReport build() {
			if (operation == null || profileType == null) {
				throw new IllegalArgumentException("operation and profileType are required");
			}
			return new BatchReport(this);
		}
	}
}
