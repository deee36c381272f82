package org.scriptonbasestar.loader.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * @author archmagece
 * @since 2025-03
 */
public class StatQueueProfile extends Profile {

	private final ActivationInterval activationInterval;
	private final int queueLength;
	private final Duration ttl;
	private final int minItems;
	private final List<String> metricIds;
	private final boolean stored;
	private final boolean blocker;
	private final List<String> thresholdIds;

	public StatQueueProfile(TenantID tenantID, List<String> filterIds, ActivationInterval activationInterval,
							int queueLength, Duration ttl, int minItems, List<String> metricIds,
							boolean stored, boolean blocker, double weight, List<String> thresholdIds) {
		super(tenantID, filterIds, weight);
		this.activationInterval = activationInterval;
		this.queueLength = queueLength;
		this.ttl = ttl;
		this.minItems = minItems;
		this.metricIds = metricIds == null ? Collections.emptyList() : List.copyOf(metricIds);
		this.stored = stored;
		this.blocker = blocker;
		this.thresholdIds = thresholdIds == null ? Collections.emptyList() : List.copyOf(thresholdIds);
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.STATS;
	}

	/**
	 * 새 큐는 프로파일의 메트릭 목록으로 비어있는 상태로 시작합니다.
	 */
	@Override
	public Optional<RuntimeItem> newRuntimeItem() {
		return Optional.of(new StatQueue(getTenantID(), metricIds));
	}

	public ActivationInterval getActivationInterval() {
		return activationInterval;
	}

	public int getQueueLength() {
		return queueLength;
	}

	public Duration getTtl() {
		return ttl;
	}

	public int getMinItems() {
		return minItems;
	}

	public List<String> getMetricIds() {
		return metricIds;
	}

	public boolean isStored() {
		return stored;
	}

	public boolean isBlocker() {
		return blocker;
	}

	public List<String> getThresholdIds() {
		return thresholdIds;
	}
}
