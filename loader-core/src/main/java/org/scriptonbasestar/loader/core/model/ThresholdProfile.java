package org.scriptonbasestar.loader.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * @author archmagece
 * @since 2025-03
 */
public class ThresholdProfile extends Profile {

	private final ActivationInterval activationInterval;
	private final int maxHits;
	private final int minHits;
	private final Duration minSleep;
	private final boolean blocker;
	private final List<String> actionIds;
	private final boolean async;

	public ThresholdProfile(TenantID tenantID, List<String> filterIds, ActivationInterval activationInterval,
							int maxHits, int minHits, Duration minSleep, boolean blocker, double weight,
							List<String> actionIds, boolean async) {
		super(tenantID, filterIds, weight);
		this.activationInterval = activationInterval;
		this.maxHits = maxHits;
		this.minHits = minHits;
		this.minSleep = minSleep == null ? Duration.ZERO : minSleep;
		this.blocker = blocker;
		this.actionIds = actionIds == null ? Collections.emptyList() : List.copyOf(actionIds);
		this.async = async;
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.THRESHOLDS;
	}

	@Override
	public Optional<RuntimeItem> newRuntimeItem() {
		return Optional.of(new Threshold(getTenantID(), 0));
	}

	public ActivationInterval getActivationInterval() {
		return activationInterval;
	}

	public int getMaxHits() {
		return maxHits;
	}

	public int getMinHits() {
		return minHits;
	}

	public Duration getMinSleep() {
		return minSleep;
	}

	public boolean isBlocker() {
		return blocker;
	}

	public List<String> getActionIds() {
		return actionIds;
	}

	public boolean isAsync() {
		return async;
	}
}
