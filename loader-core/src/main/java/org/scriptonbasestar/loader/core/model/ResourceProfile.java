package org.scriptonbasestar.loader.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * @author archmagece
 * @since 2025-03
 */
public class ResourceProfile extends Profile {

	private final ActivationInterval activationInterval;
	private final Duration usageTtl;
	private final double limit;
	private final String allocationMessage;
	private final boolean blocker;
	private final boolean stored;
	private final List<String> thresholdIds;

	public ResourceProfile(TenantID tenantID, List<String> filterIds, ActivationInterval activationInterval,
						   Duration usageTtl, double limit, String allocationMessage, boolean blocker,
						   boolean stored, double weight, List<String> thresholdIds) {
		super(tenantID, filterIds, weight);
		this.activationInterval = activationInterval;
		this.usageTtl = usageTtl;
		this.limit = limit;
		this.allocationMessage = allocationMessage;
		this.blocker = blocker;
		this.stored = stored;
		this.thresholdIds = thresholdIds == null ? Collections.emptyList() : List.copyOf(thresholdIds);
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.RESOURCES;
	}

	@Override
	public Optional<RuntimeItem> newRuntimeItem() {
		return Optional.of(new Resource(getTenantID()));
	}

	public ActivationInterval getActivationInterval() {
		return activationInterval;
	}

	public Duration getUsageTtl() {
		return usageTtl;
	}

	public double getLimit() {
		return limit;
	}

	public String getAllocationMessage() {
		return allocationMessage;
	}

	public boolean isBlocker() {
		return blocker;
	}

	public boolean isStored() {
		return stored;
	}

	public List<String> getThresholdIds() {
		return thresholdIds;
	}
}
