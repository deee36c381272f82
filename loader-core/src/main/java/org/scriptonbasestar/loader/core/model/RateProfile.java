package org.scriptonbasestar.loader.core.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Rating profile: cost bounds and rounding applied to the rates it groups.
 *
 * @author archmagece
 * @since 2025-03
 */
public class RateProfile extends Profile {

	private final ActivationInterval activationInterval;
	private final int roundingDecimals;
	private final String roundingMethod;
	private final BigDecimal minCost;
	private final BigDecimal maxCost;
	private final String maxCostStrategy;

	public RateProfile(TenantID tenantID, List<String> filterIds, ActivationInterval activationInterval,
					   double weight, int roundingDecimals, String roundingMethod,
					   BigDecimal minCost, BigDecimal maxCost, String maxCostStrategy) {
		super(tenantID, filterIds, weight);
		this.activationInterval = activationInterval;
		this.roundingDecimals = roundingDecimals;
		this.roundingMethod = roundingMethod;
		this.minCost = minCost;
		this.maxCost = maxCost;
		this.maxCostStrategy = maxCostStrategy;
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.RATE_PROFILES;
	}

	public ActivationInterval getActivationInterval() {
		return activationInterval;
	}

	public int getRoundingDecimals() {
		return roundingDecimals;
	}

	public String getRoundingMethod() {
		return roundingMethod;
	}

	public BigDecimal getMinCost() {
		return minCost;
	}

	public BigDecimal getMaxCost() {
		return maxCost;
	}

	public String getMaxCostStrategy() {
		return maxCostStrategy;
	}
}
