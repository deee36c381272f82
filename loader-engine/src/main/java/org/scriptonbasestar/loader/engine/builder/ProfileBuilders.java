package org.scriptonbasestar.loader.engine.builder;

import org.scriptonbasestar.loader.core.exception.BuildException;
import org.scriptonbasestar.loader.core.model.ActivationInterval;
import org.scriptonbasestar.loader.core.model.AttributeProfile;
import org.scriptonbasestar.loader.core.model.ChargerProfile;
import org.scriptonbasestar.loader.core.model.FilterProfile;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.model.RateProfile;
import org.scriptonbasestar.loader.core.model.ResourceProfile;
import org.scriptonbasestar.loader.core.model.StatQueueProfile;
import org.scriptonbasestar.loader.core.model.ThresholdProfile;
import org.scriptonbasestar.loader.core.record.Record;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static builder per {@link ProfileType}.
 * <p>
 * Field tags are shared across types ({@code Tenant}, {@code ID}, {@code FilterIDs},
 * {@code ActivationInterval}, {@code Weight}) plus the type specific ones below.
 * List fields use {@code ;} as separator, {@code ActivationInterval} is
 * {@code activation[;expiry]}.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public final class ProfileBuilders {

	public static final String FILTER_IDS = "FilterIDs";
	public static final String ACTIVATION_INTERVAL = "ActivationInterval";
	public static final String WEIGHT = "Weight";
	public static final String BLOCKER = "Blocker";
	public static final String STORED = "Stored";
	public static final String THRESHOLD_IDS = "ThresholdIDs";

	private static final Map<ProfileType, ProfileBuilder> BUILDERS = new EnumMap<>(ProfileType.class);

	static {
		BUILDERS.put(ProfileType.ATTRIBUTES, ProfileBuilders::attributeProfile);
		BUILDERS.put(ProfileType.FILTERS, ProfileBuilders::filterProfile);
		BUILDERS.put(ProfileType.RESOURCES, ProfileBuilders::resourceProfile);
		BUILDERS.put(ProfileType.STATS, ProfileBuilders::statQueueProfile);
		BUILDERS.put(ProfileType.THRESHOLDS, ProfileBuilders::thresholdProfile);
		BUILDERS.put(ProfileType.CHARGERS, ProfileBuilders::chargerProfile);
		BUILDERS.put(ProfileType.RATE_PROFILES, ProfileBuilders::rateProfile);
	}

	private ProfileBuilders() {
	}

	public static ProfileBuilder forType(ProfileType type) {
		ProfileBuilder builder = BUILDERS.get(type);
		if (builder == null) {
			throw new IllegalArgumentException("No builder for " + type);
		}
		return builder;
	}

	/**
	 * Contexts, Path/Type/Value (zipped lists), Blocker
	 */
	public static AttributeProfile attributeProfile(Record record, ZoneId zone) {
		List<String> paths = record.getList("Path");
		List<String> types = record.getList("Type");
		List<String> values = record.getList("Value");
		if (types.size() != paths.size() || values.size() != paths.size()) {
			throw new BuildException("Path", "Path, Type and Value must have the same number of entries");
		}
		List<AttributeProfile.Attribute> attributes = new ArrayList<>(paths.size());
		for (int i = 0; i < paths.size(); i++) {
			attributes.add(new AttributeProfile.Attribute(paths.get(i), types.get(i), values.get(i)));
		}
		return new AttributeProfile(record.tenantID(), record.getList("Contexts"), record.getList(FILTER_IDS),
			activationInterval(record, zone), attributes, record.getBoolean(BLOCKER, false),
			record.getDouble(WEIGHT, 0));
	}

	/**
	 * Type, Element, Values: one rule per row
	 */
	public static FilterProfile filterProfile(Record record, ZoneId zone) {
		FilterProfile.FilterRule rule = new FilterProfile.FilterRule(record.requireString("Type"),
			record.requireString("Element"), record.getList("Values"));
		return new FilterProfile(record.tenantID(), Collections.singletonList(rule), activationInterval(record, zone));
	}

	/**
	 * UsageTTL, Limit, AllocationMessage, Blocker, Stored, ThresholdIDs
	 */
	public static ResourceProfile resourceProfile(Record record, ZoneId zone) {
		return new ResourceProfile(record.tenantID(), record.getList(FILTER_IDS), activationInterval(record, zone),
			record.getDuration("UsageTTL"), record.getDouble("Limit", 0), record.getString("AllocationMessage"),
			record.getBoolean(BLOCKER, false), record.getBoolean(STORED, false), record.getDouble(WEIGHT, 0),
			record.getList(THRESHOLD_IDS));
	}

	/**
	 * QueueLength, TTL, MinItems, MetricIDs, Stored, Blocker, ThresholdIDs
	 */
	public static StatQueueProfile statQueueProfile(Record record, ZoneId zone) {
		return new StatQueueProfile(record.tenantID(), record.getList(FILTER_IDS), activationInterval(record, zone),
			record.getInt("QueueLength", 0), record.getDuration("TTL"), record.getInt("MinItems", 0),
			record.getList("MetricIDs"), record.getBoolean(STORED, false), record.getBoolean(BLOCKER, false),
			record.getDouble(WEIGHT, 0), record.getList(THRESHOLD_IDS));
	}

	/**
	 * MaxHits, MinHits, MinSleep, Blocker, ActionIDs, Async
	 */
	public static ThresholdProfile thresholdProfile(Record record, ZoneId zone) {
		return new ThresholdProfile(record.tenantID(), record.getList(FILTER_IDS), activationInterval(record, zone),
			record.getInt("MaxHits", 0), record.getInt("MinHits", 0), record.getDuration("MinSleep"),
			record.getBoolean(BLOCKER, false), record.getDouble(WEIGHT, 0), record.getList("ActionIDs"),
			record.getBoolean("Async", false));
	}

	/**
	 * RunID, AttributeIDs
	 */
	public static ChargerProfile chargerProfile(Record record, ZoneId zone) {
		return new ChargerProfile(record.tenantID(), record.getList(FILTER_IDS), record.getString("RunID"),
			record.getList("AttributeIDs"), record.getDouble(WEIGHT, 0));
	}

	/**
	 * RoundingDecimals, RoundingMethod, MinCost, MaxCost, MaxCostStrategy
	 */
	public static RateProfile rateProfile(Record record, ZoneId zone) {
		return new RateProfile(record.tenantID(), record.getList(FILTER_IDS), activationInterval(record, zone),
			record.getDouble(WEIGHT, 0), record.getInt("RoundingDecimals", 0), record.getString("RoundingMethod"),
			record.getDecimal("MinCost"), record.getDecimal("MaxCost"), record.getString("MaxCostStrategy"));
	}

	static ActivationInterval activationInterval(Record record, ZoneId zone) {
		Instant[] range = record.getTimeRange(ACTIVATION_INTERVAL, zone);
		if (range == null) {
			return null;
		}
		try {
			return new ActivationInterval(range[0], range[1]);
		} catch (IllegalArgumentException e) {
			throw new BuildException(ACTIVATION_INTERVAL, e.getMessage(), e);
		}
	}
}
