package org.scriptonbasestar.loader.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of configuration entity categories handled by the loader.
 * <p>
 * Each constant selects the builder, the store accessor and the cache partitions
 * that apply to its records. Adding a category means adding a constant here plus a
 * builder mapping.
 * </p>
 *
 * <h3>Partitions:</h3>
 * <ul>
 *   <li>{@code profilePartition} - cache partition holding the profiles</li>
 *   <li>{@code itemPartition} - cache partition holding the runtime companion, {@code null} when stateless</li>
 *   <li>{@code indexPartition} - filter index partition, {@code null} when the type is not indexed</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-03
 */
public enum ProfileType {

	ATTRIBUTES("*attributes", "Attributes", "*attribute_profiles", null, "*attribute_filter_indexes"),
	FILTERS("*filters", "Filters", "*filters", null, null),
	RESOURCES("*resources", "Resources", "*resource_profiles", "*resources", "*resource_filter_indexes"),
	STATS("*stats", "Stats", "*statqueue_profiles", "*statqueues", "*stat_filter_indexes"),
	THRESHOLDS("*thresholds", "Thresholds", "*threshold_profiles", "*thresholds", "*threshold_filter_indexes"),
	CHARGERS("*chargers", "Chargers", "*charger_profiles", null, "*charger_filter_indexes"),
	RATE_PROFILES("*rate_profiles", "RateProfiles", "*rate_profiles", null, "*rate_profile_filter_indexes");

	private final String tag;
	private final String sourceName;
	private final String profilePartition;
	private final String itemPartition;
	private final String indexPartition;

	ProfileType(String tag, String sourceName, String profilePartition,
				String itemPartition, String indexPartition) {
		this.tag = tag;
		this.sourceName = sourceName;
		this.profilePartition = profilePartition;
		this.itemPartition = itemPartition;
		this.indexPartition = indexPartition;
	}

	public String getTag() {
		return tag;
	}

	/**
	 * @return base name used by file based record sources, e.g. {@code RateProfiles}
	 */
	public String getSourceName() {
		return sourceName;
	}

	public String getProfilePartition() {
		return profilePartition;
	}

	public Optional<String> getItemPartition() {
		return Optional.ofNullable(itemPartition);
	}

	public Optional<String> getIndexPartition() {
		return Optional.ofNullable(indexPartition);
	}

	/**
	 * Stateful types keep a runtime companion item next to the profile.
	 */
	public boolean isStateful() {
		return itemPartition != null;
	}

	/**
	 * All cache partitions touched when this type is cleared.
	 */
	public List<String> cachePartitions() {
		List<String> partitions = new ArrayList<>(3);
		partitions.add(profilePartition);
		if (itemPartition != null) {
			partitions.add(itemPartition);
		}
		if (indexPartition != null) {
			partitions.add(indexPartition);
		}
		return Collections.unmodifiableList(partitions);
	}

	public static Optional<ProfileType> fromTag(String tag) {
		for (ProfileType type : values()) {
			if (type.tag.equals(tag)) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}

	@Override
	public String toString() {
		return tag;
	}
}
