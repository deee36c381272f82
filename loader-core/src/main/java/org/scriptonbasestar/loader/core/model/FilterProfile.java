package org.scriptonbasestar.loader.core.model;

import java.util.Collections;
import java.util.List;

/**
 * @author archmagece
 * @since 2025-03
 */
public class FilterProfile extends Profile {

	private final List<FilterRule> rules;
	private final ActivationInterval activationInterval;

	public FilterProfile(TenantID tenantID, List<FilterRule> rules, ActivationInterval activationInterval) {
		super(tenantID, Collections.emptyList(), 0);
		this.rules = rules == null ? Collections.emptyList() : List.copyOf(rules);
		this.activationInterval = activationInterval;
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.FILTERS;
	}

	public List<FilterRule> getRules() {
		return rules;
	}

	public ActivationInterval getActivationInterval() {
		return activationInterval;
	}

	public static final class FilterRule {
		private final String type;
		private final String element;
		private final List<String> values;

		public FilterRule(String type, String element, List<String> values) {
			this.type = type;
			this.element = element;
			this.values = values == null ? Collections.emptyList() : List.copyOf(values);
		}

		public String getType() {
			return type;
		}

		public String getElement() {
			return element;
		}

		public List<String> getValues() {
			return values;
		}
	}
}
