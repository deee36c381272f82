package org.scriptonbasestar.loader.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @author archmagece
 * @since 2025-03
 */
public class AttributeProfile extends Profile {

	public static final String ANY_CONTEXT = "*any";

	private final List<String> contexts;
	private final ActivationInterval activationInterval;
	private final List<Attribute> attributes;
	private final boolean blocker;

	public AttributeProfile(TenantID tenantID, List<String> contexts, List<String> filterIds,
							ActivationInterval activationInterval, List<Attribute> attributes,
							boolean blocker, double weight) {
		super(tenantID, filterIds, weight);
		this.contexts = contexts == null || contexts.isEmpty() ? List.of(ANY_CONTEXT) : List.copyOf(contexts);
		this.activationInterval = activationInterval;
		this.attributes = attributes == null ? Collections.emptyList() : List.copyOf(attributes);
		this.blocker = blocker;
	}

	@Override
	public ProfileType getProfileType() {
		return ProfileType.ATTRIBUTES;
	}

	public List<String> getContexts() {
		return contexts;
	}

	public ActivationInterval getActivationInterval() {
		return activationInterval;
	}

	public List<Attribute> getAttributes() {
		return attributes;
	}

	public boolean isBlocker() {
		return blocker;
	}

	/**
	 * 속성 프로파일은 컨텍스트별로 인덱스를 유지합니다 ({@code tenant:context}).
	 */
	@Override
	public List<String> indexContexts() {
		List<String> result = new ArrayList<>(contexts.size());
		for (String context : contexts) {
			result.add(getTenant() + TenantID.SEPARATOR + context);
		}
		return result;
	}

	/**
	 * Single field substitution applied by the attribute service.
	 */
	public static final class Attribute {
		private final String path;
		private final String type;
		private final String value;

		public Attribute(String path, String type, String value) {
			this.path = path;
			this.type = type;
			this.value = value;
		}

		public String getPath() {
			return path;
		}

		public String getType() {
			return type;
		}

		public String getValue() {
			return value;
		}

		@Override
		public String toString() {
			return "Attribute{" + path + ' ' + type + ' ' + value + '}';
		}
	}
}
