package org.scriptonbasestar.loader.spring.boot;

import org.scriptonbasestar.loader.connector.ConnectorGroups;
import org.scriptonbasestar.loader.connector.TransportKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the config loader.
 * <p>
 * Bind to {@code sb-loader.*} properties in application.yml/properties.
 * </p>
 *
 * <h3>Example Configuration:</h3>
 * <pre>{@code
 * # application.yml
 * sb-loader:
 *   loader-id: "*default"
 *   timezone: "UTC"
 *   data-path: /var/spool/loader/in
 *   cache-conns:
 *     - "*internal:*caches"
 *     - "*remote:*caches"
 *   connect-timeout: 1s
 *   reply-timeout: 2s
 *   acquire-timeout: 2s
 *   internal-capacity: 1
 *   connectors:
 *     "[*remote:*caches]":
 *       transport: "*json"
 *       addresses:
 *         - 10.0.0.10:2012
 *         - 10.0.0.11:2012
 *   health:
 *     max-failure-rate: 0.5
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
@ConfigurationProperties(prefix = LoaderProperties.PREFIX)
public class LoaderProperties {

	public static final String PREFIX = "sb-loader";

	/**
	 * Loader identifier, used in logs, reports and metric tags.
	 */
	private String loaderId = "*default";

	/**
	 * Timezone for date fields without an offset; {@code Local} for the system default.
	 */
	private String timezone = "Local";

	/**
	 * Directory holding one {@code <SourceName>.json} file per profile type.
	 */
	private String dataPath;

	/**
	 * Cache connector group IDs, tried in order.
	 */
	private List<String> cacheConns = new ArrayList<>(List.of(ConnectorGroups.INTERNAL_CACHES));

	private Duration connectTimeout = Duration.ofSeconds(1);

	private Duration replyTimeout = Duration.ofSeconds(2);

	private Duration acquireTimeout = Duration.ofSeconds(2);

	/**
	 * Handles per in-process connector.
	 */
	private int internalCapacity = 1;

	/**
	 * Remote connector groups by group ID.
	 */
	private Map<String, ConnectorGroupConfig> connectors = new LinkedHashMap<>();

	private Health health = new Health();

	// Getters and Setters

	public String getLoaderId() {
		return loaderId;
	}

	public void setLoaderId(String loaderId) {
		this.loaderId = loaderId;
	}

	public String getTimezone() {
		return timezone;
	}

	public void setTimezone(String timezone) {
		this.timezone = timezone;
	}

	public String getDataPath() {
		return dataPath;
	}

	public void setDataPath(String dataPath) {
		this.dataPath = dataPath;
	}

	public List<String> getCacheConns() {
		return cacheConns;
	}

	public void setCacheConns(List<String> cacheConns) {
		this.cacheConns = cacheConns;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getReplyTimeout() {
		return replyTimeout;
	}

	public void setReplyTimeout(Duration replyTimeout) {
		this.replyTimeout = replyTimeout;
	}

	public Duration getAcquireTimeout() {
		return acquireTimeout;
	}

	public void setAcquireTimeout(Duration acquireTimeout) {
		this.acquireTimeout = acquireTimeout;
	}

	public int getInternalCapacity() {
		return internalCapacity;
	}

	public void setInternalCapacity(int internalCapacity) {
		this.internalCapacity = internalCapacity;
	}

	public Map<String, ConnectorGroupConfig> getConnectors() {
		return connectors;
	}

	public void setConnectors(Map<String, ConnectorGroupConfig> connectors) {
		this.connectors = connectors;
	}

	public Health getHealth() {
		return health;
	}

	public void setHealth(Health health) {
		this.health = health;
	}

	/**
	 * Remote connector group.
	 */
	public static class ConnectorGroupConfig {
		/**
		 * Transport tag: {@code *json} or {@code *gob}.
		 */
		private String transport = TransportKind.JSON.getTag();

		/**
		 * {@code host:port} addresses, in failover order.
		 */
		private List<String> addresses = new ArrayList<>();

		public String getTransport() {
			return transport;
		}

		public void setTransport(String transport) {
			this.transport = transport;
		}

		public List<String> getAddresses() {
			return addresses;
		}

		public void setAddresses(List<String> addresses) {
			this.addresses = addresses;
		}

		public TransportKind transportKind() {
			return TransportKind.fromTag(transport)
				.orElseThrow(() -> new IllegalArgumentException("Unknown transport: " + transport));
		}
	}

	/**
	 * Health indicator thresholds.
	 */
	public static class Health {
		/**
		 * Batch failure rate above which the loader reports DOWN.
		 */
		private double maxFailureRate = 0.5;

		public double getMaxFailureRate() {
			return maxFailureRate;
		}

		public void setMaxFailureRate(double maxFailureRate) {
			this.maxFailureRate = maxFailureRate;
		}
	}
}
