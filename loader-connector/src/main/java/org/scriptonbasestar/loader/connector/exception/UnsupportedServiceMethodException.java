package org.scriptonbasestar.loader.connector.exception;

import java.util.Collections;
import java.util.List;

/**
 * No connector was able to serve the requested method.
 * <p>
 * Raised by a single connector when its peer does not expose the method, and by the
 * pool once every configured group has been tried. The message is always
 * {@value #MESSAGE}; the method and the groups tried are available as properties.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public class UnsupportedServiceMethodException extends ConnectorException {

	public static final String MESSAGE = "UNSUPPORTED_SERVICE_METHOD";

	private final String serviceMethod;
	private final List<String> connectorGroups;

	public UnsupportedServiceMethodException(String serviceMethod) {
		this(serviceMethod, Collections.emptyList());
	}

	public UnsupportedServiceMethodException(String serviceMethod, List<String> connectorGroups) {
		super(MESSAGE);
		this.serviceMethod = serviceMethod;
		this.connectorGroups = connectorGroups == null ? Collections.emptyList() : List.copyOf(connectorGroups);
	}

	public String getServiceMethod() {
		return serviceMethod;
	}

	/**
	 * @return connector groups tried, empty when raised by a single connector
	 */
	public List<String> getConnectorGroups() {
		return connectorGroups;
	}
}
