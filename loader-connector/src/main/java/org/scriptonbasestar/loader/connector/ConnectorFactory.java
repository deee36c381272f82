package org.scriptonbasestar.loader.connector;

import org.scriptonbasestar.loader.connector.exception.DialException;

/**
 * Creates a ready connector; invoked lazily on first use of a pool slot.
 *
 * @author archmagece
 * @since 2025-03
 */
@FunctionalInterface
public interface ConnectorFactory {

	Connector create() throws DialException;
}
