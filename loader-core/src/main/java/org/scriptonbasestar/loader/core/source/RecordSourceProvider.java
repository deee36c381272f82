package org.scriptonbasestar.loader.core.source;

import org.scriptonbasestar.loader.core.exception.RecordSourceException;
import org.scriptonbasestar.loader.core.model.ProfileType;

/**
 * Opens a fresh {@link RecordSource} for one batch of the given profile type.
 *
 * @author archmagece
 * @since 2025-03
 */
@FunctionalInterface
public interface RecordSourceProvider {

	RecordSource open(ProfileType profileType) throws RecordSourceException;
}
