package org.scriptonbasestar.loader.source.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.loader.core.model.ProfileType;
import org.scriptonbasestar.loader.core.source.RecordSource;
import org.scriptonbasestar.loader.core.source.RecordSourceProvider;

import java.io.File;
import java.nio.file.Path;

/**
 * 디렉토리의 {@code <SourceName>.json} 파일을 프로파일 타입별 소스로 엽니다.
 * 예: {@link ProfileType#RATE_PROFILES} → {@code RateProfiles.json}
 *
 * @author archmagece
 * @since 2025-03
 */
public class JsonDirectoryRecordSourceProvider implements RecordSourceProvider {

	public static final String EXTENSION = ".json";

	private final Path directory;
	private final ObjectMapper objectMapper;

	public JsonDirectoryRecordSourceProvider(Path directory) {
		this(directory, new ObjectMapper());
	}

	public JsonDirectoryRecordSourceProvider(Path directory, ObjectMapper objectMapper) {
		if (directory == null) {
			throw new IllegalArgumentException("Directory must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.directory = directory;
		this.objectMapper = objectMapper;
	}

	@Override
	public RecordSource open(ProfileType profileType) {
		return new JsonRecordSource(fileFor(profileType), objectMapper);
	}

	public File fileFor(ProfileType profileType) {
		return directory.resolve(profileType.getSourceName() + EXTENSION).toFile();
	}

	public Path getDirectory() {
		return directory;
	}
}
