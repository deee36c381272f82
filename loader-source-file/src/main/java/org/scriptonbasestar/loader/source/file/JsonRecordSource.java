package org.scriptonbasestar.loader.source.file;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.loader.core.exception.RecordSourceException;
import org.scriptonbasestar.loader.core.record.Record;
import org.scriptonbasestar.loader.core.source.RecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON 파일 기반 레코드 소스
 * 최상위 배열의 각 객체를 하나의 레코드로 읽습니다.
 *
 * <p>파일은 첫 {@link #next()} 호출 시 열리고, 레코드는 하나씩 스트리밍으로 읽습니다.
 * 파일이 없으면 빈 배치로 처리합니다.</p>
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * // RateProfiles.json 파일 내용:
 * // [
 * //   {"Tenant": "cgrates.org", "ID": "RP1", "FilterIDs": "*string:~*req.Account:1001", "Weight": 20},
 * //   {"Tenant": "cgrates.org", "ID": "RP2", "FilterIDs": ["FLTR_1", "FLTR_2"]}
 * // ]
 *
 * try (RecordSource source = new JsonRecordSource(new File("RateProfiles.json"))) {
 *     Record record;
 *     while ((record = source.next()) != null) {
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
public class JsonRecordSource implements RecordSource {

	private static final Logger log = LoggerFactory.getLogger(JsonRecordSource.class);

	private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<Map<String, Object>>() {
	};

	private final File file;
	private final ObjectMapper objectMapper;
	private MappingIterator<Map<String, Object>> iterator;
	private boolean exhausted;
	private int position;

	public JsonRecordSource(File file) {
		this(file, new ObjectMapper());
	}

	public JsonRecordSource(File file, ObjectMapper objectMapper) {
		if (file == null) {
			throw new IllegalArgumentException("File must not be null");
		}
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.file = file;
		this.objectMapper = objectMapper;
	}

	@Override
	public Record next() throws RecordSourceException {
		if (exhausted) {
			return null;
		}
		try {
			if (iterator == null && !open()) {
				return null;
			}
			if (!iterator.hasNextValue()) {
				log.debug("Read {} record(s) from {}", position, file.getAbsolutePath());
				exhausted = true;
				return null;
			}
			Map<String, Object> fields = iterator.nextValue();
			position++;
			return toRecord(fields);
		} catch (IOException e) {
			exhausted = true;
			throw new RecordSourceException("Failed to read record " + (position + 1) + " from file: " + file.getAbsolutePath(), e);
		}
	}

	private boolean open() throws IOException {
		if (!file.exists()) {
			log.warn("File does not exist: {}", file.getAbsolutePath());
			exhausted = true;
			return false;
		}
		log.debug("Reading records from file: {}", file.getAbsolutePath());
		iterator = objectMapper.readerFor(RECORD_TYPE).readValues(file);
		return true;
	}

	private Record toRecord(Map<String, Object> fields) {
		if (fields == null) {
			throw new RecordSourceException("Record " + position + " in " + file.getAbsolutePath() + " is null");
		}
		Map<String, Object> cells = new LinkedHashMap<>();
		for (Map.Entry<String, Object> entry : fields.entrySet()) {
			Object value = entry.getValue();
			if (value == null) {
				continue;
			}
			if (value instanceof Map) {
				throw new RecordSourceException("Field " + entry.getKey() + " of record " + position
					+ " in " + file.getAbsolutePath() + " is an object, expected a scalar or a list");
			}
			cells.put(entry.getKey(), value);
		}
		return Record.of(cells);
	}

	/**
	 * 파일이 존재하는지 확인
	 */
	public boolean fileExists() {
		return file.exists();
	}

	public File getFile() {
		return file;
	}

	@Override
	public void close() throws RecordSourceException {
		if (iterator == null) {
			return;
		}
		try {
			iterator.close();
		} catch (IOException e) {
			throw new RecordSourceException("Failed to close file: " + file.getAbsolutePath(), e);
		} finally {
			iterator = null;
			exhausted = true;
		}
	}
}
