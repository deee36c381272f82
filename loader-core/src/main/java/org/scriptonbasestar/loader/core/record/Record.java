package org.scriptonbasestar.loader.core.record;

import org.scriptonbasestar.loader.core.exception.BuildException;
import org.scriptonbasestar.loader.core.model.TenantID;
import org.scriptonbasestar.loader.core.util.TimeParser;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One logical row of a batch: field tag to typed scalar value.
 * <p>
 * Immutable once produced. Typed accessors accept either the native type or its string
 * form, so rows read from text sources ({@code "20"}) and from typed sources ({@code 20})
 * convert the same way. Conversion failures raise {@link BuildException} naming the field.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Record record = Record.builder()
 *     .put(Record.TENANT, "cgrates.org")
 *     .put(Record.ID, "P1")
 *     .put("Weight", "20")
 *     .build();
 *
 * record.tenantID();              // cgrates.org:P1
 * record.getDouble("Weight", 0);  // 20.0
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
public final class Record {

	public static final String TENANT = "Tenant";
	public static final String ID = "ID";
	public static final String LIST_SEPARATOR = ";";

	private final Map<String, Object> fields;

	private Record(Map<String, Object> fields) {
		this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	public static Record of(Map<String, ?> fields) {
		if (fields == null) {
			throw new IllegalArgumentException("fields must not be null");
		}
		return new Record(new LinkedHashMap<>(fields));
	}

	public static Builder builder() {
		return new Builder();
	}

	public Map<String, Object> asMap() {
		return fields;
	}

	/**
	 * @return true when the field is present with a non-blank value
	 */
	public boolean has(String field) {
		Object value = fields.get(field);
		return value != null && !(value instanceof String && ((String) value).trim().isEmpty());
	}

	public Object get(String field) {
		return fields.get(field);
	}

	public String getString(String field) {
		Object value = fields.get(field);
		return value == null ? null : value.toString().trim();
	}

	public String requireString(String field) {
		if (!has(field)) {
			throw BuildException.mandatoryMissing(field);
		}
		return getString(field);
	}

	/**
	 * (Tenant, ID) identity of the row; both fields are mandatory.
	 */
	public TenantID tenantID() {
		return TenantID.of(requireString(TENANT), requireString(ID));
	}

	public double getDouble(String field, double defaultValue) {
		if (!has(field)) {
			return defaultValue;
		}
		Object value = fields.get(field);
		if (value instanceof Number) {
			return ((Number) value).doubleValue();
		}
		try {
			return Double.parseDouble(getString(field));
		} catch (NumberFormatException e) {
			throw conversionFailed(field, "float", e);
		}
	}

	public int getInt(String field, int defaultValue) {
		if (!has(field)) {
			return defaultValue;
		}
		Object value = fields.get(field);
		if (value instanceof Number) {
			// 소수부가 있거나 int 범위를 벗어나면 실패
			try {
				return new BigDecimal(value.toString()).intValueExact();
			} catch (ArithmeticException | NumberFormatException e) {
				throw conversionFailed(field, "integer", e);
			}
		}
		try {
			return Integer.parseInt(getString(field));
		} catch (NumberFormatException e) {
			throw conversionFailed(field, "integer", e);
		}
	}

	public boolean getBoolean(String field, boolean defaultValue) {
		if (!has(field)) {
			return defaultValue;
		}
		Object value = fields.get(field);
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		String text = getString(field);
		if ("true".equalsIgnoreCase(text)) {
			return true;
		}
		if ("false".equalsIgnoreCase(text)) {
			return false;
		}
		throw new BuildException(field, "Cannot convert field " + field + " to boolean: " + text);
	}

	public BigDecimal getDecimal(String field) {
		if (!has(field)) {
			return null;
		}
		try {
			return new BigDecimal(getString(field));
		} catch (NumberFormatException e) {
			throw conversionFailed(field, "decimal", e);
		}
	}

	/**
	 * {@value #LIST_SEPARATOR} 로 구분된 값을 목록으로 반환합니다. 값이 없으면 빈 목록.
	 */
	public List<String> getList(String field) {
		if (!has(field)) {
			return Collections.emptyList();
		}
		Object value = fields.get(field);
		List<String> result = new ArrayList<>();
		if (value instanceof List) {
			for (Object item : (List<?>) value) {
				if (item != null && !item.toString().trim().isEmpty()) {
					result.add(item.toString().trim());
				}
			}
			return result;
		}
		for (String part : getString(field).split(LIST_SEPARATOR)) {
			if (!part.trim().isEmpty()) {
				result.add(part.trim());
			}
		}
		return result;
	}

	public Duration getDuration(String field) {
		if (!has(field)) {
			return null;
		}
		try {
			return TimeParser.parseDuration(getString(field));
		} catch (IllegalArgumentException e) {
			throw conversionFailed(field, "duration", e);
		}
	}

	public Instant getTime(String field, ZoneId zone) {
		if (!has(field)) {
			return null;
		}
		return parseTime(field, getString(field), zone);
	}

	/**
	 * 구분자로 나뉜 두 시각 (시작;만료)을 읽습니다. 하나만 있으면 만료 시각은 null 입니다.
	 */
	public Instant[] getTimeRange(String field, ZoneId zone) {
		List<String> parts = getList(field);
		if (parts.isEmpty()) {
			return null;
		}
		if (parts.size() > 2) {
			throw new BuildException(field, "Too many values in time range " + field + ": " + getString(field));
		}
		Instant start = parseTime(field, parts.get(0), zone);
		Instant end = parts.size() == 2 ? parseTime(field, parts.get(1), zone) : null;
		return new Instant[]{start, end};
	}

	private static Instant parseTime(String field, String text, ZoneId zone) {
		try {
			return TimeParser.parseTime(text, zone);
		} catch (DateTimeException e) {
			throw conversionFailed(field, "time", e);
		}
	}

	private static BuildException conversionFailed(String field, String type, Exception cause) {
		return new BuildException(field, "Cannot convert field " + field + " to " + type + ": " + cause.getMessage(), cause);
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o instanceof Record && fields.equals(((Record) o).fields));
	}

	@Override
	public int hashCode() {
		return fields.hashCode();
	}

	@Override
	public String toString() {
		return "Record" + fields;
	}

	public static class Builder {
		private final Map<String, Object> fields = new LinkedHashMap<>();

		public Builder put(String field, Object value) {
			fields.put(field, value);
			return this;
		}

		public Record build() {
			return new Record(fields);
		}
	}
}
