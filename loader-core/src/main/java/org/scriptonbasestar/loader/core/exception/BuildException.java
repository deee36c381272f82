package org.scriptonbasestar.loader.core.exception;

/**
 * A record could not be converted into a profile.
 * <p>
 * Raised for a missing mandatory field or a value that cannot be converted to the
 * field's type. Nothing is written to the store for the offending record.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public class BuildException extends LoaderException {

	private final String field;

	public BuildException(String field, String message) {
		super(message);
		this.field = field;
	}

	public BuildException(String field, String message, Throwable cause) {
		super(message, cause);
		this.field = field;
	}

	/**
	 * @return the record field that failed, or {@code null} when the failure is not field specific
	 */
	public String getField() {
		return field;
	}

	public static BuildException mandatoryMissing(String field) {
		return new BuildException(field, "MANDATORY_IE_MISSING: [" + field + "]");
	}
}
