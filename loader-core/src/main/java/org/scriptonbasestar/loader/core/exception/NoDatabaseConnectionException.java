package org.scriptonbasestar.loader.core.exception;

/**
 * 저장소 연결이 없는 상태
 *
 * 메시지는 항상 {@value #MESSAGE} 로 고정되며, 호출자가 그대로 전달받아야 합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class NoDatabaseConnectionException extends StoreException {

	public static final String MESSAGE = "NO_DATABASE_CONNECTION";

	public NoDatabaseConnectionException() {
		super(MESSAGE);
	}
}
