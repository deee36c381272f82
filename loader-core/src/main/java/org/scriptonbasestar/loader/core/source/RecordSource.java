package org.scriptonbasestar.loader.core.source;

import org.scriptonbasestar.loader.core.exception.RecordSourceException;
import org.scriptonbasestar.loader.core.record.Record;

/**
 * 배치 하나 분량의 레코드를 순서대로 제공하는 단일 패스 소스
 *
 * @author archmagece
 * @since 2025-03
 */
public interface RecordSource extends AutoCloseable {

	/**
	 * 다음 레코드를 반환합니다.
	 *
	 * @return 다음 레코드, 배치가 끝나면 null
	 * @throws RecordSourceException 읽기 실패 시
	 */
	Record next() throws RecordSourceException;

	/**
	 * 사용한 자원을 해제합니다. 기본 구현은 아무것도 하지 않습니다.
	 */
	@Override
	default void close() throws RecordSourceException {
	}
}
