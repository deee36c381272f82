package org.scriptonbasestar.loader.connector;

import lombok.experimental.UtilityClass;

/**
 * 커넥터 그룹 ID 헬퍼
 *
 * @author archmagece
 * @since 2025-03
 */
@UtilityClass
public class ConnectorGroups {

	public static final String SEPARATOR = ":";
	public static final String INTERNAL = "*internal";
	public static final String CACHES = "*caches";

	/** 내부 캐시 서비스 그룹: {@code *internal:*caches} */
	public static final String INTERNAL_CACHES = concat(INTERNAL, CACHES);

	public static String concat(String... parts) {
		return String.join(SEPARATOR, parts);
	}
}
