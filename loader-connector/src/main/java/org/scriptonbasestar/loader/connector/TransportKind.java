package org.scriptonbasestar.loader.connector;

import java.util.Optional;

/**
 * 커넥터 전송 방식
 *
 * @author archmagece
 * @since 2025-03
 */
public enum TransportKind {
	/** Jackson JSON 프레임 */
	JSON("*json"),
	/** Java 직렬화 프레임 */
	BINARY("*gob"),
	/** 같은 프로세스 내부 호출 */
	INTERNAL("*internal");

	private final String tag;

	TransportKind(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	public static Optional<TransportKind> fromTag(String tag) {
		for (TransportKind kind : values()) {
			if (kind.tag.equalsIgnoreCase(tag) || kind.name().equalsIgnoreCase(tag)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
