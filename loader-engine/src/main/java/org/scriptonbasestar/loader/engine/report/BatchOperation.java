package org.scriptonbasestar.loader.engine.report;

/**
 * 배치 종류
 *
 * @author archmagece
 * @since 2025-03
 */
public enum BatchOperation {
	/** processContent: 생성/갱신 */
	CONTENT("content"),
	/** removeContent: 삭제 */
	REMOVAL("removal");

	private final String tag;

	BatchOperation(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}
}
