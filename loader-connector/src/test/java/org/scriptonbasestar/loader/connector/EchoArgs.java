package org.scriptonbasestar.loader.connector;

import java.io.Serializable;

/**
 * 테스트용 인자 타입
 */
public class EchoArgs implements Serializable {

	private static final long serialVersionUID = 1L;

	private String text;

	public EchoArgs() {
	}

	public EchoArgs(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public void setText(String text) {
		this.text = text;
	}
}
