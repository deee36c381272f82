package org.scriptonbasestar.loader.connector.exception;

/**
 * 원격 주소 연결 실패
 *
 * @author archmagece
 * @since 2025-03
 */
public class DialException extends TransportException {

	private final String address;

	public DialException(String address, Throwable cause) {
		super("Failed to dial " + address, cause);
		this.address = address;
	}

	public String getAddress() {
		return address;
	}
}
