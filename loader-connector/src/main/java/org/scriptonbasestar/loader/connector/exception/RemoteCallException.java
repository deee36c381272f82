package org.scriptonbasestar.loader.connector.exception;

/**
 * 원격 서비스가 메서드를 처리했지만 오류를 반환한 경우
 *
 * @author archmagece
 * @since 2025-03
 */
public class RemoteCallException extends TransportException {

	private final String serviceMethod;
	private final String remoteError;

	public RemoteCallException(String serviceMethod, String remoteError) {
		super(serviceMethod + ": " + remoteError);
		this.serviceMethod = serviceMethod;
		this.remoteError = remoteError;
	}

	public RemoteCallException(String serviceMethod, String remoteError, Throwable cause) {
		super(serviceMethod + ": " + remoteError, cause);
		this.serviceMethod = serviceMethod;
		this.remoteError = remoteError;
	}

	public String getServiceMethod() {
		return serviceMethod;
	}

	public String getRemoteError() {
		return remoteError;
	}
}
