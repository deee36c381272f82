package org.scriptonbasestar.loader.connector.rpc;

import lombok.experimental.UtilityClass;
import org.scriptonbasestar.loader.connector.exception.ConnectorException;
import org.scriptonbasestar.loader.connector.exception.RemoteCallException;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;

/**
 * 응답 error 문자열과 예외 사이의 변환
 *
 * @author archmagece
 * @since 2025-03
 */
@UtilityClass
public class RemoteErrors {

	static final String CANT_FIND_PREFIX = "rpc: can't find";

	public static ConnectorException toException(String serviceMethod, String error) {
		if (UnsupportedServiceMethodException.MESSAGE.equals(error) || error.startsWith(CANT_FIND_PREFIX)) {
			return new UnsupportedServiceMethodException(serviceMethod);
		}
		return new RemoteCallException(serviceMethod, error);
	}

	public static String toError(Throwable failure) {
		if (failure instanceof UnsupportedServiceMethodException) {
			return UnsupportedServiceMethodException.MESSAGE;
		}
		return failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
	}
}
