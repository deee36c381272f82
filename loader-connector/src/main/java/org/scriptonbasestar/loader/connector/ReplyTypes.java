package org.scriptonbasestar.loader.connector;

import lombok.experimental.UtilityClass;
import org.scriptonbasestar.loader.connector.exception.TransportException;

/**
 * 응답 타입 검증
 *
 * @author archmagece
 * @since 2025-03
 */
@UtilityClass
public class ReplyTypes {

	/**
	 * @throws TransportException the reply is not an instance of the expected type
	 */
	public static <R> R cast(String serviceMethod, Object reply, Class<R> replyType) {
		if (reply == null || replyType.isInstance(reply)) {
			return replyType.cast(reply);
		}
		throw new TransportException("Reply type mismatch for " + serviceMethod + ": expected "
			+ replyType.getName() + " but got " + reply.getClass().getName());
	}
}
