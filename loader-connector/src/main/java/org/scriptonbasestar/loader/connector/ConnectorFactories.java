package org.scriptonbasestar.loader.connector;

import lombok.experimental.UtilityClass;
import org.scriptonbasestar.loader.connector.rpc.BinaryRpcCodec;
import org.scriptonbasestar.loader.connector.rpc.JsonRpcCodec;
import org.scriptonbasestar.loader.connector.rpc.SocketConnector;

/**
 * 전송 방식별 커넥터 팩토리
 *
 * @author archmagece
 * @since 2025-03
 */
@UtilityClass
public class ConnectorFactories {

	/**
	 * 원격 주소용 팩토리. 커넥터는 생성 시점에 연결(dial)합니다.
	 *
	 * @throws IllegalArgumentException {@link TransportKind#INTERNAL} 이거나 주소 형식이 잘못된 경우
	 */
	public static ConnectorFactory forAddress(TransportKind kind, String address, ConnectorOptions options) {
		switch (kind) {
			case JSON:
				SocketConnector.parseAddress(address);
				return () -> SocketConnector.dial(address, new JsonRpcCodec(), options);
			case BINARY:
				SocketConnector.parseAddress(address);
				return () -> SocketConnector.dial(address, new BinaryRpcCodec(), options);
			default:
				throw new IllegalArgumentException("Transport " + kind.getTag() + " has no network address; register an endpoint instead");
		}
	}
}
