package org.scriptonbasestar.loader.connector.rpc;

import org.scriptonbasestar.loader.connector.TransportKind;

import java.io.IOException;

/**
 * Frame payload codec shared by {@link SocketConnector} and {@link RpcServer}.
 *
 * @author archmagece
 * @since 2025-03
 */
public interface RpcCodec {

	TransportKind kind();

	byte[] encodeRequest(RpcRequest request) throws IOException;

	RpcRequest decodeRequest(byte[] payload) throws IOException;

	byte[] encodeResponse(RpcResponse response) throws IOException;

	RpcResponse decodeResponse(byte[] payload) throws IOException;

	/**
	 * Turns a decoded result into the caller's reply type.
	 *
	 * @throws org.scriptonbasestar.loader.connector.exception.TransportException the result does not fit the type
	 */
	<R> R convertReply(String serviceMethod, Object result, Class<R> replyType);
}
