package org.scriptonbasestar.loader.connector.rpc;

import org.scriptonbasestar.loader.connector.ReplyTypes;
import org.scriptonbasestar.loader.connector.TransportKind;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidClassException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/**
 * Java 직렬화 코덱
 *
 * 인자와 결과 타입은 {@link java.io.Serializable} 이어야 하며, 양쪽 클래스패스에 있어야 합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class BinaryRpcCodec implements RpcCodec {

	@Override
	public TransportKind kind() {
		return TransportKind.BINARY;
	}

	@Override
	public byte[] encodeRequest(RpcRequest request) throws IOException {
		return serialize(request);
	}

	@Override
	public RpcRequest decodeRequest(byte[] payload) throws IOException {
		return deserialize(payload, RpcRequest.class);
	}

	@Override
	public byte[] encodeResponse(RpcResponse response) throws IOException {
		return serialize(response);
	}

	@Override
	public RpcResponse decodeResponse(byte[] payload) throws IOException {
		return deserialize(payload, RpcResponse.class);
	}

	@Override
	public <R> R convertReply(String serviceMethod, Object result, Class<R> replyType) {
		return ReplyTypes.cast(serviceMethod, result, replyType);
	}

	private static byte[] serialize(Object value) throws IOException {
		try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
		     ObjectOutputStream oos = new ObjectOutputStream(baos)) {
			oos.writeObject(value);
			oos.flush();
			return baos.toByteArray();
		}
	}

	private static <T> T deserialize(byte[] data, Class<T> type) throws IOException {
		try (ByteArrayInputStream bais = new ByteArrayInputStream(data);
		     ObjectInputStream ois = new ObjectInputStream(bais)) {
			Object value = ois.readObject();
			if (!type.isInstance(value)) {
				throw new InvalidClassException(type.getName(), "unexpected frame " + value.getClass().getName());
			}
			return type.cast(value);
		} catch (ClassNotFoundException e) {
			throw new IOException("Unknown class in frame", e);
		}
	}
}
