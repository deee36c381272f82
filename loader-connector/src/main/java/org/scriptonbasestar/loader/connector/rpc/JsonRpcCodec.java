package org.scriptonbasestar.loader.connector.rpc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.scriptonbasestar.loader.connector.TransportKind;
import org.scriptonbasestar.loader.connector.exception.TransportException;

import java.io.IOException;

/**
 * JSON 코덱 (Jackson)
 *
 * 인자와 결과는 일반 JSON 구조(Map, List, String, Number)로 복원되며,
 * 수신 측에서 필요한 타입으로 변환합니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class JsonRpcCodec implements RpcCodec {

	private final ObjectMapper objectMapper;

	public JsonRpcCodec() {
		this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
	}

	public JsonRpcCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public TransportKind kind() {
		return TransportKind.JSON;
	}

	@Override
	public byte[] encodeRequest(RpcRequest request) throws IOException {
		return objectMapper.writeValueAsBytes(request);
	}

	@Override
	public RpcRequest decodeRequest(byte[] payload) throws IOException {
		return objectMapper.readValue(payload, RpcRequest.class);
	}

	@Override
	public byte[] encodeResponse(RpcResponse response) throws IOException {
		return objectMapper.writeValueAsBytes(response);
	}

	@Override
	public RpcResponse decodeResponse(byte[] payload) throws IOException {
		return objectMapper.readValue(payload, RpcResponse.class);
	}

	@Override
	public <R> R convertReply(String serviceMethod, Object result, Class<R> replyType) {
		if (result == null || replyType.isInstance(result)) {
			return replyType.cast(result);
		}
		try {
			return objectMapper.convertValue(result, replyType);
		} catch (IllegalArgumentException e) {
			throw new TransportException("Reply type mismatch for " + serviceMethod + ": expected "
				+ replyType.getName() + " but got " + result.getClass().getName(), e);
		}
	}
}
