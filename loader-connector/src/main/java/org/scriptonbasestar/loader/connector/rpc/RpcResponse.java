package org.scriptonbasestar.loader.connector.rpc;

import java.io.Serializable;

/**
 * 응답 프레임: {@code {id, result, error}}. error 가 null 이 아니면 result 는 무시됩니다.
 *
 * @author archmagece
 * @since 2025-03
 */
public class RpcResponse implements Serializable {

	private static final long serialVersionUID = 1L;

	private long id;
	private Object result;
	private String error;

	public RpcResponse() {
	}

	public RpcResponse(long id, Object result, String error) {
		this.id = id;
		this.result = result;
		this.error = error;
	}

	public static RpcResponse success(long id, Object result) {
		return new RpcResponse(id, result, null);
	}

	public static RpcResponse failure(long id, String error) {
		return new RpcResponse(id, null, error);
	}

	public long getId() {
		return id;
	}

	public void setId(long id) {
		this.id = id;
	}

	public Object getResult() {
		return result;
	}

	public void setResult(Object result) {
		this.result = result;
	}

	public String getError() {
		return error;
	}

	public void setError(String error) {
		this.error = error;
	}
}
