package org.scriptonbasestar.loader.connector.rpc;

import java.io.Serializable;

/**
 * 요청 프레임: {@code {id, method, params}}
 *
 * @author archmagece
 * @since 2025-03
 */
public class RpcRequest implements Serializable {

	private static final long serialVersionUID = 1L;

	private long id;
	private String method;
	private Object params;

	public RpcRequest() {
	}

	public RpcRequest(long id, String method, Object params) {
		this.id = id;
		this.method = method;
		this.params = params;
	}

	public long getId() {
		return id;
	}

	public void setId(long id) {
		this.id = id;
	}

	public String getMethod() {
		return method;
	}

	public void setMethod(String method) {
		this.method = method;
	}

	public Object getParams() {
		return params;
	}

	public void setParams(Object params) {
		this.params = params;
	}
}
