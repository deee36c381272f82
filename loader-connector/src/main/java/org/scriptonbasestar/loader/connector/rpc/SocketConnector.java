package org.scriptonbasestar.loader.connector.rpc;

import org.scriptonbasestar.loader.connector.Connector;
import org.scriptonbasestar.loader.connector.ConnectorOptions;
import org.scriptonbasestar.loader.connector.exception.DialException;
import org.scriptonbasestar.loader.connector.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Networked connector speaking length-prefixed frames over one TCP connection.
 * <p>
 * Request/response exchanges are serialized on the socket. A broken connection is closed
 * and dialled again on the next call; the failing call itself surfaces a
 * {@link TransportException}.
 * </p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Connector connector = SocketConnector.dial("127.0.0.1:2012", new JsonRpcCodec(), ConnectorOptions.defaults());
 * String reply = connector.call("CacheSv1.Clear", new CacheClearArgs(), String.class);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-03
 */
public class SocketConnector implements Connector {

	private static final Logger log = LoggerFactory.getLogger(SocketConnector.class);

	private final String address;
	private final InetSocketAddress socketAddress;
	private final RpcCodec codec;
	private final ConnectorOptions options;
	private final AtomicLong sequence = new AtomicLong();

	private Socket socket;
	private DataInputStream in;
	private DataOutputStream out;

	public SocketConnector(String address, RpcCodec codec, ConnectorOptions options) {
		if (codec == null || options == null) {
			throw new IllegalArgumentException("codec and options must not be null");
		}
		this.address = address;
		this.socketAddress = parseAddress(address);
		this.codec = codec;
		this.options = options;
	}

	/**
	 * 연결까지 완료된 커넥터를 반환합니다.
	 */
	public static SocketConnector dial(String address, RpcCodec codec, ConnectorOptions options) throws DialException {
		SocketConnector connector = new SocketConnector(address, codec, options);
		synchronized (connector) {
			connector.connect();
		}
		return connector;
	}

	/**
	 * @throws IllegalArgumentException the address is not {@code host:port}
	 */
	public static InetSocketAddress parseAddress(String address) {
		int idx = address == null ? -1 : address.lastIndexOf(':');
		if (idx <= 0 || idx == address.length() - 1) {
			throw new IllegalArgumentException("Address must be host:port: " + address);
		}
		try {
			return InetSocketAddress.createUnresolved(address.substring(0, idx), Integer.parseInt(address.substring(idx + 1)));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid port in address: " + address, e);
		}
	}

	@Override
	public synchronized <R> R call(String serviceMethod, Object args, Class<R> replyType) {
		if (socket == null) {
			connect();
		}
		RpcRequest request = new RpcRequest(sequence.incrementAndGet(), serviceMethod, args);
		RpcResponse response;
		try {
			Frames.write(out, codec.encodeRequest(request));
			response = codec.decodeResponse(Frames.read(in));
		} catch (SocketTimeoutException e) {
			disconnect();
			throw new TransportException("No reply for " + serviceMethod + " from " + address
				+ " within " + options.getReplyTimeout(), e);
		} catch (IOException e) {
			disconnect();
			throw new TransportException("Call " + serviceMethod + " to " + address + " failed", e);
		}
		if (response.getId() != request.getId()) {
			disconnect();
			throw new TransportException("Reply id " + response.getId() + " does not match request id " + request.getId());
		}
		if (response.getError() != null) {
			throw RemoteErrors.toException(serviceMethod, response.getError());
		}
		log.trace("{} answered {} from {}", serviceMethod, codec.kind(), address);
		return codec.convertReply(serviceMethod, response.getResult(), replyType);
	}

	public String getAddress() {
		return address;
	}

	public synchronized boolean isConnected() {
		return socket != null && socket.isConnected() && !socket.isClosed();
	}

	@Override
	public synchronized void close() {
		disconnect();
	}

	private void connect() throws DialException {
		Socket candidate = new Socket();
		try {
			candidate.connect(new InetSocketAddress(socketAddress.getHostString(), socketAddress.getPort()),
				(int) options.getConnectTimeout().toMillis());
			candidate.setSoTimeout((int) options.getReplyTimeout().toMillis());
			candidate.setTcpNoDelay(true);
			in = new DataInputStream(new BufferedInputStream(candidate.getInputStream()));
			out = new DataOutputStream(new BufferedOutputStream(candidate.getOutputStream()));
			socket = candidate;
			log.debug("Connected {} connector to {}", codec.kind(), address);
		} catch (IOException e) {
			closeSocket(candidate);
			throw new DialException(address, e);
		}
	}

	private void disconnect() {
		if (socket != null) {
			closeSocket(socket);
			socket = null;
			in = null;
			out = null;
		}
	}

	private void closeSocket(Socket target) {
		try {
			target.close();
		} catch (IOException e) {
			log.debug("Failed to close socket to {}", address, e);
		}
	}

	@Override
	public String toString() {
		return "SocketConnector{" + codec.kind() + ", " + address + '}';
	}
}
