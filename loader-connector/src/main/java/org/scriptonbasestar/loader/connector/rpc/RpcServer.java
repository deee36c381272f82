package org.scriptonbasestar.loader.connector.rpc;

import org.scriptonbasestar.loader.connector.endpoint.ServiceEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves a {@link ServiceEndpoint} over length-prefixed frames, one thread per connection.
 * <p>
 * Endpoint failures are answered as error frames: an unsupported method as
 * {@code UNSUPPORTED_SERVICE_METHOD}, anything else with its message.
 * </p>
 *
 * @author archmagece
 * @since 2025-03
 */
public class RpcServer implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

	private final ServiceEndpoint endpoint;
	private final RpcCodec codec;
	private final ServerSocket serverSocket;
	private final ExecutorService workers;
	private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
	private final AtomicInteger served = new AtomicInteger();
	private volatile boolean running = true;

	/**
	 * 루프백 주소의 임의 포트로 서버를 시작합니다.
	 */
	public RpcServer(ServiceEndpoint endpoint, RpcCodec codec) throws IOException {
		this(endpoint, codec, new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
	}

	public RpcServer(ServiceEndpoint endpoint, RpcCodec codec, InetSocketAddress bindAddress) throws IOException {
		if (endpoint == null || codec == null) {
			throw new IllegalArgumentException("endpoint and codec must not be null");
		}
		this.endpoint = endpoint;
		this.codec = codec;
		this.serverSocket = new ServerSocket();
		this.serverSocket.bind(bindAddress);
		AtomicInteger threadIndex = new AtomicInteger();
		this.workers = Executors.newCachedThreadPool(r -> {
			Thread thread = new Thread(r, "rpc-server-" + codec.kind().getTag() + "-" + threadIndex.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
		this.workers.execute(this::acceptLoop);
		log.debug("RpcServer ({}) listening on {}", codec.kind(), getAddress());
	}

	public int getPort() {
		return serverSocket.getLocalPort();
	}

	/**
	 * @return {@code host:port} usable as a connector address
	 */
	public String getAddress() {
		return serverSocket.getInetAddress().getHostAddress() + ":" + getPort();
	}

	/**
	 * @return number of requests answered so far
	 */
	public int getServedCount() {
		return served.get();
	}

	private void acceptLoop() {
		while (running) {
			try {
				Socket client = serverSocket.accept();
				clients.add(client);
				workers.execute(() -> serve(client));
			} catch (SocketException e) {
				if (running) {
					log.error("RpcServer accept failed", e);
				}
				return;
			} catch (IOException e) {
				log.error("RpcServer accept failed", e);
			}
		}
	}

	private void serve(Socket client) {
		try (Socket socket = client;
		     DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
		     DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()))) {
			while (running) {
				RpcRequest request = codec.decodeRequest(Frames.read(in));
				RpcResponse response = handle(request);
				served.incrementAndGet();
				Frames.write(out, codec.encodeResponse(response));
			}
		} catch (EOFException e) {
			log.trace("Client {} disconnected", client.getRemoteSocketAddress());
		} catch (IOException e) {
			if (running) {
				log.debug("Connection from {} dropped", client.getRemoteSocketAddress(), e);
			}
		} finally {
			clients.remove(client);
		}
	}

	private RpcResponse handle(RpcRequest request) {
		try {
			Object result = endpoint.serve(request.getMethod(), request.getParams());
			return RpcResponse.success(request.getId(), result);
		} catch (RuntimeException e) {
			log.trace("{} failed: {}", request.getMethod(), e.getMessage());
			return RpcResponse.failure(request.getId(), RemoteErrors.toError(e));
		}
	}

	@Override
	public void close() throws IOException {
		running = false;
		try {
			serverSocket.close();
		} finally {
			for (Socket client : clients) {
				try {
					client.close();
				} catch (IOException e) {
					log.debug("Failed to close client socket", e);
				}
			}
			workers.shutdownNow();
			log.debug("RpcServer ({}) on port {} closed", codec.kind(), getPort());
		}
	}
}
