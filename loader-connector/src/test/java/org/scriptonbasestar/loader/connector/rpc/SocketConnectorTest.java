package org.scriptonbasestar.loader.connector.rpc;

import org.junit.After;
import org.junit.Test;
import org.scriptonbasestar.loader.connector.ConnectorOptions;
import org.scriptonbasestar.loader.connector.ConnectorPool;
import org.scriptonbasestar.loader.connector.EchoArgs;
import org.scriptonbasestar.loader.connector.TransportKind;
import org.scriptonbasestar.loader.connector.endpoint.MethodRegistry;
import org.scriptonbasestar.loader.connector.exception.DialException;
import org.scriptonbasestar.loader.connector.exception.RemoteCallException;
import org.scriptonbasestar.loader.connector.exception.TransportException;
import org.scriptonbasestar.loader.connector.exception.UnsupportedServiceMethodException;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 * @author archmagece
 * @since 2025-03
 */
public class SocketConnectorTest {

	private final MethodRegistry registry = new MethodRegistry()
		.register("EchoSv1.Echo", EchoArgs.class, args -> "echo:" + args.getText())
		.register("EchoSv1.Fail", EchoArgs.class, args -> {
			throw new IllegalStateException("SERVER_ERROR: " + args.getText());
		});

	private final ConnectorOptions options = ConnectorOptions.builder()
		.connectTimeout(Duration.ofSeconds(1))
		.replyTimeout(Duration.ofSeconds(2))
		.build();

	private RpcServer server;
	private SocketConnector connector;

	@After
	public void tearDown() throws IOException {
		if (connector != null) {
			connector.close();
		}
		if (server != null) {
			server.close();
		}
	}

	@Test
	public void jsonTransportRoundTrip() throws IOException {
		server = new RpcServer(registry, new JsonRpcCodec());
		connector = SocketConnector.dial(server.getAddress(), new JsonRpcCodec(), options);

		assertEquals("echo:json", connector.call("EchoSv1.Echo", new EchoArgs("json"), String.class));
		assertEquals("echo:again", connector.call("EchoSv1.Echo", new EchoArgs("again"), String.class));
		assertEquals(2, server.getServedCount());
	}

	@Test
	public void binaryTransportRoundTrip() throws IOException {
		server = new RpcServer(registry, new BinaryRpcCodec());
		connector = SocketConnector.dial(server.getAddress(), new BinaryRpcCodec(), options);

		assertEquals("echo:gob", connector.call("EchoSv1.Echo", new EchoArgs("gob"), String.class));
	}

	@Test
	public void remoteUnsupportedMethodIsRecognised() throws IOException {
		server = new RpcServer(registry, new JsonRpcCodec());
		connector = SocketConnector.dial(server.getAddress(), new JsonRpcCodec(), options);

		try {
			connector.call("EchoSv1.Missing", new EchoArgs("x"), String.class);
			fail("remote does not serve the method");
		} catch (UnsupportedServiceMethodException e) {
			assertEquals("EchoSv1.Missing", e.getServiceMethod());
		}
		// 연결은 유지됨
		assertTrue(connector.isConnected());
	}

	@Test
	public void remoteFailureIsRemoteCallError() throws IOException {
		server = new RpcServer(registry, new BinaryRpcCodec());
		connector = SocketConnector.dial(server.getAddress(), new BinaryRpcCodec(), options);

		try {
			connector.call("EchoSv1.Fail", new EchoArgs("boom"), String.class);
			fail("handler throws");
		} catch (RemoteCallException e) {
			assertEquals("EchoSv1.Fail", e.getServiceMethod());
			assertEquals("SERVER_ERROR: boom", e.getRemoteError());
		}
	}

	@Test
	public void replyTypeMismatch() throws IOException {
		server = new RpcServer(registry, new JsonRpcCodec());
		connector = SocketConnector.dial(server.getAddress(), new JsonRpcCodec(), options);

		try {
			connector.call("EchoSv1.Echo", new EchoArgs("x"), Integer.class);
			fail("reply is a string");
		} catch (TransportException e) {
			assertTrue(e.getMessage().contains("Reply type mismatch"));
		}
	}

	@Test
	public void dialFailureIsDialException() throws IOException {
		int port;
		try (ServerSocket placeholder = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
			port = placeholder.getLocalPort();
		}
		String address = "127.0.0.1:" + port;

		try {
			SocketConnector.dial(address, new JsonRpcCodec(), options);
			fail("nothing listens on " + address);
		} catch (DialException e) {
			assertEquals(address, e.getAddress());
		}
	}

	@Test
	public void brokenConnectionIsRedialled() throws IOException {
		server = new RpcServer(registry, new JsonRpcCodec());
		connector = SocketConnector.dial(server.getAddress(), new JsonRpcCodec(), options);
		assertEquals("echo:1", connector.call("EchoSv1.Echo", new EchoArgs("1"), String.class));

		connector.close();
		assertFalse(connector.isConnected());

		assertEquals("echo:2", connector.call("EchoSv1.Echo", new EchoArgs("2"), String.class));
		assertTrue(connector.isConnected());
	}

	@Test
	public void poolFailsOverFromJsonToBinaryGroup() throws IOException {
		// Given: JSON 서버는 Echo를 모르고, 바이너리 서버만 처리
		MethodRegistry empty = new MethodRegistry();
		try (RpcServer jsonServer = new RpcServer(empty, new JsonRpcCodec());
		     RpcServer gobServer = new RpcServer(registry, new BinaryRpcCodec());
		     ConnectorPool pool = new ConnectorPool(options)) {
			pool.registerRemote("*json_caches", TransportKind.JSON, List.of(jsonServer.getAddress()));
			pool.registerRemote("*gob_caches", TransportKind.BINARY, List.of(gobServer.getAddress()));

			// When
			String reply = pool.call(Arrays.asList("*json_caches", "*gob_caches"), "EchoSv1.Echo",
				new EchoArgs("failover"), String.class);

			// Then
			assertEquals("echo:failover", reply);
			assertEquals(1, jsonServer.getServedCount());
			assertEquals(1, gobServer.getServedCount());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void addressNeedsPort() {
		SocketConnector.parseAddress("localhost");
	}
}
