package org.scriptonbasestar.loader.connector.rpc;

import lombok.experimental.UtilityClass;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * 길이 접두 프레임: 4바이트 길이(big-endian) + payload
 *
 * @author archmagece
 * @since 2025-03
 */
@UtilityClass
public class Frames {

	public static final int MAX_FRAME_SIZE = 16 * 1024 * 1024;

	public static void write(DataOutputStream out, byte[] payload) throws IOException {
		if (payload.length > MAX_FRAME_SIZE) {
			throw new IOException("Frame too large: " + payload.length);
		}
		out.writeInt(payload.length);
		out.write(payload);
		out.flush();
	}

	/**
	 * @throws java.io.EOFException the peer closed the connection
	 */
	public static byte[] read(DataInputStream in) throws IOException {
		int length = in.readInt();
		if (length < 0 || length > MAX_FRAME_SIZE) {
			throw new IOException("Invalid frame length: " + length);
		}
		byte[] payload = new byte[length];
		in.readFully(payload);
		return payload;
	}
}
