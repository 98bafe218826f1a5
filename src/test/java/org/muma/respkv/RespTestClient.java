package org.muma.respkv;

import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;

/**
 * 测试用的最小 RESP 客户端 (阻塞 Socket)
 */
class RespTestClient implements Closeable {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;

    RespTestClient(int port) throws IOException {
        this.socket = new Socket("127.0.0.1", port);
        this.socket.setSoTimeout(5000);
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = socket.getOutputStream();
    }

    RedisMessage call(String... args) throws IOException {
        send(args);
        return readReply();
    }

    void send(String... args) throws IOException {
        out.write(encode(args));
        out.flush();
    }

    void sendRaw(String raw) throws IOException {
        out.write(raw.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    static byte[] encode(String... args) {
        StringBuilder sb = new StringBuilder();
        sb.append('*').append(args.length).append("\r\n");
        for (String arg : args) {
            byte[] bytes = arg.getBytes(StandardCharsets.UTF_8);
            sb.append('$').append(bytes.length).append("\r\n").append(arg).append("\r\n");
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    RedisMessage readReply() throws IOException {
        int type = in.read();
        if (type < 0) throw new EOFException("Connection closed by server");
        String line = readLine();
        switch (type) {
            case '+':
                return new SimpleString(line);
            case '-':
                return new ErrorMessage(line);
            case ':':
                return new RedisInteger(Long.parseLong(line));
            case '$': {
                int len = Integer.parseInt(line);
                if (len < 0) return BulkString.NULL;
                byte[] data = in.readNBytes(len);
                readLine();
                return new BulkString(data);
            }
            case '*': {
                int count = Integer.parseInt(line);
                if (count < 0) return RedisArray.NULL;
                RedisMessage[] elements = new RedisMessage[count];
                for (int i = 0; i < count; i++) {
                    elements[i] = readReply();
                }
                return new RedisArray(elements);
            }
            default:
                throw new IOException("Unexpected reply type: " + (char) type);
        }
    }

    /**
     * 服务端是否已经关闭连接 (读到 EOF)
     */
    boolean isClosedByServer() throws IOException {
        try {
            return in.read() < 0;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (SocketException e) {
            // Connection reset
            return true;
        }
    }

    private String readLine() throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != '\r') {
            if (b < 0) throw new EOFException("Connection closed by server");
            buf.write(b);
        }
        if (in.read() != '\n') throw new IOException("Expected LF");
        return buf.toString(StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
