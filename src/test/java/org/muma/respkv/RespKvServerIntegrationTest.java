package org.muma.respkv;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.respkv.config.ServerConfig;
import org.muma.respkv.protocol.BulkString;
import org.muma.respkv.protocol.ErrorMessage;
import org.muma.respkv.protocol.RedisArray;
import org.muma.respkv.protocol.RedisInteger;
import org.muma.respkv.protocol.RedisMessage;
import org.muma.respkv.protocol.SimpleString;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端测试：真实端口 + 真实 Socket
 */
class RespKvServerIntegrationTest {

    private RespKvServer server;
    private int port;

    private static ServerConfig testConfig(int port) {
        ServerConfig config = new ServerConfig();
        config.setBindAddress("127.0.0.1");
        config.setPort(port);
        config.setWorkerThreads(4);
        config.setSweepIntervalMs(20);
        return config;
    }

    @BeforeEach
    void setUp() {
        // 端口 0 由系统分配
        server = new RespKvServer(testConfig(0));
        server.start();
        port = server.getBoundPort();
    }

    @AfterEach
    void tearDown() {
        server.shutdown();
    }

    private static String str(RedisMessage msg) {
        return assertInstanceOf(BulkString.class, msg).asString();
    }

    @Test
    void testSetGetRoundTrip() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(SimpleString.OK, client.call("SET", "greeting", "héllo wörld"));
            assertEquals("héllo wörld", str(client.call("GET", "greeting")));
            assertEquals(BulkString.NULL, client.call("GET", "missing"));
        }
    }

    @Test
    void testDelThenExists() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            client.call("SET", "k", "v");
            assertEquals(new RedisInteger(1), client.call("DEL", "k"));
            assertEquals(new RedisInteger(0), client.call("EXISTS", "k"));
        }
    }

    @Test
    void testExpiredKeyObservedAsAbsent() throws Exception {
        try (RespTestClient client = new RespTestClient(port)) {
            client.call("SET", "temp", "v", "PX", "100");
            Thread.sleep(250);

            assertEquals(BulkString.NULL, client.call("GET", "temp"));
            assertEquals(BulkString.NULL, client.call("GET", "temp"));
            assertEquals(new RedisInteger(-2), client.call("TTL", "temp"));
        }
    }

    @Test
    void testSweepReclaimsUntouchedKeys() throws Exception {
        try (RespTestClient client = new RespTestClient(port)) {
            for (int i = 0; i < 50; i++) {
                client.call("SET", "tmp:" + i, "v", "PX", "50");
            }
            client.call("SET", "keep", "v");

            long deadline = System.currentTimeMillis() + 5000;
            while (server.getStorage().size() > 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, server.getStorage().size());
        }
    }

    @Test
    void testConcurrentIncrFromManyConnections() throws Exception {
        int clients = 10;
        int perClient = 200;
        ExecutorService pool = Executors.newFixedThreadPool(clients);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int c = 0; c < clients; c++) {
                futures.add(pool.submit(() -> {
                    try (RespTestClient client = new RespTestClient(port)) {
                        for (int i = 0; i < perClient; i++) {
                            assertInstanceOf(RedisInteger.class, client.call("INCR", "counter"));
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(String.valueOf(clients * perClient), str(client.call("GET", "counter")));
        }
    }

    @Test
    void testWrongTypeKeepsOriginalValue() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            client.call("SET", "s", "text");

            RedisMessage reply = client.call("LPUSH", "s", "x");
            assertTrue(assertInstanceOf(ErrorMessage.class, reply).content().startsWith("WRONGTYPE"));
            assertEquals("text", str(client.call("GET", "s")));
        }
    }

    @Test
    void testPipelinedCommandsReplyInOrder() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            byte[] a = RespTestClient.encode("SET", "a", "1");
            byte[] b = RespTestClient.encode("SET", "a", "2");
            byte[] c = RespTestClient.encode("GET", "a");
            client.sendRaw(new String(a) + new String(b) + new String(c));

            assertEquals(SimpleString.OK, client.readReply());
            assertEquals(SimpleString.OK, client.readReply());
            assertEquals("2", str(client.readReply()));
        }
    }

    @Test
    void testMalformedRequestClosesOnlyThatConnection() throws IOException {
        try (RespTestClient bad = new RespTestClient(port)) {
            bad.sendRaw("*1\r\n$10\r\nPING\r\n");
            bad.sendRaw("padding!\r\n");

            RedisMessage reply = bad.readReply();
            assertTrue(assertInstanceOf(ErrorMessage.class, reply).content().startsWith("ERR Protocol error"));
            assertTrue(bad.isClosedByServer());
        }

        try (RespTestClient good = new RespTestClient(port)) {
            assertEquals(SimpleString.PONG, good.call("PING"));
        }
    }

    @Test
    void testKeysAfterDelete() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            client.call("SET", "a", "1");
            client.call("SET", "b", "2");
            client.call("DEL", "a");

            RedisArray keys = assertInstanceOf(RedisArray.class, client.call("KEYS", "*"));
            assertEquals(1, keys.size());
            assertEquals("b", keys.arg(0).asString());
        }
    }

    @Test
    void testInlineCommandAndQuit() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            client.sendRaw("PING\r\n");
            assertEquals(SimpleString.PONG, client.readReply());

            assertEquals(SimpleString.OK, client.call("QUIT"));
            assertTrue(client.isClosedByServer());
        }
    }

    @Test
    void testBindConflictFailsStartup() {
        RespKvServer second = new RespKvServer(testConfig(port));
        assertThrows(ServerStartupException.class, second::start);
        second.shutdown();
    }

    @Test
    void testShutdownIsIdempotent() throws IOException {
        try (RespTestClient client = new RespTestClient(port)) {
            assertEquals(SimpleString.PONG, client.call("PING"));
        }
        server.shutdown();
        server.shutdown();
    }
}
