package org.muma.dredis.server;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.muma.dredis.command.CommandDispatcher;
import org.muma.dredis.protocol.RespDecoder;
import org.muma.dredis.protocol.RespEncoder;
import org.muma.dredis.store.impl.MemoryBackend;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端：原始字节 -> 解码 -> 命令 -> 后端 -> 编码 -> 原始字节
 */
class RedisCommandHandlerTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        RedisCommandHandler handler = new RedisCommandHandler(new CommandDispatcher(new MemoryBackend()));
        channel = new EmbeddedChannel(new RespDecoder(), new RespEncoder(), handler);
    }

    private void send(String request) {
        channel.writeInbound(Unpooled.copiedBuffer(request, StandardCharsets.UTF_8));
    }

    private String reply() {
        ByteBuf out = channel.readOutbound();
        assertNotNull(out, "expected a reply");
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    private String call(String request) {
        send(request);
        return reply();
    }

    @Test
    void testSetThenGet() {
        assertEquals("+OK\r\n", call("*3\r\n$3\r\nset\r\n$3\r\nfoo\r\n$3\r\nbar\r\n"));
        assertEquals("$3\r\nbar\r\n", call("*2\r\n$3\r\nget\r\n$3\r\nfoo\r\n"));
    }

    @Test
    void testGetOnEmptyStoreReturnsNull() {
        assertEquals("_\r\n", call("*2\r\n$3\r\nget\r\n$5\r\nhello\r\n"));
    }

    @Test
    void testHMGetOmitsAbsentFields() {
        assertEquals("+OK\r\n", call("*4\r\n$4\r\nhset\r\n$3\r\nkey\r\n$5\r\nfield\r\n$5\r\nvalue\r\n"));
        assertEquals("*1\r\n$5\r\nvalue\r\n",
                call("*4\r\n$5\r\nhmget\r\n$3\r\nkey\r\n$5\r\nfield\r\n$5\r\nother\r\n"));
    }

    @Test
    void testHGetAllRepliesSortedMap() {
        call("*4\r\n$4\r\nhset\r\n$1\r\nh\r\n$1\r\nb\r\n$1\r\n2\r\n");
        call("*4\r\n$4\r\nhset\r\n$1\r\nh\r\n$1\r\na\r\n$1\r\n1\r\n");

        assertEquals("%2\r\n+a\r\n$1\r\n1\r\n+b\r\n$1\r\n2\r\n", call("*2\r\n$7\r\nhgetall\r\n$1\r\nh\r\n"));
        assertEquals("*0\r\n", call("*2\r\n$7\r\nHGETALL\r\n$4\r\nnone\r\n"));
    }

    @Test
    void testSAddAndSIsMember() {
        assertEquals(":1\r\n", call("*3\r\n$4\r\nsadd\r\n$4\r\nskey\r\n$7\r\nsvalue1\r\n"));
        assertEquals(":0\r\n", call("*3\r\n$4\r\nsadd\r\n$4\r\nskey\r\n$7\r\nsvalue1\r\n"));
        assertEquals(":1\r\n", call("*3\r\n$9\r\nsismember\r\n$4\r\nskey\r\n$7\r\nsvalue1\r\n"));
        assertEquals(":0\r\n", call("*3\r\n$9\r\nsismember\r\n$4\r\nskey\r\n$7\r\nsvalue2\r\n"));
    }

    @Test
    void testEcho() {
        assertEquals("+mecho\r\n", call("*2\r\n$4\r\necho\r\n$5\r\nmecho\r\n"));
    }

    @Test
    void testUnknownCommandRepliesOk() {
        assertEquals("+OK\r\n", call("*1\r\n$4\r\nnoop\r\n"));
    }

    @Test
    void testRequestArrivingByteByByte() {
        String request = "*2\r\n$3\r\nget\r\n$5\r\nhello\r\n";
        for (int i = 0; i < request.length() - 1; i++) {
            send(request.substring(i, i + 1));
            assertNull(channel.readOutbound());
        }
        send(request.substring(request.length() - 1));
        assertEquals("_\r\n", reply());
    }

    @Test
    void testRepliesKeepRequestOrder() {
        send("*3\r\n$3\r\nset\r\n$1\r\nk\r\n$1\r\n1\r\n*2\r\n$3\r\nget\r\n$1\r\nk\r\n*1\r\n$4\r\nping\r\n");

        assertEquals("+OK\r\n", reply());
        assertEquals("$1\r\n1\r\n", reply());
        assertEquals("+OK\r\n", reply());
    }

    @Test
    void testCommandErrorKeepsConnectionOpen() {
        assertEquals("-ERR get command must have exactly 1 argument\r\n",
                call("*3\r\n$3\r\nget\r\n$5\r\nhello\r\n$5\r\nbogus\r\n"));
        assertTrue(channel.isActive());

        assertEquals("-ERR Command must be an Array\r\n", call("+PING\r\n"));
        assertTrue(channel.isActive());
    }

    @Test
    void testProtocolErrorClosesConnection() {
        assertEquals("-ERR Protocol error: Invalid frame type: '!'\r\n", call("!oops\r\n"));
        assertFalse(channel.isOpen());
    }

    @Test
    void testDeeplyNestedRequestIsProtocolError() {
        assertEquals("-ERR Protocol error: Frame nesting exceeds 512 levels\r\n",
                call("*1\r\n".repeat(100_000) + ":1\r\n"));
        assertFalse(channel.isOpen());
    }

    @Test
    void testEchoWithLineBreakRepliesBulkString() {
        assertEquals("$4\r\na\r\nb\r\n", call("*2\r\n$4\r\necho\r\n$4\r\na\r\nb\r\n"));
        assertTrue(channel.isActive());
    }
}
