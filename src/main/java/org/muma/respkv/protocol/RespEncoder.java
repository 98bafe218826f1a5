package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

/**
 * RESP 回复编码器
 * 无状态，所有连接共享一个实例
 */
@ChannelHandler.Sharable
public class RespEncoder extends MessageToByteEncoder<RedisMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_LENGTH = "-1".getBytes(StandardCharsets.US_ASCII);

    @Override
    protected void encode(ChannelHandlerContext ctx, RedisMessage msg, ByteBuf out) {
        write(out, msg);
    }

    /**
     * 递归写入，数组元素可以是任意类型 (包括嵌套数组)
     */
    public static void write(ByteBuf out, RedisMessage msg) {
        if (msg instanceof SimpleString s) {
            out.writeByte('+');
            out.writeCharSequence(singleLine(s.content()), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof ErrorMessage e) {
            out.writeByte('-');
            out.writeCharSequence(singleLine(e.content()), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        } else if (msg instanceof RedisInteger i) {
            out.writeByte(':');
            writeNumber(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.content() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RedisArray a) {
            out.writeByte('*');
            if (a.elements() == null) {
                out.writeBytes(NULL_LENGTH);
                out.writeBytes(CRLF);
            } else {
                writeNumber(out, a.elements().length);
                for (RedisMessage element : a.elements()) {
                    write(out, element);
                }
            }
        }
    }

    // 单行回复里不能出现 CR / LF，否则客户端会错位
    private static String singleLine(String s) {
        if (s.indexOf('\r') < 0 && s.indexOf('\n') < 0) return s;
        return s.replace('\r', ' ').replace('\n', ' ');
    }

    // 数字 + CRLF
    private static void writeNumber(ByteBuf out, long value) {
        out.writeCharSequence(Long.toString(value), StandardCharsets.US_ASCII);
        out.writeBytes(CRLF);
    }
}
