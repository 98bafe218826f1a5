package org.muma.respkv.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.ByteProcessor;
import org.muma.respkv.utils.NumberUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP 请求解码器 (每个连接一个实例，有状态)
 * <p>
 * 支持两种请求格式：
 * 1. Multibulk: *<count>\r\n 后跟 count 个 $<len>\r\n<data>\r\n
 * 2. Inline: 一行以空格分隔的文本 (telnet 场景)
 * <p>
 * 已经完整到达的头部和参数会立即消费并保存在解码器里，数据不够时下次从断点继续，
 * 一条分成很多段到达的大命令里每个字节只解析一次。
 * Netty 的 decode 循环会把 cumulation 里所有完整的命令依次取出，所以天然支持 Pipelining。
 */
public class RespDecoder extends ByteToMessageDecoder {

    // 与 Redis 默认值保持一致
    static final int MAX_MULTIBULK_LENGTH = 1024 * 1024;
    static final long MAX_BULK_LENGTH = 512L * 1024 * 1024;
    static final int MAX_INLINE_LENGTH = 64 * 1024;
    // 参数列表的预分配上限，更多的参数随到达逐步扩容
    static final int MAX_PREALLOC_ARGS = 1024;

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 进行中的 multibulk 请求：声明的参数个数 (-1 表示没有) 与已解析的参数
    private int expectedArgs = -1;
    private List<RedisMessage> pendingArgs;

    // 一旦解析失败，后续字节全部丢弃，等待连接关闭
    private boolean failed;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        RedisArray command;
        try {
            command = decodeCommand(in);
        } catch (ProtocolException e) {
            failed = true;
            throw e;
        }
        // *0 / *-1 / 空行：已消费但不产生命令
        if (command != null && command.size() > 0) {
            out.add(command);
        }
    }

    /**
     * 从 in 中尝试解出一条完整命令
     *
     * @return 完整命令；数据不够时返回 null (已完整的部分被消费并暂存，未完整的参数不移动 readerIndex)
     * @throws ProtocolException 数据格式错误
     */
    public RedisArray decodeCommand(ByteBuf in) {
        if (expectedArgs < 0) {
            if (!in.isReadable()) return null;

            int start = in.readerIndex();
            if (in.getByte(start) != '*') {
                return decodeInline(in);
            }

            int lineEnd = findLineEnd(in, start, "too big mbulk count string");
            if (lineEnd < 0) return null;

            long count = parseLength(in, start + 1, lineEnd, "invalid multibulk length");
            if (count > MAX_MULTIBULK_LENGTH) {
                throw new ProtocolException("invalid multibulk length");
            }
            in.readerIndex(lineEnd + 2);
            if (count <= 0) {
                return RedisArray.EMPTY;
            }
            expectedArgs = (int) count;
            pendingArgs = new ArrayList<>(Math.min(expectedArgs, MAX_PREALLOC_ARGS));
        }

        while (pendingArgs.size() < expectedArgs) {
            BulkString arg = decodeBulk(in);
            if (arg == null) return null;
            pendingArgs.add(arg);
        }

        RedisArray command = new RedisArray(pendingArgs.toArray(new RedisMessage[0]));
        expectedArgs = -1;
        pendingArgs = null;
        return command;
    }

    /**
     * 是否有解析了一半的 multibulk 请求
     */
    boolean hasPendingCommand() {
        return expectedArgs >= 0;
    }

    // $<len>\r\n<data>\r\n 全部到齐才消费，否则返回 null 且不移动 readerIndex
    private static BulkString decodeBulk(ByteBuf in) {
        int pos = in.readerIndex();
        if (pos >= in.writerIndex()) return null;

        byte marker = in.getByte(pos);
        if (marker != '$') {
            throw new ProtocolException("expected '$', got '" + (char) marker + "'");
        }

        int end = findLineEnd(in, pos, "too big bulk count string");
        if (end < 0) return null;

        long length = parseLength(in, pos + 1, end, "invalid bulk length");
        if (length < 0 || length > MAX_BULK_LENGTH) {
            throw new ProtocolException("invalid bulk length");
        }

        int dataStart = end + 2;
        // payload + CRLF 还没到齐
        if ((long) in.writerIndex() - dataStart < length + 2) return null;

        int dataEnd = dataStart + (int) length;
        if (in.getByte(dataEnd) != CR || in.getByte(dataEnd + 1) != LF) {
            throw new ProtocolException("bulk length does not match payload");
        }

        byte[] content = new byte[(int) length];
        in.getBytes(dataStart, content);
        in.readerIndex(dataEnd + 2);
        return new BulkString(content);
    }

    // 返回 CR 的位置 (其后紧跟 LF)；行未结束返回 -1
    private static int findLineEnd(ByteBuf in, int from, String tooLongMessage) {
        int searchLength = in.writerIndex() - from;
        int cr = in.forEachByte(from, searchLength, ByteProcessor.FIND_CR);
        if (cr < 0 || cr + 1 >= in.writerIndex()) {
            if (searchLength > MAX_INLINE_LENGTH) {
                throw new ProtocolException(tooLongMessage);
            }
            return -1;
        }
        if (in.getByte(cr + 1) != LF) {
            throw new ProtocolException("expected CRLF");
        }
        return cr;
    }

    // 解析 [from, to) 区间内的十进制整数，规则同 Redis (不接受 '+'、前导 0)
    private static long parseLength(ByteBuf in, int from, int to, String errorMessage) {
        if (to <= from || to - from > 20) {
            throw new ProtocolException(errorMessage);
        }
        byte[] digits = new byte[to - from];
        in.getBytes(from, digits);
        try {
            return NumberUtils.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new ProtocolException(errorMessage);
        }
    }

    // --- Inline 命令 ---

    private static RedisArray decodeInline(ByteBuf in) {
        int start = in.readerIndex();
        int lf = in.forEachByte(start, in.readableBytes(), ByteProcessor.FIND_LF);
        if (lf < 0) {
            if (in.readableBytes() > MAX_INLINE_LENGTH) {
                throw new ProtocolException("too big inline request");
            }
            return null;
        }

        int end = lf;
        if (end > start && in.getByte(end - 1) == CR) end--;
        String line = in.toString(start, end - start, StandardCharsets.ISO_8859_1);
        in.readerIndex(lf + 1);

        List<String> parts = splitArgs(line);
        RedisMessage[] elements = new RedisMessage[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            elements[i] = new BulkString(parts.get(i).getBytes(StandardCharsets.ISO_8859_1));
        }
        return new RedisArray(elements);
    }

    /**
     * 按空白切分参数，支持 "双引号" (含 \n \r \t \" \\ 转义) 与 '单引号'
     */
    static List<String> splitArgs(String line) {
        List<String> result = new ArrayList<>();
        int i = 0;
        int n = line.length();
        while (true) {
            while (i < n && Character.isWhitespace(line.charAt(i))) i++;
            if (i >= n) return result;

            StringBuilder current = new StringBuilder();
            boolean inDouble = false;
            boolean inSingle = false;
            boolean done = false;
            while (!done) {
                if (i >= n) {
                    if (inDouble || inSingle) throw new ProtocolException("unbalanced quotes in request");
                    break;
                }
                char c = line.charAt(i);
                if (inDouble) {
                    if (c == '\\' && i + 1 < n) {
                        char next = line.charAt(++i);
                        switch (next) {
                            case 'n' -> current.append('\n');
                            case 'r' -> current.append('\r');
                            case 't' -> current.append('\t');
                            default -> current.append(next);
                        }
                    } else if (c == '"') {
                        // 闭合引号后必须是空白或行尾
                        if (i + 1 < n && !Character.isWhitespace(line.charAt(i + 1))) {
                            throw new ProtocolException("unbalanced quotes in request");
                        }
                        done = true;
                    } else {
                        current.append(c);
                    }
                } else if (inSingle) {
                    if (c == '\\' && i + 1 < n && line.charAt(i + 1) == '\'') {
                        current.append('\'');
                        i++;
                    } else if (c == '\'') {
                        if (i + 1 < n && !Character.isWhitespace(line.charAt(i + 1))) {
                            throw new ProtocolException("unbalanced quotes in request");
                        }
                        done = true;
                    } else {
                        current.append(c);
                    }
                } else if (Character.isWhitespace(c)) {
                    done = true;
                } else if (c == '"') {
                    inDouble = true;
                } else if (c == '\'') {
                    inSingle = true;
                } else {
                    current.append(c);
                }
                i++;
            }
            result.add(current.toString());
        }
    }
}
