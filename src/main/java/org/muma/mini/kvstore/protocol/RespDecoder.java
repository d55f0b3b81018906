package org.muma.mini.kvstore.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ReplayingDecoder;

import java.util.List;

/**
 * RESP 解码器 (Bulk String / Integer / Array)
 * 数据不完整时 ReplayingDecoder 会回滚读指针，等下一批字节到达后从头重放
 */
public class RespDecoder extends ReplayingDecoder<Void> {

    private static final byte COLON_BYTE = ':';
    private static final byte DOLLAR_BYTE = '$';
    private static final byte ASTERISK_BYTE = '*';

    private static final byte CR = '\r';
    private static final byte LF = '\n';

    // 单个 bulk 上限 512MB, 与 Redis proto-max-bulk-len 一致
    static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    static final int MAX_ARRAY_LENGTH = 1024 * 1024;
    private static final int MAX_LINE_LENGTH = 64;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        out.add(readNextObject(in));
    }

    private RespMessage readNextObject(ByteBuf in) {
        byte type = in.readByte();
        return switch (type) {
            case COLON_BYTE -> new RespInteger(readLong(in));
            case DOLLAR_BYTE -> decodeBulkString(in);
            case ASTERISK_BYTE -> decodeArray(in);
            default -> throw new IllegalStateException("Unknown RESP type byte: 0x" + Integer.toHexString(type & 0xff));
        };
    }

    // $<length>\r\n<data>\r\n
    private BulkString decodeBulkString(ByteBuf in) {
        long length = readLong(in);
        if (length == -1) {
            return BulkString.NULL;
        }
        if (length < -1 || length > MAX_BULK_LENGTH) {
            throw new IllegalStateException("Invalid bulk length: " + length);
        }

        // readSlice 在数据不够时先触发重放, 内容到齐之后才拷贝
        byte[] content = ByteBufUtil.getBytes(in.readSlice((int) length));
        readCRLF(in);
        return new BulkString(content);
    }

    // *<count>\r\n<element1>...<elementN>
    private RespArray decodeArray(ByteBuf in) {
        long count = readLong(in);
        if (count == -1) {
            return new RespArray(null);
        }
        if (count < -1 || count > MAX_ARRAY_LENGTH) {
            throw new IllegalStateException("Invalid array length: " + count);
        }

        RespMessage[] elements = new RespMessage[(int) count];
        for (int i = 0; i < count; i++) {
            elements[i] = readNextObject(in);
        }
        return new RespArray(elements);
    }

    private String readLine(ByteBuf in) {
        StringBuilder sb = new StringBuilder();
        while (true) {
            byte b = in.readByte();
            if (b == CR) {
                if (in.readByte() != LF) {
                    throw new IllegalStateException("Expected LF after CR");
                }
                return sb.toString();
            }
            if (sb.length() >= MAX_LINE_LENGTH) {
                throw new IllegalStateException("Header line too long");
            }
            sb.append((char) b);
        }
    }

    private long readLong(ByteBuf in) {
        String line = readLine(in);
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer: " + line);
        }
    }

    private void readCRLF(ByteBuf in) {
        byte b1 = in.readByte();
        byte b2 = in.readByte();
        if (b1 != CR || b2 != LF) {
            throw new IllegalStateException("Expected CRLF");
        }
    }
}
