package org.muma.mini.kvstore.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.nio.charset.StandardCharsets;

public class RespEncoder extends MessageToByteEncoder<RespMessage> {

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.UTF_8);
    private static final byte[] MINUS_ONE = "-1".getBytes(StandardCharsets.UTF_8);

    @Override
    protected void encode(ChannelHandlerContext ctx, RespMessage msg, ByteBuf out) {
        write(out, msg);
    }

    // 数组元素递归写入
    static void write(ByteBuf out, RespMessage msg) {
        if (msg instanceof RespInteger i) {
            out.writeByte(':');
            writeAscii(out, i.value());
        } else if (msg instanceof BulkString b) {
            out.writeByte('$');
            if (b.isNull()) {
                out.writeBytes(MINUS_ONE);
                out.writeBytes(CRLF);
            } else {
                writeAscii(out, b.content().length);
                out.writeBytes(b.content());
                out.writeBytes(CRLF);
            }
        } else if (msg instanceof RespArray a) {
            out.writeByte('*');
            if (a.isNull()) {
                out.writeBytes(MINUS_ONE);
                out.writeBytes(CRLF);
            } else {
                writeAscii(out, a.elements().length);
                for (RespMessage element : a.elements()) {
                    write(out, element);
                }
            }
        }
    }

    private static void writeAscii(ByteBuf out, long value) {
        out.writeBytes(String.valueOf(value).getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(CRLF);
    }
}
