package org.muma.mini.kvstore.protocol;

import java.nio.charset.StandardCharsets;

// 批量字符串 ($) - 支持 null (表示 $-1)
public record BulkString(byte[] content) implements RespMessage {

    public static final BulkString NULL = new BulkString((byte[]) null);

    public BulkString(String s) {
        this(s == null ? null : s.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isNull() {
        return content == null;
    }

    public String asString() {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }
}
