package org.muma.mini.kvstore.protocol;

// 数组 (*) - elements 为 null 表示 *-1
public record RespArray(RespMessage[] elements) implements RespMessage {

    public static RespArray ofBulk(String... parts) {
        RespMessage[] elements = new RespMessage[parts.length];
        for (int i = 0; i < parts.length; i++) {
            elements[i] = new BulkString(parts[i]);
        }
        return new RespArray(elements);
    }

    public boolean isNull() {
        return elements == null;
    }

    public int size() {
        return elements == null ? 0 : elements.length;
    }
}
