package org.muma.mini.kvstore.protocol;

import java.nio.charset.StandardCharsets;

/**
 * 响应: 回显 key, 成功标志, 以及 LOAD 成功时的 value (其余情况为 null)
 */
public record StoreResponse(String key, boolean success, byte[] value) {

    private static final StoreResponse MALFORMED = new StoreResponse("", false, null);

    public static StoreResponse ok(String key) {
        return new StoreResponse(key, true, null);
    }

    public static StoreResponse ok(String key, byte[] value) {
        return new StoreResponse(key, true, value);
    }

    public static StoreResponse failed(String key) {
        return new StoreResponse(key, false, null);
    }

    /** 请求无法解码时的响应: 空 key, success=false */
    public static StoreResponse malformed() {
        return MALFORMED;
    }

    public String valueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }
}
