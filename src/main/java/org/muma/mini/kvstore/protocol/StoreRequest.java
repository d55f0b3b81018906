package org.muma.mini.kvstore.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * 一次 STORE / LOAD / ERASE 请求. value 只在 STORE 时非空.
 * rawType 保留客户端发来的原始操作名, 方便 UNKNOWN 时打日志.
 */
public record StoreRequest(StoreRequestType type, String rawType, String key, byte[] value) {

    public StoreRequest {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(key, "key");
    }

    public static StoreRequest store(String key, byte[] value) {
        return new StoreRequest(StoreRequestType.STORE, "STORE", key, Objects.requireNonNull(value, "value"));
    }

    public static StoreRequest store(String key, String value) {
        return store(key, value.getBytes(StandardCharsets.UTF_8));
    }

    public static StoreRequest load(String key) {
        return new StoreRequest(StoreRequestType.LOAD, "LOAD", key, null);
    }

    public static StoreRequest erase(String key) {
        return new StoreRequest(StoreRequestType.ERASE, "ERASE", key, null);
    }
}
