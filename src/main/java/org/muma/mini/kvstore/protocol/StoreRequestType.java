package org.muma.mini.kvstore.protocol;

import java.util.Locale;

public enum StoreRequestType {
    STORE(3),
    LOAD(2),
    ERASE(2),
    /** 无法识别的操作, 只要带了 key 就能通过解码, 由 StoreService 返回失败 */
    UNKNOWN(-1);

    // 包含操作名本身在内的参数个数
    private final int arity;

    StoreRequestType(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }

    public boolean isMutation() {
        return this == STORE || this == ERASE;
    }

    public static StoreRequestType parse(String name) {
        if (name == null) return UNKNOWN;
        return switch (name.toUpperCase(Locale.ROOT)) {
            case "STORE" -> STORE;
            case "LOAD" -> LOAD;
            case "ERASE" -> ERASE;
            default -> UNKNOWN;
        };
    }
}
