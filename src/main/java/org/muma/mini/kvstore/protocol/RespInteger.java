package org.muma.mini.kvstore.protocol;

// 整数 (:)
public record RespInteger(long value) implements RespMessage {
}
