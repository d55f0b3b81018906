package org.muma.mini.kvstore.protocol;

// 密封接口，限制实现类
public sealed interface RespMessage permits BulkString, RespInteger, RespArray {
}
