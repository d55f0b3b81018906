package org.muma.mini.kvstore.protocol;

/**
 * RESP 帧与 StoreRequest / StoreResponse 之间的转换.
 * <p>
 * 请求: [STORE key value] | [LOAD key] | [ERASE key], 全部为 Bulk String.
 * 响应: [key, :1|:0, value|nil]
 */
public final class StoreMessageCodec {

    private StoreMessageCodec() {
    }

    /**
     * @throws IllegalArgumentException 帧结构不合法 (非数组 / 空数组 / 元素不是 Bulk String / 参数个数不对)
     */
    public static StoreRequest decodeRequest(RespMessage msg) {
        if (!(msg instanceof RespArray array) || array.isNull() || array.size() == 0) {
            throw new IllegalArgumentException("request must be a non-empty array");
        }
        RespMessage[] elements = array.elements();
        for (RespMessage element : elements) {
            if (!(element instanceof BulkString bulk) || bulk.isNull()) {
                throw new IllegalArgumentException("request elements must be non-null bulk strings");
            }
        }

        String rawType = ((BulkString) elements[0]).asString();
        StoreRequestType type = StoreRequestType.parse(rawType);
        if (type == StoreRequestType.UNKNOWN) {
            // 未知操作只要求带 key, 交给 StoreService 返回失败并回显 key
            if (elements.length < 2) {
                throw new IllegalArgumentException("unknown operation '" + rawType + "' without key");
            }
            return new StoreRequest(type, rawType, ((BulkString) elements[1]).asString(), null);
        }
        if (elements.length != type.arity()) {
            throw new IllegalArgumentException("wrong number of arguments for '" + type + "'");
        }

        String key = ((BulkString) elements[1]).asString();
        byte[] value = type == StoreRequestType.STORE ? ((BulkString) elements[2]).content() : null;
        return new StoreRequest(type, rawType, key, value);
    }

    public static RespArray encodeRequest(StoreRequest request) {
        BulkString op = new BulkString(request.rawType() != null ? request.rawType() : request.type().name());
        BulkString key = new BulkString(request.key());
        if (request.type() == StoreRequestType.STORE) {
            return new RespArray(new RespMessage[]{op, key, new BulkString(request.value())});
        }
        return new RespArray(new RespMessage[]{op, key});
    }

    public static RespArray encodeResponse(StoreResponse response) {
        return new RespArray(new RespMessage[]{
                new BulkString(response.key()),
                new RespInteger(response.success() ? 1 : 0),
                response.value() == null ? BulkString.NULL : new BulkString(response.value())
        });
    }

    /**
     * @throws IllegalArgumentException 响应帧结构不合法
     */
    public static StoreResponse decodeResponse(RespMessage msg) {
        if (!(msg instanceof RespArray array) || array.size() != 3) {
            throw new IllegalArgumentException("response must be a 3-element array");
        }
        RespMessage[] elements = array.elements();
        if (!(elements[0] instanceof BulkString key)
                || !(elements[1] instanceof RespInteger success)
                || !(elements[2] instanceof BulkString value)) {
            throw new IllegalArgumentException("unexpected response element types");
        }
        String keyStr = key.isNull() ? "" : key.asString();
        return new StoreResponse(keyStr, success.value() != 0, value.content());
    }
}
