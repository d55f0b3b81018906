package org.muma.mini.kvstore.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class StoreMessageCodecTest {

    @Test
    void testDecodeKnownRequests() {
        StoreRequest store = StoreMessageCodec.decodeRequest(RespArray.ofBulk("STORE", "a", "1"));
        assertEquals(StoreRequestType.STORE, store.type());
        assertEquals("a", store.key());
        assertArrayEquals("1".getBytes(StandardCharsets.UTF_8), store.value());

        StoreRequest load = StoreMessageCodec.decodeRequest(RespArray.ofBulk("load", "a"));
        assertEquals(StoreRequestType.LOAD, load.type());
        assertNull(load.value());

        StoreRequest erase = StoreMessageCodec.decodeRequest(RespArray.ofBulk("Erase", "a"));
        assertEquals(StoreRequestType.ERASE, erase.type());
    }

    @Test
    void testUnknownOperationKeepsKey() {
        StoreRequest request = StoreMessageCodec.decodeRequest(RespArray.ofBulk("FLUSHALL", "a", "extra"));
        assertEquals(StoreRequestType.UNKNOWN, request.type());
        assertEquals("FLUSHALL", request.rawType());
        assertEquals("a", request.key());
        assertFalse(request.type().isMutation());
    }

    @Test
    void testMalformedRequestsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(new RespInteger(1)));
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(new RespArray(null)));
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(RespArray.ofBulk()));
        // 参数个数不对
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(RespArray.ofBulk("STORE", "a")));
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(RespArray.ofBulk("LOAD", "a", "b")));
        // 未知操作且没有 key
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(RespArray.ofBulk("PING")));
        // 元素类型不对
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(
                new RespArray(new RespMessage[]{new BulkString("LOAD"), new RespInteger(7)})));
        assertThrows(IllegalArgumentException.class, () -> StoreMessageCodec.decodeRequest(
                new RespArray(new RespMessage[]{new BulkString("LOAD"), BulkString.NULL})));
    }

    @Test
    void testResponseDecodesBack() {
        StoreResponse original = StoreResponse.ok("k", "v".getBytes(StandardCharsets.UTF_8));
        StoreResponse decoded = StoreMessageCodec.decodeResponse(StoreMessageCodec.encodeResponse(original));

        assertEquals("k", decoded.key());
        assertTrue(decoded.success());
        assertEquals("v", decoded.valueAsString());

        StoreResponse malformed = StoreMessageCodec.decodeResponse(StoreMessageCodec.encodeResponse(StoreResponse.malformed()));
        assertEquals("", malformed.key());
        assertFalse(malformed.success());
        assertNull(malformed.value());
    }
}
