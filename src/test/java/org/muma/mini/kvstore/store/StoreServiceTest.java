package org.muma.mini.kvstore.store;

import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.EventExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.muma.mini.kvstore.persist.DatabaseFile;
import org.muma.mini.kvstore.persist.SaveBackoff;
import org.muma.mini.kvstore.protocol.StoreRequest;
import org.muma.mini.kvstore.protocol.StoreRequestType;
import org.muma.mini.kvstore.protocol.StoreResponse;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class StoreServiceTest {

    @TempDir
    Path tempDir;

    private DefaultEventExecutor realExecutor;

    @AfterEach
    void tearDown() {
        if (realExecutor != null) {
            realExecutor.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly();
        }
    }

    private Path storePath() {
        return tempDir.resolve("store.db");
    }

    private StoreService synchronousService() {
        return new StoreService(new DatabaseFile(storePath()), new SaveBackoff(Duration.ZERO, Duration.ZERO), mock(EventExecutor.class));
    }

    private static StoreRequest unknown(String op, String key) {
        return new StoreRequest(StoreRequestType.UNKNOWN, op, key, null);
    }

    @Test
    void testStoreLoadEraseScenario() {
        StoreService service = synchronousService();

        StoreResponse stored = service.handle(StoreRequest.store("a", "1"));
        assertEquals("a", stored.key());
        assertTrue(stored.success());
        assertNull(stored.value());

        StoreResponse loaded = service.handle(StoreRequest.load("a"));
        assertEquals("a", loaded.key());
        assertTrue(loaded.success());
        assertEquals("1", loaded.valueAsString());

        StoreResponse erased = service.handle(StoreRequest.erase("a"));
        assertEquals("a", erased.key());
        assertTrue(erased.success());

        StoreResponse missing = service.handle(StoreRequest.load("a"));
        assertEquals("a", missing.key());
        assertFalse(missing.success());
        assertNull(missing.value());
    }

    @Test
    void testStoreOverwrites() {
        StoreService service = synchronousService();
        service.handle(StoreRequest.store("k", "old"));
        service.handle(StoreRequest.store("k", "new"));

        assertEquals("new", service.handle(StoreRequest.load("k")).valueAsString());
        assertEquals(1, service.getDatabase().size());
    }

    @Test
    void testEraseTwice() {
        StoreService service = synchronousService();
        service.handle(StoreRequest.store("k", "v"));

        assertTrue(service.handle(StoreRequest.erase("k")).success());
        assertFalse(service.handle(StoreRequest.erase("k")).success());
        assertFalse(service.handle(StoreRequest.load("k")).success());
    }

    @Test
    void testSynchronousModeWritesBeforeReturning() {
        StoreService service = synchronousService();

        service.handle(StoreRequest.store("a", "1"));

        // 响应返回时文件已经包含这次写入
        Database onDisk = new DatabaseFile(storePath()).load().orElseThrow();
        assertArrayEquals("1".getBytes(StandardCharsets.UTF_8), onDisk.get("a"));
        assertEquals(1, service.getDatabaseFile().getWriteCount());

        service.handle(StoreRequest.erase("a"));
        assertFalse(new DatabaseFile(storePath()).load().orElseThrow().contains("a"));
        assertEquals(2, service.getDatabaseFile().getWriteCount());
    }

    @Test
    void testReadsAndFailedMutationsDoNotPersist() {
        StoreService service = synchronousService();

        service.handle(StoreRequest.load("nope"));
        service.handle(StoreRequest.erase("nope"));
        service.handle(unknown("FLUSHALL", "nope"));

        assertEquals(0, service.getDatabaseFile().getWriteCount());
        assertFalse(Files.exists(storePath()));
    }

    @Test
    void testUnknownOperationFailsWithoutChangingState() {
        StoreService service = synchronousService();
        service.handle(StoreRequest.store("k", "v"));

        StoreResponse response = service.handle(unknown("INCR", "k"));

        assertEquals("k", response.key());
        assertFalse(response.success());
        assertEquals("v", service.handle(StoreRequest.load("k")).valueAsString());
    }

    @Test
    void testMalformedResponse() {
        StoreService service = synchronousService();
        StoreResponse response = service.malformed();

        assertEquals("", response.key());
        assertFalse(response.success());
        assertTrue(service.getDatabase().isEmpty());
    }

    @Test
    void testStateSurvivesRestart() {
        StoreService first = synchronousService();
        first.handle(StoreRequest.store("a", "1"));
        first.handle(StoreRequest.store("b", "2"));
        first.handle(StoreRequest.store("c", "3"));
        first.handle(StoreRequest.erase("b"));

        StoreService second = synchronousService();

        assertEquals(first.getDatabase(), second.getDatabase());
        assertEquals("1", second.handle(StoreRequest.load("a")).valueAsString());
        assertFalse(second.handle(StoreRequest.load("b")).success());
    }

    @Test
    void testCorruptFileAtStartup() throws Exception {
        Files.write(storePath(), "garbage garbage garbage garbage".getBytes(StandardCharsets.UTF_8));

        StoreService service = synchronousService();

        assertTrue(service.getDatabase().isEmpty());
        assertTrue(service.handle(StoreRequest.store("a", "1")).success());
        assertEquals("1", service.handle(StoreRequest.load("a")).valueAsString());
        // 新的写入覆盖了损坏的文件
        assertTrue(new DatabaseFile(storePath()).load().isPresent());
    }

    @Test
    void testDebouncedBurstCostsOneWrite() {
        EventExecutor executor = mock(EventExecutor.class);
        StoreService service = new StoreService(new DatabaseFile(storePath()),
                new SaveBackoff(Duration.ofMillis(50), Duration.ofSeconds(1)), executor);

        for (int i = 0; i < 100; i++) {
            service.handle(StoreRequest.store("k" + i, "v" + i));
        }
        service.handle(StoreRequest.erase("k0"));
        assertEquals(0, service.getDatabaseFile().getWriteCount());

        ArgumentCaptor<Runnable> flush = ArgumentCaptor.forClass(Runnable.class);
        verify(executor, times(1)).schedule(flush.capture(), eq(50L), eq(TimeUnit.MILLISECONDS));
        flush.getValue().run();

        assertEquals(1, service.getDatabaseFile().getWriteCount());
        // flush 时的数据库状态 (包括 armed 之后的修改) 全部落盘
        Database onDisk = new DatabaseFile(storePath()).load().orElseThrow();
        assertEquals(99, onDisk.size());
        assertFalse(onDisk.contains("k0"));
    }

    @Test
    void testDebouncedFlushOnRealExecutor() throws Exception {
        realExecutor = new DefaultEventExecutor();
        StoreService service = new StoreService(new DatabaseFile(storePath()),
                new SaveBackoff(Duration.ofMillis(100), Duration.ofSeconds(1)), realExecutor);

        // 所有写请求在同一个窗口内完成
        realExecutor.submit(() -> {
            for (int i = 0; i < 20; i++) {
                service.handle(StoreRequest.store("k" + i, "v" + i));
            }
        }).sync();

        long deadline = System.currentTimeMillis() + 5000;
        while (service.getDatabaseFile().getWriteCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(300);

        assertEquals(1, service.getDatabaseFile().getWriteCount());
        assertEquals(20, new DatabaseFile(storePath()).load().orElseThrow().size());
    }

    @Test
    void testFailingDiskKeepsDataInMemoryAndRetries() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "x");
        EventExecutor executor = mock(EventExecutor.class);
        StoreService service = new StoreService(new DatabaseFile(blocker.resolve("store.db")),
                new SaveBackoff(Duration.ofMillis(10), Duration.ofMillis(40)), executor);

        assertTrue(service.handle(StoreRequest.store("a", "1")).success());

        ArgumentCaptor<Runnable> flush = ArgumentCaptor.forClass(Runnable.class);
        verify(executor).schedule(flush.capture(), eq(10L), eq(TimeUnit.MILLISECONDS));
        flush.getValue().run();

        // 写盘失败: 客户端看到的数据不受影响, 并安排了更长延迟的重试
        verify(executor).schedule(any(Runnable.class), eq(20L), eq(TimeUnit.MILLISECONDS));
        assertEquals("1", service.handle(StoreRequest.load("a")).valueAsString());
        assertEquals(0, service.getDatabaseFile().getWriteCount());
    }

    @Test
    void testFlushNowAlwaysWrites() {
        EventExecutor executor = mock(EventExecutor.class);
        StoreService service = new StoreService(new DatabaseFile(storePath()),
                new SaveBackoff(Duration.ofSeconds(10), Duration.ofSeconds(10)), executor);

        assertTrue(service.flushNow());
        assertTrue(service.flushNow());

        assertEquals(2, service.getDatabaseFile().getWriteCount());
    }
}
