package org.muma.mini.kvstore.store;

import io.netty.util.concurrent.EventExecutor;
import lombok.Getter;
import org.muma.mini.kvstore.persist.DatabaseFile;
import org.muma.mini.kvstore.persist.FlushScheduler;
import org.muma.mini.kvstore.persist.SaveBackoff;
import org.muma.mini.kvstore.protocol.StoreRequest;
import org.muma.mini.kvstore.protocol.StoreResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 持久化 KV 服务的核心逻辑
 * <p>
 * 唯一持有内存数据库, 所有方法都在 StoreCoreExecutor 单线程上执行, 因此不加锁.
 * 写操作成功后交给 FlushScheduler 决定立即落盘还是延迟合并落盘.
 */
public class StoreService {

    private static final Logger log = LoggerFactory.getLogger(StoreService.class);

    @Getter
    private final DatabaseFile databaseFile;
    private final FlushScheduler flushScheduler;
    @Getter
    private final Database database;

    public StoreService(DatabaseFile databaseFile, SaveBackoff backoff, EventExecutor executor) {
        this.databaseFile = databaseFile;
        this.flushScheduler = new FlushScheduler(backoff, executor, this::saveDatabase);

        // 加载失败不致命, 用空库继续
        this.database = databaseFile.load().orElseGet(() -> {
            log.warn("Starting with an empty database, nothing usable at '{}'", databaseFile.getPath());
            return new Database();
        });
    }

    public StoreResponse handle(StoreRequest request) {
        String key = request.key();
        StoreResponse response = switch (request.type()) {
            case STORE -> {
                database.put(key, request.value());
                yield StoreResponse.ok(key);
            }
            case LOAD -> {
                byte[] value = database.get(key);
                yield value != null ? StoreResponse.ok(key, value) : StoreResponse.failed(key);
            }
            case ERASE -> database.remove(key) ? StoreResponse.ok(key) : StoreResponse.failed(key);
            case UNKNOWN -> {
                log.error("Got unknown request type '{}' for key '{}'", request.rawType(), key);
                yield StoreResponse.failed(key);
            }
        };

        if (response.success() && request.type().isMutation()) {
            flushScheduler.requestFlush();
        }
        return response;
    }

    /** 请求解码失败时的响应, 不触碰数据库 */
    public StoreResponse malformed() {
        return StoreResponse.malformed();
    }

    /**
     * 无条件同步落盘一次, 关闭时调用 (即使内容没有变化)
     */
    public boolean flushNow() {
        return saveDatabase();
    }

    private boolean saveDatabase() {
        return databaseFile.save(database);
    }
}
