package org.muma.mini.kvstore.store;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 内存中的数据库镜像 (key -> value)
 * <p>
 * 非线程安全: 只允许在 StoreCoreExecutor 线程上访问.
 * value 以 byte[] 保存, 调用方不要修改传入或取出的数组.
 */
public class Database {

    private final Map<String, byte[]> keyVals;

    public Database() {
        this.keyVals = new HashMap<>();
    }

    public Database(Map<String, byte[]> keyVals) {
        this.keyVals = new HashMap<>(keyVals);
    }

    /** 覆盖写, 返回旧值 (没有则为 null) */
    public byte[] put(String key, byte[] value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        return keyVals.put(key, value);
    }

    public byte[] get(String key) {
        return keyVals.get(key);
    }

    public boolean contains(String key) {
        return keyVals.containsKey(key);
    }

    public boolean remove(String key) {
        return keyVals.remove(key) != null;
    }

    public int size() {
        return keyVals.size();
    }

    public boolean isEmpty() {
        return keyVals.isEmpty();
    }

    public Set<Map.Entry<String, byte[]>> entries() {
        return Collections.unmodifiableMap(keyVals).entrySet();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Database other)) return false;
        if (keyVals.size() != other.keyVals.size()) return false;
        for (Map.Entry<String, byte[]> e : keyVals.entrySet()) {
            if (!Arrays.equals(e.getValue(), other.keyVals.get(e.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 0;
        for (Map.Entry<String, byte[]> e : keyVals.entrySet()) {
            h += e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return h;
    }

    @Override
    public String toString() {
        return "Database{keys=" + keyVals.size() + "}";
    }
}
