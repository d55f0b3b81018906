package org.muma.mini.kvstore.persist;

import org.muma.mini.kvstore.store.Database;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * 数据库镜像的磁盘格式
 * <pre>
 * "MINIKV" "0001"                 header
 * len(count)                      条目数
 * { len(k) k  len(v) v } * count
 * 0xFF                            EOF
 * crc32 (8 bytes, big endian)     之前所有字节的校验和
 * </pre>
 * len 使用 RDB 的长度编码 (6 / 14 / 32 bit).
 */
public final class DatabaseCodec {

    static final byte[] MAGIC = "MINIKV".getBytes(StandardCharsets.US_ASCII);
    static final String VERSION = "0001";
    static final int OP_EOF = 0xFF;

    private static final int CHECKSUM_BYTES = 8;

    private DatabaseCodec() {
    }

    public static byte[] encode(Database database) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(256);
        DataOutputStream out = new DataOutputStream(bos);

        out.write(MAGIC);
        out.write(VERSION.getBytes(StandardCharsets.US_ASCII));
        writeLength(out, database.size());
        for (Map.Entry<String, byte[]> entry : database.entries()) {
            writeString(out, entry.getKey().getBytes(StandardCharsets.UTF_8));
            writeString(out, entry.getValue());
        }
        out.write(OP_EOF);
        out.flush();

        CRC32 crc = new CRC32();
        crc.update(bos.toByteArray());
        out.writeLong(crc.getValue());
        out.flush();
        return bos.toByteArray();
    }

    /**
     * @throws IOException 魔数 / 版本 / 长度 / EOF / 校验和 任何一项不对
     */
    public static Database decode(byte[] data) throws IOException {
        int minLength = MAGIC.length + VERSION.length() + 2 + CHECKSUM_BYTES;
        if (data.length < minLength) {
            throw new IOException("Database file too short: " + data.length + " bytes");
        }

        int bodyLength = data.length - CHECKSUM_BYTES;
        CRC32 crc = new CRC32();
        crc.update(data, 0, bodyLength);
        long expected = new DataInputStream(new ByteArrayInputStream(data, bodyLength, CHECKSUM_BYTES)).readLong();
        if (crc.getValue() != expected) {
            throw new IOException("Database checksum mismatch");
        }

        DataInputStream in = new DataInputStream(new ByteArrayInputStream(data, 0, bodyLength));
        try {
            byte[] magic = readBytes(in, MAGIC.length);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new IOException("Invalid database file: bad magic");
            }
            String version = new String(readBytes(in, VERSION.length()), StandardCharsets.US_ASCII);
            if (!VERSION.equals(version)) {
                throw new IOException("Unsupported database version: " + version);
            }

            long count = readLength(in);
            Map<String, byte[]> keyVals = new HashMap<>();
            for (long i = 0; i < count; i++) {
                String key = new String(readString(in), StandardCharsets.UTF_8);
                keyVals.put(key, readString(in));
            }

            if (in.readUnsignedByte() != OP_EOF) {
                throw new IOException("Invalid database file: missing EOF marker");
            }
            if (in.available() > 0) {
                throw new IOException("Invalid database file: " + in.available() + " trailing bytes");
            }
            return new Database(keyVals);
        } catch (EOFException e) {
            throw new IOException("Invalid database file: truncated", e);
        }
    }

    // --- 长度编码 (与 RDB 相同) ---

    static void writeLength(DataOutputStream out, long len) throws IOException {
        if (len < 0 || len > 0xFFFFFFFFL) {
            throw new IOException("Length out of range: " + len);
        }
        if (len < 64) {
            // 00xxxxxx
            out.write((int) len);
        } else if (len < 16384) {
            // 01xxxxxx xxxxxxxx
            out.write(0x40 | (int) ((len >> 8) & 0x3F));
            out.write((int) (len & 0xFF));
        } else {
            // 10000000 + 4 bytes big endian
            out.write(0x80);
            out.writeInt((int) len);
        }
    }

    static long readLength(DataInputStream in) throws IOException {
        int b = in.readUnsignedByte();
        int type = (b & 0xC0) >> 6;
        return switch (type) {
            case 0 -> b & 0x3F;
            case 1 -> ((b & 0x3F) << 8) | in.readUnsignedByte();
            case 2 -> {
                if (b != 0x80) throw new IOException("Invalid length flag: 0x" + Integer.toHexString(b));
                yield in.readInt() & 0xFFFFFFFFL;
            }
            default -> throw new IOException("Unsupported length encoding: 0x" + Integer.toHexString(b));
        };
    }

    private static void writeString(DataOutputStream out, byte[] bytes) throws IOException {
        writeLength(out, bytes.length);
        out.write(bytes);
    }

    private static byte[] readString(DataInputStream in) throws IOException {
        long len = readLength(in);
        if (len > in.available()) {
            throw new IOException("Invalid database file: string length " + len + " exceeds remaining data");
        }
        return readBytes(in, (int) len);
    }

    private static byte[] readBytes(DataInputStream in, int len) throws IOException {
        byte[] bytes = new byte[len];
        in.readFully(bytes);
        return bytes;
    }
}
