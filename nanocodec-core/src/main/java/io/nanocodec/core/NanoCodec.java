// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.nanocodec.core.chain.Network;
import io.nanocodec.core.error.TypeParseException;
import io.nanocodec.core.field.FieldFactory;
import io.nanocodec.core.field.NcField;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.nctype.NcTypeParser;
import io.nanocodec.core.types.BufferExtract;
import io.nanocodec.primitives.Hex;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for encoding and decoding values by type descriptor.
 *
 * <p>
 * A codec is bound to one {@link Network}, which decides the accepted address versions. Fields
 * are cached by parsed type, so spellings that differ only in whitespace or container case share
 * one entry. The cache keeps the most recently used {@link #DEFAULT_CACHE_SIZE} types unless
 * another bound is given. Instances are thread-safe and meant to be long-lived and shared.
 *
 * <pre>{@code
 * NanoCodec codec = new NanoCodec(Networks.TESTNET);
 * byte[] wire = codec.serialize(BigInteger.valueOf(300), "int");
 * BufferExtract<?> back = codec.deserialize(wire, "int");
 * }</pre>
 */
public final class NanoCodec {

    public static final int DEFAULT_CACHE_SIZE = 1024;

    private final Network network;
    private final ReentrantLock cacheLock = new ReentrantLock();
    private final Map<NcType, NcField<?>> fields;

    public NanoCodec(final Network network) {
        this(network, DEFAULT_CACHE_SIZE);
    }

    public NanoCodec(final Network network, final int maxCachedTypes) {
        this.network = Objects.requireNonNull(network, "network");
        if (maxCachedTypes < 1) {
            throw new IllegalArgumentException("maxCachedTypes must be positive, got " + maxCachedTypes);
        }
        this.fields = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(final Map.Entry<NcType, NcField<?>> eldest) {
                return size() > maxCachedTypes;
            }
        };
    }

    public Network network() {
        return network;
    }

    /**
     * Returns the field for {@code descriptor}, parsing it on first use.
     *
     * @throws TypeParseException if the descriptor is invalid
     */
    public NcField<?> field(final String descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        final NcType type = NcTypeParser.parse(descriptor);
        cacheLock.lock();
        try {
            NcField<?> field = fields.get(type);
            if (field == null) {
                DebugLogger.logParse("[nc type] %s parsed as %s", descriptor, type);
                field = FieldFactory.fieldFor(type, network);
                fields.put(type, field);
            }
            return field;
        } finally {
            cacheLock.unlock();
        }
    }

    public NcType type(final String descriptor) {
        return field(descriptor).type();
    }

    public byte[] serialize(final Object value, final String descriptor) {
        final byte[] encoded = field(descriptor).encodeObject(value);
        DebugLogger.logCodec("[encode] %s -> %s", descriptor, Hex.encode(encoded));
        return encoded;
    }

    public BufferExtract<?> deserialize(final byte[] buf, final String descriptor) {
        return deserialize(buf, 0, descriptor);
    }

    public BufferExtract<?> deserialize(final byte[] buf, final int offset, final String descriptor) {
        Objects.requireNonNull(buf, "buf");
        final BufferExtract<?> extract = field(descriptor).decode(buf, offset);
        DebugLogger.logCodec("[decode] %s at %d read %d bytes", descriptor, offset, extract.bytesRead());
        return extract;
    }

    public JsonNode toUser(final Object value, final String descriptor) {
        return field(descriptor).toUserObject(value);
    }

    public Object fromUser(final JsonNode data, final String descriptor) {
        return field(descriptor).fromUser(data);
    }

    /**
     * Drops every cached descriptor.
     */
    public void clearCache() {
        cacheLock.lock();
        try {
            fields.clear();
        } finally {
            cacheLock.unlock();
        }
    }

    int cachedTypeCount() {
        cacheLock.lock();
        try {
            return fields.size();
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * Returns {@code true} if {@code descriptor} parses.
     */
    public static boolean isValidDescriptor(final String descriptor) {
        try {
            NcTypeParser.parse(descriptor);
            return true;
        } catch (TypeParseException e) {
            return false;
        }
    }
}
