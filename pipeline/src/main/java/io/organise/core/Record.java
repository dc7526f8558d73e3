package io.organise.core;

import java.util.Objects;

/**
 * A generic record wrapper that carries a payload and its position in the source stream.
 */
public final class Record<T> implements Comparable<Record<?>> {
    private final long seq; // 0-based, monotonically increasing across the source
    private final T payload;

    public Record(long seq, T payload) {
        this.seq = seq;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public T payload() { return payload; }

    @Override
    public int compareTo(Record<?> o) {
        return Long.compare(this.seq, o.seq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", payload=" + payload +
                '}';
    }
}
