package com.flakeid;

import java.util.Date;

/**
 * ID information container class.
 *
 * <p>Provides structured access to the components decoded from an ID and
 * utility methods for analysis and debugging. A new instance is built for every
 * parse call.</p>
 */
public final class IdInfo {
    /** The original ID value */
    public final long id;

    /** Timestamp component, Unix milliseconds */
    public final long timestamp;

    /** Datacenter ID component */
    public final long datacenterId;

    /** Worker ID component */
    public final long workerId;

    /** Sequence number component */
    public final long sequence;

    /**
     * Constructs IdInfo with all components.
     *
     * @param id the original ID
     * @param timestamp timestamp component in Unix milliseconds
     * @param datacenterId datacenter ID component
     * @param workerId worker ID component
     * @param sequence sequence number component
     */
    public IdInfo(long id, long timestamp, long datacenterId, long workerId, long sequence) {
        this.id = id;
        this.timestamp = timestamp;
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.sequence = sequence;
    }

    public long getId() { return id; }

    public long getTimestamp() { return timestamp; }

    public long getDatacenterId() { return datacenterId; }

    public long getWorkerId() { return workerId; }

    public long getSequence() { return sequence; }

    /**
     * Returns the date representation of the timestamp.
     *
     * @return a new Date object
     */
    public Date getDate() { return new Date(timestamp); }

    /**
     * Generates a detailed report of ID components.
     *
     * @return formatted report string
     */
    public String generateReport() {
        String binary = String.format("%64s", Long.toUnsignedString(id, 2)).replace(' ', '0');
        String hexPadded = String.format("%016X", id);
        return String.format(
                "═══════════════════════════════════════\n" +
                        "Snowflake ID Report\n" +
                        "═══════════════════════════════════════\n" +
                        "ID              : %,d\n" +
                        "Hex             : 0x%s\n" +
                        "Timestamp       : %d\n" +
                        "Datacenter ID   : %d\n" +
                        "Worker ID       : %d\n" +
                        "Sequence        : %d\n" +
                        "Date            : %s\n" +
                        "Binary          : %s\n" +
                        "═══════════════════════════════════════\n",
                id, hexPadded, timestamp, datacenterId, workerId, sequence, getDate(), binary);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdInfo)) return false;
        IdInfo other = (IdInfo) o;
        return id == other.id && timestamp == other.timestamp && datacenterId == other.datacenterId
                && workerId == other.workerId && sequence == other.sequence;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    /**
     * Returns string representation of ID information.
     *
     * @return compact string representation
     */
    @Override public String toString() {
        return String.format("ID[%d] Time:%d DC:%d Worker:%d Seq:%d", id, timestamp, datacenterId, workerId, sequence);
    }
}
