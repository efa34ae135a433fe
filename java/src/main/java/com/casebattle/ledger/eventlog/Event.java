package com.casebattle.ledger.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.CRC32;

/**
 * Immutable record of one ledger mutation in the binary journal.
 *
 * Layout (little-endian):
 * - sequence_num (8 bytes)
 * - timestamp_ms (8 bytes, epoch millis)
 * - event_type (1 byte)
 * - reserved (3 bytes)
 * - payload_length (4 bytes)
 * - payload (N bytes, UTF-8 JSON)
 * - crc32 (4 bytes, over all preceding bytes)
 */
@Getter
@AllArgsConstructor
@ToString
public class Event {

    public static final int HEADER_SIZE = 28;
    public static final int CRC_SIZE = 4;

    public enum EventType {
        TRANSACTION_RECORDED((byte) 1),
        USER_RESET((byte) 2);

        private final byte value;

        EventType(byte value) {
            this.value = value;
        }

        public byte getValue() {
            return value;
        }

        public static EventType fromValue(byte value) {
            return Arrays.stream(values())
                    .filter(type -> type.value == value)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
        }
    }

    private final long sequenceNum;
    private final long timestampMs;
    private final EventType eventType;
    private final String payload;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    public Event(long sequenceNum, long timestampMs, EventType eventType, Object payloadObject) {
        this.sequenceNum = sequenceNum;
        this.timestampMs = timestampMs;
        this.eventType = eventType;
        this.payload = serializePayload(payloadObject);
    }

    private String serializePayload(Object payloadObject) {
        try {
            return objectMapper.writeValueAsString(payloadObject);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }

    public byte[] serialize() {
        byte[] payloadBytes = payload.getBytes(StandardCharsets.UTF_8);
        int totalSize = HEADER_SIZE + payloadBytes.length + CRC_SIZE;

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.order(ByteOrder.LITTLE_ENDIAN);

        buffer.putLong(sequenceNum);
        buffer.putLong(timestampMs);
        buffer.put(eventType.getValue());
        buffer.put((byte) 0);
        buffer.put((byte) 0);
        buffer.put((byte) 0);
        buffer.putInt(payloadBytes.length);
        buffer.put(payloadBytes);

        buffer.putInt((int) checksum(buffer.array(), totalSize - CRC_SIZE));
        return buffer.array();
    }

    static long checksum(byte[] bytes, int length) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, length);
        return crc.getValue();
    }
}
