package com.casebattle.ledger.eventlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only binary journal of ledger mutations.
 *
 * Every append is forced to disk before returning. On open the existing file is scanned,
 * the sequence counter resumes after the last intact event, and a torn trailing record
 * left by a crash is cut off so readers only ever see whole events.
 */
public class FileEventLogWriter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FileEventLogWriter.class);

    static final int MAGIC = 0x4C454447;  // "LEDG"
    static final int VERSION = 1;
    static final int FILE_HEADER_SIZE = 16;

    private final FileChannel channel;
    private final AtomicLong sequenceCounter;
    private final Path logPath;
    private final Clock clock;

    public FileEventLogWriter(Path logPath, Clock clock) throws IOException {
        this.logPath = logPath;
        this.clock = clock;

        long lastSequence = recover(logPath);
        this.sequenceCounter = new AtomicLong(lastSequence);

        this.channel = FileChannel.open(logPath,
                StandardOpenOption.WRITE,
                StandardOpenOption.APPEND,
                StandardOpenOption.CREATE);

        if (channel.size() == 0) {
            writeHeader();
            logger.info("Created new event log at: {}", logPath);
        } else {
            logger.info("Opened existing event log at: {} (last sequence {})", logPath, lastSequence);
        }
    }

    private void writeHeader() throws IOException {
        ByteBuffer header = ByteBuffer.allocate(FILE_HEADER_SIZE);
        header.order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(MAGIC);
        header.putInt(VERSION);
        header.putLong(0);
        header.flip();
        writeFully(header);
        channel.force(true);
    }

    public synchronized void append(Event.EventType eventType, Object payload) throws IOException {
        long seqNum = sequenceCounter.incrementAndGet();
        Event event = new Event(seqNum, clock.millis(), eventType, payload);
        byte[] eventBytes = event.serialize();

        long sizeBefore = channel.size();
        try {
            writeFully(ByteBuffer.wrap(eventBytes));
            channel.force(false);
        } catch (IOException e) {
            sequenceCounter.decrementAndGet();
            try {
                channel.truncate(sizeBefore);
            } catch (IOException truncateFailure) {
                e.addSuppressed(truncateFailure);
            }
            throw e;
        }

        logger.debug("Appended event: seq={}, type={}, size={} bytes", seqNum, eventType, eventBytes.length);
    }

    public long getCurrentSequence() {
        return sequenceCounter.get();
    }

    public Path getLogPath() {
        return logPath;
    }

    /**
     * Read every intact event of a journal file, oldest first.
     */
    public static List<Event> readAll(Path logPath) throws IOException {
        try (FileChannel in = FileChannel.open(logPath, StandardOpenOption.READ)) {
            return scan(in).events;
        }
    }

    private void writeFully(ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static long recover(Path logPath) throws IOException {
        if (!Files.exists(logPath) || Files.size(logPath) == 0) {
            return 0;
        }

        try (FileChannel rw = FileChannel.open(logPath, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            if (rw.size() < FILE_HEADER_SIZE) {
                logger.warn("Event log {} has a torn header ({} bytes), starting over", logPath, rw.size());
                rw.truncate(0);
                return 0;
            }

            ScanResult result = scan(rw);
            if (result.validEnd < rw.size()) {
                logger.warn("Truncating torn tail of event log {}: {} -> {} bytes",
                        logPath, rw.size(), result.validEnd);
                rw.truncate(result.validEnd);
                rw.force(true);
            }
            return result.lastSequence;
        }
    }

    private static ScanResult scan(FileChannel in) throws IOException {
        long size = in.size();
        ByteBuffer fileHeader = readAt(in, 0, FILE_HEADER_SIZE);
        if (fileHeader == null) {
            return new ScanResult(0, 0, new ArrayList<>());
        }
        int magic = fileHeader.getInt();
        int version = fileHeader.getInt();
        if (magic != MAGIC || version != VERSION) {
            throw new IOException("Not a ledger event log (magic=0x" + Integer.toHexString(magic)
                    + ", version=" + version + ")");
        }

        List<Event> events = new ArrayList<>();
        long position = FILE_HEADER_SIZE;
        long lastSequence = 0;
        while (position + Event.HEADER_SIZE <= size) {
            ByteBuffer header = readAt(in, position, Event.HEADER_SIZE);
            long seqNum = header.getLong();
            long timestampMs = header.getLong();
            byte type = header.get();
            header.position(header.position() + 3);
            int payloadLength = header.getInt();

            long recordSize = (long) Event.HEADER_SIZE + payloadLength + Event.CRC_SIZE;
            if (payloadLength < 0 || position + recordSize > size) {
                break;
            }

            ByteBuffer record = readAt(in, position, (int) recordSize);
            byte[] bytes = record.array();
            long storedCrc = Integer.toUnsignedLong(record.getInt((int) recordSize - Event.CRC_SIZE));
            if (Event.checksum(bytes, (int) recordSize - Event.CRC_SIZE) != storedCrc) {
                logger.warn("CRC mismatch at offset {} (seq={}), ignoring the rest of the log", position, seqNum);
                break;
            }

            String payload = new String(bytes, Event.HEADER_SIZE, payloadLength, StandardCharsets.UTF_8);
            events.add(new Event(seqNum, timestampMs, Event.EventType.fromValue(type), payload));
            lastSequence = seqNum;
            position += recordSize;
        }
        return new ScanResult(position, lastSequence, events);
    }

    private static ByteBuffer readAt(FileChannel in, long position, int length) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        while (buffer.hasRemaining()) {
            int read = in.read(buffer, position + buffer.position());
            if (read < 0) {
                return null;
            }
        }
        buffer.flip();
        return buffer;
    }

    private static final class ScanResult {
        private final long validEnd;
        private final long lastSequence;
        private final List<Event> events;

        private ScanResult(long validEnd, long lastSequence, List<Event> events) {
            this.validEnd = validEnd;
            this.lastSequence = lastSequence;
            this.events = events;
        }
    }

    @Override
    public void close() throws IOException {
        if (channel != null && channel.isOpen()) {
            channel.close();
            logger.info("Closed event log: {}", logPath);
        }
    }
}
