package com.questrail.bridge.protocol.line.codec.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * LineFramer
 * -----------------------------------------------------------------------------
 * Accumulates raw serial bytes and yields complete, decoded lines.
 *
 * <p>Unlike a datagram transport, a serial port delivers an unstructured byte
 * stream: a single read may carry half a line or several lines. The framer
 * keeps the incomplete tail between reads, so a read timeout never loses
 * data.</p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Lines are terminated by {@code '\n'}; a preceding {@code '\r'} is dropped.</li>
 *   <li>Bytes are decoded as UTF-8; malformed sequences are replaced with
 *       U+FFFD and logged, never rejected.</li>
 *   <li>An unterminated line longer than {@link #MAX_LINE_BYTES} is discarded.</li>
 * </ul>
 *
 * <p>One framer belongs to one serial session and is not thread-safe; the
 * link manager serializes reads.</p>
 */
public final class LineFramer
{
    private static final Logger log = LoggerFactory.getLogger(LineFramer.class);

    public static final int MAX_LINE_BYTES = 64 * 1024;

    private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
    private final Deque<String> complete = new ArrayDeque<>();
    private boolean discarding;

    /**
     * Feed {@code length} bytes from {@code bytes} into the framer.
     */
    public void feed(byte[] bytes, int length)
    {
        for (int i = 0; i < length; i++) {
            byte b = bytes[i];
            if (b == '\n') {
                if (discarding) {
                    discarding = false;
                } else {
                    complete.addLast(decode(partial.toByteArray()));
                }
                partial.reset();
                continue;
            }
            if (discarding) {
                continue;
            }
            if (partial.size() >= MAX_LINE_BYTES) {
                log.warn("Discarding serial line longer than {} bytes", MAX_LINE_BYTES);
                partial.reset();
                discarding = true;
                continue;
            }
            partial.write(b);
        }
    }

    /**
     * Returns the next complete line, if one has been framed.
     */
    public Optional<String> nextLine()
    {
        return Optional.ofNullable(complete.pollFirst());
    }

    /**
     * Number of buffered bytes that do not yet form a complete line.
     */
    public int pendingBytes()
    {
        return partial.size();
    }

    static String decode(byte[] raw)
    {
        int length = raw.length;
        if (length > 0 && raw[length - 1] == '\r') {
            length--;
        }

        CharsetDecoder strict = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            CharBuffer chars = strict.decode(ByteBuffer.wrap(raw, 0, length));
            return chars.toString();
        } catch (CharacterCodingException e) {
            String replaced = new String(raw, 0, length, StandardCharsets.UTF_8);
            log.warn("Invalid UTF-8 in serial data (replaced): {} -> {}", toHex(raw, length), replaced);
            return replaced;
        }
    }

    private static String toHex(byte[] raw, int length)
    {
        StringBuilder sb = new StringBuilder(length * 2);
        for (int i = 0; i < length; i++) {
            sb.append(String.format("%02x", raw[i] & 0xFF));
        }
        return sb.toString();
    }
}
