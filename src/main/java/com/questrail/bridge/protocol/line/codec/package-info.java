/**
 * Line Protocol Codec
 * =============================================================================
 *
 * <p>The device speaks a newline-delimited UTF-8 text protocol:</p>
 *
 * <pre>
 *   TOPIC:PAYLOAD\n
 * </pre>
 *
 * <p>The split happens on the <em>first</em> {@code ':'}; both sides are trimmed.
 * There is no escaping of {@code ':'} or {@code '\n'}, and none is added here,
 * because the firmware on the other end of the link does not unescape.</p>
 *
 * <h2>Architectural placement</h2>
 * <pre>
 *   byte[] from serial port
 *        → LineFramer          (newline framing, lossy UTF-8 decode)
 *            → LineCodec       (TOPIC:PAYLOAD split)
 *                → DeviceMessage
 * </pre>
 *
 * <p>Everything in this package is free of I/O. Failures are classified as
 * framing or protocol defects: the offending line is dropped and the link is
 * left untouched.</p>
 */
package com.questrail.bridge.protocol.line.codec;
