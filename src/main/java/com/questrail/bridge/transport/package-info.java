/**
 * Serial Transport Port
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete serial library and the
 * link manager. Everything above this package sees only {@code byte[]}, the
 * {@link com.questrail.bridge.transport.SerialPortSettings} record and
 * {@link com.questrail.bridge.transport.SerialPortException}.</p>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>perform byte I/O only (no line framing, no topic parsing)</li>
 *   <li>not retry or reconnect on their own</li>
 *   <li>not leak library types (for example jSerialComm's {@code SerialPort})</li>
 * </ul>
 *
 * <p>Connection state and recovery belong to the link manager.</p>
 */
package com.questrail.bridge.transport;
