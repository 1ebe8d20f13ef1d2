/**
 * Concrete line protocol codec and stream framer.
 */
package com.questrail.bridge.protocol.line.codec.impl;
