package com.questrail.bridge.config;

/**
 * The bridge configuration is invalid. Fatal at startup.
 */
public final class BridgeConfigException extends RuntimeException
{
    public BridgeConfigException(String message) {
        super(message);
    }

    public BridgeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
