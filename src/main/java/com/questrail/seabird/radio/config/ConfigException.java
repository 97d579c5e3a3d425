package com.questrail.seabird.radio.config;

/**
 * The process environment does not describe a usable configuration.
 */
public final class ConfigException extends Exception
{
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
