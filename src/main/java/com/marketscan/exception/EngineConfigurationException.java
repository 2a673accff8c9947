package com.marketscan.exception;

/**
 * Fatal misconfiguration detected while starting the engine (no symbols, strategy store
 * unreachable). The engine stays stopped.
 */
public class EngineConfigurationException extends BaseException {

    public EngineConfigurationException(String message) {
        super(ErrorCode.ENGINE_MISCONFIGURED, message);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super(ErrorCode.ENGINE_MISCONFIGURED, message, cause);
    }
}
