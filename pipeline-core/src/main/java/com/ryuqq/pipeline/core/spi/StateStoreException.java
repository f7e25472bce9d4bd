package com.ryuqq.pipeline.core.spi;

/**
 * 상태 저장소 I/O 실패.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
