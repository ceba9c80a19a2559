package com.dubbi.hostmaster.portal.error;

/**
 * 포털 자동화 중 발생하는 모든 예외의 루트.
 * 워크플로는 어떤 하위 예외든 받는 즉시 중단되며, 재시도는 호출자 책임이다.
 */
public abstract class PortalException extends RuntimeException {
    protected PortalException(String message) {
        super(message);
    }

    protected PortalException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable kind used by the REST layer.
     */
    public abstract String kind();
}
