package opshealth;

/**
 * 运行健康异常
 */
public class OpsHealthException extends RuntimeException {
    public OpsHealthException(String message) {
        super(message);
    }

    public OpsHealthException(String message, Throwable cause) {
        super(message, cause);
    }
}
