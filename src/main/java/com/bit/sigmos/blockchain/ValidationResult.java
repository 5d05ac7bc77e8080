package com.bit.sigmos.blockchain;

import lombok.Getter;

@Getter
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(null, "");

    private final RejectReason reason;
    private final String message;

    private ValidationResult(RejectReason reason, String message) {
        this.reason = reason;
        this.message = message;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult reject(RejectReason reason, String message) {
        if (reason == null) {
            throw new IllegalArgumentException("拒绝原因不能为空");
        }
        return new ValidationResult(reason, message);
    }

    public boolean isOk() {
        return reason == null;
    }

    @Override
    public String toString() {
        return isOk() ? "OK" : reason + ": " + message;
    }
}
