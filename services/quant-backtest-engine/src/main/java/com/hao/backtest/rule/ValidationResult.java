package com.hao.backtest.rule;

import java.util.Optional;

/**
 * 规则校验结果
 *
 * @param accepted 是否通过
 * @param reason   拒单原因，通过时为 null
 * @param detail   便于审计的明细描述
 * @author hli
 * @date 2026-03-03
 */
public record ValidationResult(boolean accepted, RejectionReason reason, String detail) {

    private static final ValidationResult ACCEPTED = new ValidationResult(true, null, null);

    public static ValidationResult accept() {
        return ACCEPTED;
    }

    public static ValidationResult reject(RejectionReason reason, String detail) {
        return new ValidationResult(false, reason, detail);
    }

    public Optional<RejectionReason> rejectionReason() {
        return Optional.ofNullable(reason);
    }
}
