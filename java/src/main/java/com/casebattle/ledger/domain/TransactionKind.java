package com.casebattle.ledger.domain;

import java.util.Arrays;

public enum TransactionKind {
    DEPOSIT("deposit"),
    WITHDRAW("withdraw");

    private final String code;

    TransactionKind(String code) {
        this.code = code;
    }

    /**
     * Lower-case value stored in the transactions table and written to exports.
     */
    public String getCode() {
        return code;
    }

    public static TransactionKind fromCode(String code) {
        return Arrays.stream(values())
                .filter(kind -> kind.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown transaction kind: " + code));
    }
}
