package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;

import java.math.BigInteger;
import java.util.Map;

/**
 * Owner balance of the spent token is below the normalized amount. Fatal.
 */
public class InsufficientBalanceException extends OperationException {

    public static final String CODE = "INSUFFICIENT_BALANCE";

    public InsufficientBalanceException(OperationKind kind, String token, String owner,
                                        BigInteger required, BigInteger available) {
        super(CODE, kind, "insufficient balance: " + owner + " holds " + available + " of " + token
                        + ", needs " + required,
                Map.of("token", token, "owner", owner,
                        "required", required.toString(), "available", available.toString()), null);
    }
}
