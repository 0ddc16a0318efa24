package com.paymentsengine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.paymentsengine.accounts.ClientAccount;
import lombok.Value;

/**
 * Output row for one account. Monetary columns are normalized decimal text.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountRow {
    int client;
    String available;
    String held;
    String total;
    boolean locked;

    public static AccountRow from(ClientAccount account) {
        return new AccountRow(
            account.getClientId(),
            account.getAvailable().toPlainString(),
            account.getHeld().toPlainString(),
            account.total().toPlainString(),
            account.isFrozen()
        );
    }
}
