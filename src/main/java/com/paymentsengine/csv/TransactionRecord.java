package com.paymentsengine.csv;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw input row, before type coercion.
 * Every column is kept as text so a bad value only rejects its own row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"type", "client", "tx", "amount"})
public class TransactionRecord {

    private String type;

    private String client;

    private String tx;

    /**
     * Empty or absent for disputes, resolves and chargebacks.
     */
    private String amount;
}
