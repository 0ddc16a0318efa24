package com.paymentsengine.transactions;

import com.paymentsengine.common.Money;
import com.paymentsengine.common.exception.InvalidTransactionException;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * A single client transaction as read from the input.
 *
 * Client ids are unsigned 16-bit values and transaction ids unsigned 32-bit
 * values, held in {@code int} and {@code long} respectively.
 */
@Value
public class Transaction {

    public static final int MAX_CLIENT_ID = 0xFFFF;
    public static final long MAX_TRANSACTION_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long transactionId;
    Money amount;

    @Builder
    private Transaction(TransactionType type, int clientId, long transactionId, Money amount) {
        if (type == null) {
            throw new InvalidTransactionException("Transaction type cannot be null");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new InvalidTransactionException("Client id out of range: " + clientId);
        }
        if (transactionId < 0 || transactionId > MAX_TRANSACTION_ID) {
            throw new InvalidTransactionException("Transaction id out of range: " + transactionId);
        }
        this.type = type;
        this.clientId = clientId;
        this.transactionId = transactionId;
        this.amount = amount;
    }

    public static Transaction of(TransactionType type, int clientId, long transactionId, Money amount) {
        return new Transaction(type, clientId, transactionId, amount);
    }

    public static Transaction of(TransactionType type, int clientId, long transactionId) {
        return new Transaction(type, clientId, transactionId, null);
    }

    /**
     * Amount carried by the record. Empty for disputes, resolves and chargebacks.
     */
    public Optional<Money> getAmount() {
        return Optional.ofNullable(amount);
    }
}
