package com.dubbi.hostmaster.transaction.api.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.LinkedHashMap;

public final class TransactionDtos {
    private TransactionDtos() {}

    /**
     * Fields keep the order of the JSON object; that order is the line order on the wire.
     */
    public record TransactionRequest(@NotEmpty LinkedHashMap<String, String> fields) {}
}
