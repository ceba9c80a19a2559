package com.dubbi.hostmaster.transaction.api;

import com.dubbi.hostmaster.portal.protocol.ResultOutcome;
import com.dubbi.hostmaster.transaction.api.dto.TransactionDtos.TransactionRequest;
import com.dubbi.hostmaster.transaction.domain.WebTransaction;
import com.dubbi.hostmaster.transaction.service.WebTransactionService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/transactions")
public class TransactionController {
    private final WebTransactionService webTransactionService;

    public TransactionController(WebTransactionService webTransactionService) {
        this.webTransactionService = webTransactionService;
    }

    @PostMapping
    public ResultOutcome send(@Valid @RequestBody TransactionRequest req) {
        return webTransactionService.send(WebTransaction.of(req.fields()));
    }
}
