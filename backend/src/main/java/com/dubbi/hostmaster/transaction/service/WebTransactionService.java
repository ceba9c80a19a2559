package com.dubbi.hostmaster.transaction.service;

import com.dubbi.hostmaster.portal.PortalAccess;
import com.dubbi.hostmaster.portal.protocol.ResultLineParser;
import com.dubbi.hostmaster.portal.protocol.ResultOutcome;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.transaction.domain.WebTransaction;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WebTransactionService {
    private static final Logger log = LoggerFactory.getLogger(WebTransactionService.class);

    private final PortalAccess portal;
    private final ResultLineParser resultParser;

    public WebTransactionService(PortalAccess portal, ResultLineParser resultParser) {
        this.portal = portal;
        this.resultParser = resultParser;
    }

    /**
     * Submits the transaction and parses the RET / RET_CODE reply. Application errors are returned, not thrown.
     */
    public ResultOutcome send(WebTransaction transaction) {
        PortalSession session = portal.open();
        String url = session.resolve(portal.settings().transactionPath());
        List<String> lines = session.exchangeLines(url, transaction.marshal());
        ResultOutcome outcome = resultParser.parse(lines);
        if (outcome.isSuccess()) {
            log.info("[Transaction] {} accepted recepNo={}", transaction, outcome.recepNo());
        } else {
            log.warn("[Transaction] {} rejected RET={} {}", transaction, outcome.overallCode(), outcome.messages());
        }
        return outcome;
    }
}
