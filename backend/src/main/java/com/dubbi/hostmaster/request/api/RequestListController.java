package com.dubbi.hostmaster.request.api;

import com.dubbi.hostmaster.common.dto.ListResponse;
import com.dubbi.hostmaster.request.domain.RequestInfo;
import com.dubbi.hostmaster.request.service.RequestListService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/requests")
public class RequestListController {
    private final RequestListService requestListService;

    public RequestListController(RequestListService requestListService) {
        this.requestListService = requestListService;
    }

    @GetMapping
    public ListResponse<RequestInfo> list(@RequestParam(value = "recepNo", required = false) String recepNo) {
        return ListResponse.of(requestListService.listRequests(recepNo));
    }
}
