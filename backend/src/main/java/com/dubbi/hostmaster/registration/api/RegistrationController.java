package com.dubbi.hostmaster.registration.api;

import com.dubbi.hostmaster.registration.api.dto.RegistrationDtos.Ipv4SearchRequest;
import com.dubbi.hostmaster.registration.api.dto.RegistrationDtos.Ipv6SearchRequest;
import com.dubbi.hostmaster.registration.domain.Ipv4Info;
import com.dubbi.hostmaster.registration.domain.Ipv4Search;
import com.dubbi.hostmaster.registration.domain.Ipv6Info;
import com.dubbi.hostmaster.registration.domain.Ipv6Search;
import com.dubbi.hostmaster.registration.domain.RegistrationDetail;
import com.dubbi.hostmaster.registration.domain.SearchResult;
import com.dubbi.hostmaster.registration.service.RegistrationSearchService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/registrations")
public class RegistrationController {
    private final RegistrationSearchService searchService;

    public RegistrationController(RegistrationSearchService searchService) {
        this.searchService = searchService;
    }

    @PostMapping("/ipv4/search")
    public SearchResult<Ipv4Info> searchIpv4(@Valid @RequestBody Ipv4SearchRequest req) {
        return searchService.searchIpv4(toSearch(req));
    }

    @PostMapping("/ipv6/search")
    public SearchResult<Ipv6Info> searchIpv6(@Valid @RequestBody Ipv6SearchRequest req) {
        return searchService.searchIpv6(toSearch(req));
    }

    @GetMapping("/detail")
    public RegistrationDetail detail(@RequestParam("link") String link) {
        return searchService.fetchRegistrationDetail(link);
    }

    private static Ipv4Search toSearch(Ipv4SearchRequest r) {
        return new Ipv4Search(r.myself(), r.ipAddress(), r.sizeStart(), r.sizeEnd(), r.networkName(),
                r.regDateStart(), r.regDateEnd(), r.returnDateStart(), r.returnDateEnd(), r.orgName(),
                r.resourceAdminShortName(), r.recepNo(), r.deliNo(), r.pa(), r.allocate(), r.assignInfra(),
                r.assignUser(), r.subAllocate(), r.historicalPi(), r.specialPi(), r.detail(), r.knownHandles());
    }

    private static Ipv6Search toSearch(Ipv6SearchRequest r) {
        return new Ipv6Search(r.myself(), r.ipAddress(), r.sizeStart(), r.sizeEnd(), r.networkName(),
                r.regDateStart(), r.regDateEnd(), r.returnDateStart(), r.returnDateEnd(), r.orgName(),
                r.resourceAdminShortName(), r.recepNo(), r.deliNo(), r.allocate(), r.assignInfra(),
                r.assignUser(), r.subAllocate(), r.detail(), r.knownHandles());
    }
}
