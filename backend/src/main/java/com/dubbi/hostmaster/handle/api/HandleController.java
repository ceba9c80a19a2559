package com.dubbi.hostmaster.handle.api;

import com.dubbi.hostmaster.handle.api.dto.HandleDtos.ContactChangeRequest;
import com.dubbi.hostmaster.handle.api.dto.HandleDtos.ContactChangeResponse;
import com.dubbi.hostmaster.handle.domain.ContactChange;
import com.dubbi.hostmaster.handle.domain.HandleDetail;
import com.dubbi.hostmaster.handle.service.HandleService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/handles")
public class HandleController {
    private final HandleService handleService;

    public HandleController(HandleService handleService) {
        this.handleService = handleService;
    }

    @GetMapping("/{handle}")
    public HandleDetail get(@PathVariable String handle) {
        return handleService.fetchHandle(handle);
    }

    @PostMapping("/contact-changes")
    public ContactChangeResponse change(@Valid @RequestBody ContactChangeRequest req) {
        var receipt = handleService.changeContactInfo(new ContactChange(
                req.person(), req.handle(), req.name(), req.nameEn(), req.email(), req.org(), req.orgEn(),
                req.zipCode(), req.address(), req.addressEn(), req.division(), req.divisionEn(), req.title(),
                req.titleEn(), req.tel(), req.fax(), req.notifyMail(), req.applyMail()));
        return new ContactChangeResponse(true, receipt.recepNo());
    }
}
