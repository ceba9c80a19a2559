package com.dubbi.hostmaster.resource.api;

import com.dubbi.hostmaster.resource.domain.ResourceInfo;
import com.dubbi.hostmaster.resource.service.ResourceManagementService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/resource-management")
public class ResourceManagementController {
    private final ResourceManagementService resourceManagementService;

    public ResourceManagementController(ResourceManagementService resourceManagementService) {
        this.resourceManagementService = resourceManagementService;
    }

    @GetMapping
    public ResourceInfo get() {
        return resourceManagementService.fetchResourceManagement();
    }
}
