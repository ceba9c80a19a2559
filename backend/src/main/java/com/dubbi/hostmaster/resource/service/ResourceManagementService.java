package com.dubbi.hostmaster.resource.service;

import com.dubbi.hostmaster.portal.PortalAccess;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.portal.web.MenuNavigator;
import com.dubbi.hostmaster.portal.web.PortalMenu;
import com.dubbi.hostmaster.resource.domain.ResourceInfo;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ResourceManagementService {
    private static final Logger log = LoggerFactory.getLogger(ResourceManagementService.class);

    private final PortalAccess portal;
    private final MenuNavigator menuNavigator;
    private final ResourcePageParser parser;

    public ResourceManagementService(PortalAccess portal, MenuNavigator menuNavigator, ResourcePageParser parser) {
        this.portal = portal;
        this.menuNavigator = menuNavigator;
        this.parser = parser;
    }

    /**
     * Reads the resource manager page. The decoded page is returned alongside the parsed figures.
     */
    public ResourceInfo fetchResourceManagement() {
        PortalSession session = portal.open();
        String url = menuNavigator.resolve(session, PortalMenu.RESOURCE_MANAGER);
        String html = session.fetchText(url);
        ResourceInfo info = parser.parse(Jsoup.parse(html, url), html);
        log.info("[Resource] {} blocks={} utilization={}%", info.manager().shortName(), info.cidrBlocks().size(),
                info.utilizationRatio());
        return info;
    }
}
