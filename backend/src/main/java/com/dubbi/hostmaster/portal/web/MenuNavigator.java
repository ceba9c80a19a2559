package com.dubbi.hostmaster.portal.web;

import com.dubbi.hostmaster.common.util.PortalUrls;
import com.dubbi.hostmaster.portal.error.StructuralException;
import com.dubbi.hostmaster.portal.session.PortalSession;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a menu label on the portal's top navigation page to the endpoint serving its form.
 */
public class MenuNavigator {
    private static final Logger log = LoggerFactory.getLogger(MenuNavigator.class);

    private final String menuPath;

    public MenuNavigator(String menuPath) {
        this.menuPath = menuPath;
    }

    public String resolve(PortalSession session, PortalMenu menu) {
        return resolve(session, menu.label());
    }

    public String resolve(PortalSession session, String menuLabel) {
        String menuUrl = session.resolve(menuPath);
        Document page = session.fetchPage(menuUrl);
        for (Element a : page.select("a[href]")) {
            if (menuLabel.equals(a.text().trim())) {
                String endpoint = PortalUrls.resolve(menuUrl, a.attr("href"));
                log.debug("[Menu] '{}' -> {}", menuLabel, endpoint);
                return endpoint;
            }
        }
        throw new StructuralException(String.format(
                "menu '%s' not found on %s (layout changed or not logged in)", menuLabel, menuUrl));
    }
}
