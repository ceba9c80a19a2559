package com.dubbi.hostmaster.portal;

import com.dubbi.hostmaster.config.PortalSettings;
import com.dubbi.hostmaster.portal.session.Deadline;
import com.dubbi.hostmaster.portal.session.PortalSession;
import com.dubbi.hostmaster.portal.session.PortalSessionFactory;
import com.dubbi.hostmaster.portal.web.MenuNavigator;
import com.dubbi.hostmaster.portal.web.PortalMenu;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Entry point shared by all workflows: one fresh session per call, bounded by the workflow timeout.
 */
@Component
public class PortalAccess {
    private final PortalSessionFactory sessionFactory;
    private final MenuNavigator menuNavigator;
    private final PortalSettings settings;

    public PortalAccess(PortalSessionFactory sessionFactory, MenuNavigator menuNavigator, PortalSettings settings) {
        this.sessionFactory = sessionFactory;
        this.menuNavigator = menuNavigator;
        this.settings = settings;
    }

    public PortalSession open() {
        return sessionFactory.open(Deadline.after(settings.workflowTimeout()));
    }

    /**
     * Resolves the menu entry and fetches the form page behind it.
     */
    public Document openMenu(PortalSession session, PortalMenu menu) {
        return session.fetchPage(menuNavigator.resolve(session, menu));
    }

    public PortalSettings settings() {
        return settings;
    }
}
