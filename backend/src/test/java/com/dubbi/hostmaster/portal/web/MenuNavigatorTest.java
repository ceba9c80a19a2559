package com.dubbi.hostmaster.portal.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.dubbi.hostmaster.portal.FixtureTransport;
import com.dubbi.hostmaster.portal.PortalFixtures;
import com.dubbi.hostmaster.portal.error.StructuralException;
import com.dubbi.hostmaster.portal.session.Deadline;
import com.dubbi.hostmaster.portal.session.LegacyEncoding;
import com.dubbi.hostmaster.portal.session.PortalSession;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MenuNavigatorTest {
    private final FixtureTransport transport = PortalFixtures.portal();
    private final PortalSession session = new PortalSession(transport, LegacyEncoding.windows31j(),
            PortalFixtures.BASE, Duration.ofSeconds(5), Deadline.none());
    private final MenuNavigator navigator = new MenuNavigator(PortalFixtures.MENU_PATH);

    @Test
    void resolvesRelativeMenuLinkAgainstMenuPage() {
        assertEquals(PortalFixtures.IPV4_FORM_URL, navigator.resolve(session, PortalMenu.IPV4_SEARCH));
        assertEquals(1, transport.hits(PortalFixtures.MENU_URL));
    }

    @Test
    void trimsLabelWhitespaceAndDropsFragments() {
        assertEquals(PortalFixtures.RESOURCE_URL, navigator.resolve(session, PortalMenu.RESOURCE_MANAGER));
        assertEquals(PortalFixtures.CONTACT_FORM_URL, navigator.resolve(session, PortalMenu.CONTACT_CHANGE));
    }

    @Test
    void labelMatchIsExact() {
        assertThrows(StructuralException.class, () -> navigator.resolve(session, "登録情報検索"));
    }
}
