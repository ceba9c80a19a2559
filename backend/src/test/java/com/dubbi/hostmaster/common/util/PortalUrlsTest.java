package com.dubbi.hostmaster.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dubbi.hostmaster.portal.error.StructuralException;
import org.junit.jupiter.api.Test;

class PortalUrlsTest {

    @Test
    void resolvesRootRelativeAgainstBareHost() {
        assertEquals("https://portal.test/jpnic/entry.do", PortalUrls.resolve("https://portal.test", "/jpnic/entry.do"));
        assertEquals("https://portal.test/entry.do", PortalUrls.resolve("https://portal.test", "entry.do"));
    }

    @Test
    void resolvesPageRelativeAndStripsFragment() {
        assertEquals("https://portal.test/jpnic/entry.do?id=1",
                PortalUrls.resolve("https://portal.test/jpnic/menu.do", "entry.do?id=1#top"));
    }

    @Test
    void keepsPreEscapedQueries() {
        assertEquals("https://portal.test/x.do?q=%81%40",
                PortalUrls.resolve("https://portal.test/", "x.do?q=%81%40"));
    }

    @Test
    void blankLinkIsStructural() {
        assertThrows(StructuralException.class, () -> PortalUrls.resolve("https://portal.test", " "));
    }

    @Test
    void sameHostCheck() {
        assertTrue(PortalUrls.isSameHost("https://portal.test", "https://PORTAL.test/jpnic/x.do"));
        assertFalse(PortalUrls.isSameHost("https://portal.test", "https://evil.test/jpnic/x.do"));
        assertFalse(PortalUrls.isSameHost("https://portal.test", "not a url"));
    }
}
