package com.dubbi.hostmaster.resource.service;

import static com.dubbi.hostmaster.portal.PortalFixtures.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.dubbi.hostmaster.portal.FixtureTransport;
import com.dubbi.hostmaster.portal.TestPortal;
import com.dubbi.hostmaster.portal.error.StructuralException;
import com.dubbi.hostmaster.portal.web.MenuNavigator;
import com.dubbi.hostmaster.resource.domain.CidrBlock;
import com.dubbi.hostmaster.resource.domain.ResourceInfo;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

class ResourceManagementServiceTest {

    private static ResourceManagementService service(FixtureTransport transport) {
        return new ResourceManagementService(TestPortal.access(transport), new MenuNavigator(MENU_PATH),
                new ResourcePageParser());
    }

    @Test
    void readsManagerFiguresAndCidrBlocks() {
        FixtureTransport transport = portal().page(RESOURCE_URL, RESOURCE);

        ResourceInfo info = service(transport).fetchResourceManagement();

        assertEquals("A1234", info.manager().resourceManagerNo());
        assertEquals("EXAMPLENET", info.manager().shortName());
        assertEquals("Example Corp", info.manager().orgEn());
        assertEquals("/24", info.manager().assignmentWindowSize());
        assertEquals("", info.manager().fax());
        assertEquals(1165, info.usedAddress());
        assertEquals(2560, info.allAddress());
        assertEquals(45.5, info.utilizationRatio(), 1e-9);
        assertEquals(0.82, info.adRatio(), 1e-9);
        assertTrue(info.html().contains("資源管理者番号"));

        assertEquals(2, info.cidrBlocks().size());
        CidrBlock first = info.cidrBlocks().get(0);
        assertEquals("192.0.2.0/24", first.address());
        assertEquals(DETAIL_1_URL, first.url());
        assertEquals("2020/04/01", first.assignDate());
        assertEquals(128, first.usedAddress());
        assertEquals(256, first.allAddress());
        assertEquals("198.51.100.0/24", info.cidrBlocks().get(1).address());
        assertEquals(100.0, info.cidrBlocks().get(1).utilizationRatio(), 1e-9);
    }

    @Test
    void malformedUtilizationIsStructural() {
        String page = nested(4, triple("総利用率", "", "データなし"));
        assertThrows(StructuralException.class,
                () -> new ResourcePageParser().parse(Jsoup.parse(page, RESOURCE_URL), page));
    }

    @Test
    void malformedAdRatioIsStructural() {
        String page = nested(4, triple("ＡＤ　ｒａｔｉｏ", "", "n/a"));
        assertThrows(StructuralException.class,
                () -> new ResourcePageParser().parse(Jsoup.parse(page, RESOURCE_URL), page));
    }
}
