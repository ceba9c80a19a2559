package com.dubbi.hostmaster.registration.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dubbi.hostmaster.portal.error.PortalTimeoutException;
import com.dubbi.hostmaster.portal.error.TransportException;
import com.dubbi.hostmaster.registration.domain.SearchResult;
import com.dubbi.hostmaster.registration.service.RegistrationSearchService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RegistrationController.class)
class RegistrationControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    RegistrationSearchService searchService;

    @Test
    void searchBindsCriteriaAndFlags() throws Exception {
        when(searchService.searchIpv4(any())).thenReturn(new SearchResult<>(List.of(), List.of()));

        mvc.perform(post("/api/registrations/ipv4/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"networkName\":\"EXAMPLE-NET\",\"allocate\":true,\"detail\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isArray());

        verify(searchService).searchIpv4(argThat(s -> "EXAMPLE-NET".equals(s.networkName())
                && s.allocate() && s.detail() && !s.myself()));
    }

    @Test
    void criteriaThatWouldSplitTheFormBodyAreRejected() throws Exception {
        mvc.perform(post("/api/registrations/ipv6/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"networkName\":\"NET&resceAdmSnm=OTHER\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(searchService);
    }

    @Test
    void unreachablePortalIsBadGateway() throws Exception {
        when(searchService.fetchRegistrationDetail("https://portal.test/jpnic/entryinfo.do?id=1"))
                .thenThrow(new TransportException("GET failed", 503, null));

        mvc.perform(get("/api/registrations/detail").param("link", "https://portal.test/jpnic/entryinfo.do?id=1"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.kind").value("TRANSPORT"));
    }

    @Test
    void expiredWorkflowIsGatewayTimeout() throws Exception {
        when(searchService.fetchRegistrationDetail(any())).thenThrow(new PortalTimeoutException("workflow deadline passed"));

        mvc.perform(get("/api/registrations/detail").param("link", "/jpnic/entryinfo.do?id=1"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.kind").value("TIMEOUT"));
    }

    @Test
    void foreignLinkIsBadRequest() throws Exception {
        when(searchService.fetchRegistrationDetail(any()))
                .thenThrow(new IllegalArgumentException("link is not on the portal host"));

        mvc.perform(get("/api/registrations/detail").param("link", "https://elsewhere.test/x"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("REQUEST"));
    }
}
