package com.dubbi.hostmaster.handle.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dubbi.hostmaster.handle.domain.ContactChangeReceipt;
import com.dubbi.hostmaster.handle.domain.HandleDetail;
import com.dubbi.hostmaster.handle.service.HandleService;
import com.dubbi.hostmaster.portal.error.ApplicationException;
import com.dubbi.hostmaster.portal.error.StructuralException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(HandleController.class)
class HandleControllerTest {

    private static final String CHANGE = """
            {"person":true,"handle":"AD001JP","name":"山田太郎","email":"taro@example.jp",
             "applyMail":"apply@example.jp"}
            """;

    @Autowired
    MockMvc mvc;

    @MockBean
    HandleService handleService;

    @Test
    void returnsHandleDetail() throws Exception {
        when(handleService.fetchHandle("AD001JP")).thenReturn(new HandleDetail(true, "AD001JP", "山田太郎",
                "Yamada, Taro", "taro@example.jp", "", "", "", "", "", "", "", "", "", "2023/01/01"));

        mvc.perform(get("/api/handles/AD001JP"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.person").value(true))
                .andExpect(jsonPath("$.nameEn").value("Yamada, Taro"));
    }

    @Test
    void acceptedChangeReturnsReceptionNumber() throws Exception {
        when(handleService.changeContactInfo(any())).thenReturn(new ContactChangeReceipt("20240001"));

        mvc.perform(post("/api/handles/contact-changes").contentType(MediaType.APPLICATION_JSON).content(CHANGE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.recepNo").value("20240001"));
    }

    @Test
    void portalRejectionIsUnprocessable() throws Exception {
        when(handleService.changeContactInfo(any()))
                .thenThrow(new ApplicationException("電子メールの形式が正しくありません"));

        mvc.perform(post("/api/handles/contact-changes").contentType(MediaType.APPLICATION_JSON).content(CHANGE))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("APPLICATION"))
                .andExpect(jsonPath("$.messages[0]").value("電子メールの形式が正しくありません"));
    }

    @Test
    void changedPageLayoutIsBadGateway() throws Exception {
        when(handleService.fetchHandle("AD001JP")).thenThrow(new StructuralException("no handle caption"));

        mvc.perform(get("/api/handles/AD001JP"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.kind").value("STRUCTURE"));
    }

    @Test
    void invalidMailIsRejectedBeforeThePortal() throws Exception {
        mvc.perform(post("/api/handles/contact-changes").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"山田太郎\",\"applyMail\":\"not-a-mail\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(handleService);
    }
}
