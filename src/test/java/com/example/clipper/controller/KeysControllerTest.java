package com.example.clipper.controller;

import com.example.clipper.service.keys.CredentialRotator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = KeysController.class)
@AutoConfigureMockMvc(addFilters = false)
class KeysControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CredentialRotator rotator;

    @Test
    void reportsPoolSizeWithoutKeys() throws Exception {
        when(rotator.getCount("github")).thenReturn(3);

        mockMvc.perform(get("/v1/clipper/keys/github"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("github"))
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.available").value(true));
    }

    @Test
    void emptyPoolIsUnavailable() throws Exception {
        when(rotator.getCount("gemini")).thenReturn(0);

        mockMvc.perform(get("/v1/clipper/keys/gemini"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.available").value(false));
    }

    @Test
    void rejectsServiceNamesThatAreNotPlainIdentifiers() throws Exception {
        mockMvc.perform(get("/v1/clipper/keys/GitHub"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/clipper/keys/..hidden"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(rotator);
    }

    @Test
    void clearingCacheForcesReload() throws Exception {
        mockMvc.perform(delete("/v1/clipper/keys/github/cache"))
                .andExpect(status().isNoContent());

        verify(rotator).clearCache("github");
    }
}
