package com.shopcraft.api.controller;

import com.shopcraft.api.service.image.HeroImage;
import com.shopcraft.api.service.image.HeroImageService;
import com.shopcraft.api.service.image.HeroImageSource;
import com.shopcraft.api.service.image.HeroImageSourceException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ImageController.class)
class ImageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HeroImageService heroImageService;

    @Test
    void returnsLocalFallbackPayload() throws Exception {
        when(heroImageService.generate(eq("https://cdn.example.com/p.png"), eq("主图"), any(), any(), any()))
                .thenReturn(new HeroImage("data:image/png;base64,AAAA", HeroImageSource.LOCAL));

        mockMvc.perform(post("/api/image")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"https://cdn.example.com/p.png\",\"prompt\":\"主图\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.url").value("data:image/png;base64,AAAA"))
                .andExpect(jsonPath("$.data.source").value("LOCAL"));
    }

    @Test
    void promptOrAssetRequired() throws Exception {
        mockMvc.perform(post("/api/image")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"https://cdn.example.com/p.png\"}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(heroImageService);
    }

    @Test
    void unreadableSourceMapsTo422() throws Exception {
        when(heroImageService.generate(any(), any(), any(), any(), any()))
                .thenThrow(new HeroImageSourceException("cannot read"));

        mockMvc.perform(post("/api/image")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"imageUrl\":\"https://cdn.example.com/p.png\",\"asset\":{\"title\":\"T\"}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("H001"));
    }
}
