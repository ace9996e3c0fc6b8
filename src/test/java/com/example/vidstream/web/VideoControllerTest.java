package com.example.vidstream.web;

import com.example.vidstream.TestFixtures;
import com.example.vidstream.exceptions.GlobalExceptionHandler;
import com.example.vidstream.exceptions.ResourceNotFoundException;
import com.example.vidstream.security.AuthEntryPoint;
import com.example.vidstream.security.AuthenticationFilter;
import com.example.vidstream.security.JwtService;
import com.example.vidstream.security.SecurityConfig;
import com.example.vidstream.service.VideoRegistrationService;
import com.example.vidstream.web.controller.VideoController;
import com.example.vidstream.web.dto.RegisterVideoRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(VideoController.class)
@Import({SecurityConfig.class, GlobalExceptionHandler.class, AuthEntryPoint.class, AuthenticationFilter.class})
class VideoControllerTest {

    private static final String TEST_USERNAME = "uploader";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private VideoRegistrationService registrationService;
    @MockitoBean
    private JwtService jwtService;

    private String body(String title, String sourcePath) throws Exception {
        return objectMapper.writeValueAsString(new RegisterVideoRequest(title, sourcePath));
    }

    @Test
    @WithMockUser(username = TEST_USERNAME)
    @DisplayName("✅ POST /api/videos - 201 with the registered video")
    void registerVideo_Created() throws Exception {
        given(registrationService.register("Clip", "clip.mp4")).willReturn(TestFixtures.video(42L, "clip.mp4"));

        mockMvc.perform(post("/api/videos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("Clip", "clip.mp4")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", is(42)))
                .andExpect(jsonPath("$.sourcePath", is("clip.mp4")));
    }

    @Test
    @WithMockUser(username = TEST_USERNAME)
    @DisplayName("❌ POST /api/videos - 400 without a source path")
    void registerVideo_MissingSource_BadRequest() throws Exception {
        mockMvc.perform(post("/api/videos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("Clip", " ")))
                .andExpect(status().isBadRequest());

        then(registrationService).shouldHaveNoInteractions();
    }

    @Test
    @WithMockUser(username = TEST_USERNAME)
    @DisplayName("❌ POST /api/videos - 404 when the source file does not exist")
    void registerVideo_UnknownSource_NotFound() throws Exception {
        given(registrationService.register(any(), any()))
                .willThrow(new ResourceNotFoundException("Source file not found: gone.mp4"));

        mockMvc.perform(post("/api/videos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("Clip", "gone.mp4")))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("❌ POST /api/videos - 401 without authentication")
    void registerVideo_Unauthenticated() throws Exception {
        mockMvc.perform(post("/api/videos")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body("Clip", "clip.mp4")))
                .andExpect(status().isUnauthorized());

        then(registrationService).shouldHaveNoInteractions();
    }
}
