package uk.gegc.comicmaker.features.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import uk.gegc.comicmaker.BaseIntegrationTest;
import uk.gegc.comicmaker.features.auth.api.dto.LoginRequest;
import uk.gegc.comicmaker.features.auth.api.dto.RefreshRequest;
import uk.gegc.comicmaker.features.auth.api.dto.RegisterRequest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@DisplayName("AuthController Integration Tests")
class AuthControllerIntegrationTest extends BaseIntegrationTest {

    private static final String BASE = "/api/v1/auth";

    @Autowired
    private ObjectMapper objectMapper;

    @Nested
    @DisplayName("POST /register")
    class Register {

        @Test
        @DisplayName("new user: 201 on the FREE plan with the free story available")
        void register_newUser_created() throws Exception {
            mockMvc.perform(post(BASE + "/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new RegisterRequest("newartist", "newartist@example.com", "password123"))))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.username").value("newartist"))
                    .andExpect(jsonPath("$.plan").value("FREE"))
                    .andExpect(jsonPath("$.freeStoryAvailable").value(true))
                    .andExpect(jsonPath("$.freeStoryUsed").value(false));
        }

        @Test
        @DisplayName("username taken: 409")
        void register_duplicate_conflict() throws Exception {
            register("takenname", "first@example.com");

            mockMvc.perform(post(BASE + "/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new RegisterRequest("takenname", "second@example.com", "password123"))))
                    .andExpect(status().isConflict())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON));
        }

        @Test
        @DisplayName("short password: 400 with field errors")
        void register_invalid_badRequest() throws Exception {
            mockMvc.perform(post(BASE + "/register")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new RegisterRequest("validname", "valid@example.com", "short"))))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.fieldErrors").exists());
        }
    }

    @Nested
    @DisplayName("login, refresh and me")
    class Session {

        @Test
        @DisplayName("login then me with the access token: 200")
        void login_thenMe_ok() throws Exception {
            register("sessionuser", "session@example.com");
            JsonNode tokens = login("sessionuser", "password123");

            mockMvc.perform(get(BASE + "/me")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokens.get("accessToken").asText()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.username").value("sessionuser"))
                    .andExpect(jsonPath("$.email").value("session@example.com"));
        }

        @Test
        @DisplayName("wrong password: 401")
        void login_wrongPassword_unauthorized() throws Exception {
            register("wrongpass", "wrongpass@example.com");

            mockMvc.perform(post(BASE + "/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new LoginRequest("wrongpass", "not-the-password"))))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("refresh token accepted by /refresh but not as a bearer token")
        void refresh_tokenTypes_enforced() throws Exception {
            register("refresher", "refresher@example.com");
            JsonNode tokens = login("refresher", "password123");
            String refreshToken = tokens.get("refreshToken").asText();

            mockMvc.perform(post(BASE + "/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new RefreshRequest(refreshToken))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.accessToken").isNotEmpty());

            mockMvc.perform(get(BASE + "/me")
                            .header(HttpHeaders.AUTHORIZATION, "Bearer " + refreshToken))
                    .andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("access token passed to /refresh: 400")
        void refresh_withAccessToken_badRequest() throws Exception {
            register("mixedup", "mixedup@example.com");
            JsonNode tokens = login("mixedup", "password123");

            mockMvc.perform(post(BASE + "/refresh")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json(new RefreshRequest(tokens.get("accessToken").asText()))))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("no token: 401 problem detail")
        void me_anonymous_unauthorized() throws Exception {
            mockMvc.perform(get(BASE + "/me"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON));
        }
    }

    private void register(String username, String email) throws Exception {
        mockMvc.perform(post(BASE + "/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new RegisterRequest(username, email, "password123"))))
                .andExpect(status().isCreated());
    }

    private JsonNode login(String username, String password) throws Exception {
        MvcResult result = mockMvc.perform(post(BASE + "/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(new LoginRequest(username, password))))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }
}
