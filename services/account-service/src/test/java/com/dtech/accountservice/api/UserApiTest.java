package com.dtech.accountservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dtech.security.AuthorizationFailure;
import com.dtech.security.Identity;
import com.dtech.security.ResetPasswordTokenCodec;
import com.dtech.security.Role;
import com.dtech.security.TenantRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

@DisplayName("Users API")
class UserApiTest extends ApiTestSupport {

    @Autowired ResetPasswordTokenCodec resetTokens;

    @Nested
    @DisplayName("session credential")
    class SessionCredential {

        @Test
        @DisplayName("missing token is 401 'Token required' with a problem body")
        void missingToken() throws Exception {
            mockMvc.perform(get("/api/v1/users/me").header("X-Correlation-ID", "corr-401"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.detail").value(AuthorizationFailure.TOKEN_REQUIRED))
                    .andExpect(jsonPath("$.correlationId").value("corr-401"))
                    .andExpect(header().string("X-Correlation-ID", "corr-401"));
        }

        @Test
        @DisplayName("garbage token is 401 'token invalid'")
        void garbageToken() throws Exception {
            mockMvc.perform(bearer(get("/api/v1/users/me"), "not-a-jwt"))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.detail").value(AuthorizationFailure.TOKEN_INVALID));
        }

        @Test
        @DisplayName("GET /users/me returns the caller without the password hash")
        void me() throws Exception {
            mockMvc.perform(bearer(get("/api/v1/users/me"), rootToken()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.email").value(ROOT_EMAIL))
                    .andExpect(jsonPath("$.role").value("ADMIN"))
                    .andExpect(jsonPath("$.hashedPassword").doesNotExist());
        }

        @Test
        @DisplayName("a token of a deleted identity is rejected")
        void deletedIdentity() throws Exception {
            Identity admin = activeUser(Role.ADMIN);
            String token = login(admin.email(), "pw");

            mockMvc.perform(bearer(delete("/api/v1/users/" + admin.id()), rootToken()))
                    .andExpect(status().isNoContent());

            mockMvc.perform(bearer(get("/api/v1/users/me"), token)).andExpect(status().isUnauthorized());
        }

        @Test
        @DisplayName("VENDOR callers cannot reach ADMIN routes")
        void vendorForbidden() throws Exception {
            Identity vendorUser = activeUser(Role.VENDOR);

            mockMvc.perform(bearer(get("/api/v1/users"), login(vendorUser.email(), "pw")))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value(AuthorizationFailure.RESOURCE_NOT_ALLOWED));
        }

        @Test
        @DisplayName("wrong credentials at login are 401")
        void badLogin() throws Exception {
            mockMvc.perform(post("/api/v1/auth/login")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", ROOT_EMAIL, "password", "wrong")))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("profile")
    class Profile {

        @Test
        @DisplayName("updates names and changes the password")
        void updateAndChangePassword() throws Exception {
            Identity admin = activeUser(Role.ADMIN);
            String token = login(admin.email(), "pw");

            mockMvc.perform(bearer(put("/api/v1/users/me"), token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("firstName", "Grace", "lastName", "Hopper")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.firstName").value("Grace"));

            mockMvc.perform(bearer(put("/api/v1/users/me/password"), token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("currentPassword", "wrong", "password", "next-pw")))
                    .andExpect(status().isBadRequest());
            mockMvc.perform(bearer(put("/api/v1/users/me/password"), token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("currentPassword", "pw", "password", "next-pw")))
                    .andExpect(status().isNoContent());

            assertThat(login(admin.email(), "next-pw")).isNotBlank();
        }

        @Test
        @DisplayName("invalid bodies are 400 validation problems")
        void validation() throws Exception {
            mockMvc.perform(bearer(put("/api/v1/users/me"), rootToken())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("firstName", "", "lastName", "x")))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Validation Error"));
        }
    }

    @Nested
    @DisplayName("invitations")
    class Invitations {

        @Test
        @DisplayName("invite, inspect, accept, then the same token is a conflict")
        void fullFlow() throws Exception {
            String email = unique("new-admin") + "@dtech.test";
            mockMvc.perform(bearer(post("/api/v1/users"), rootToken())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", email)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.role").value("ADMIN"))
                    .andExpect(jsonPath("$.invitationAccepted").value(false));
            String token = invitationToken(email);

            mockMvc.perform(get("/api/v1/users/invitation").param("token", token))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.email").value(email));

            mockMvc.perform(post("/api/v1/users/accept-invitation").param("token", token)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("firstName", "New", "lastName", "Admin", "password", "secret")))
                    .andExpect(status().isNoContent());

            mockMvc.perform(get("/api/v1/users/invitation").param("token", token))
                    .andExpect(status().isConflict());
            assertThat(login(email, "secret")).isNotBlank();
        }

        @Test
        @DisplayName("a pending identity cannot use a session token")
        void pendingIdentityForbidden() throws Exception {
            String email = unique("pending") + "@dtech.test";
            mockMvc.perform(bearer(post("/api/v1/users"), rootToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json("email", email))).andExpect(status().isOk());
            // login refuses pending identities
            Identity pending = users.findByEmail(email).orElseThrow();
            String session = sessionTokens().issue(pending);

            mockMvc.perform(bearer(get("/api/v1/users/me"), session))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value(AuthorizationFailure.INVITATION_NOT_ACCEPTED));
        }

        @Test
        @DisplayName("tampered or missing invitation tokens are 401, duplicate e-mails 409")
        void rejected() throws Exception {
            String email = unique("tamper") + "@dtech.test";
            mockMvc.perform(bearer(post("/api/v1/users"), rootToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json("email", email))).andExpect(status().isOk());
            String token = invitationToken(email);
            String tampered = token.substring(0, token.length() - 1) + (token.endsWith("0") ? "1" : "0");

            mockMvc.perform(get("/api/v1/users/invitation").param("token", tampered))
                    .andExpect(status().isUnauthorized());
            mockMvc.perform(get("/api/v1/users/invitation")).andExpect(status().isUnauthorized());
            mockMvc.perform(bearer(post("/api/v1/users"), rootToken())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", email)))
                    .andExpect(status().isConflict());
        }
    }

    @Test
    @DisplayName("an e-mail with ':' in its quoted local part is 400 and leaves nothing behind")
    void separatorInEmail() throws Exception {
        String email = "\"a:" + unique("x") + "\"@dtech.test";

        for (int attempt = 0; attempt < 2; attempt++) {
            mockMvc.perform(bearer(post("/api/v1/users"), rootToken())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", email)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("E-mail must not contain ':'"));
        }
        assertThat(users.findByEmail(email)).isEmpty();
    }

    @Nested
    @DisplayName("password reset")
    class PasswordReset {

        @Test
        @DisplayName("request for an unknown e-mail is 404")
        void unknownEmail() throws Exception {
            mockMvc.perform(post("/api/v1/users/request-password-reset")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", "ghost@dtech.test")))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("a valid reset token sets a new password")
        void reset() throws Exception {
            Identity user = activeUser(Role.VENDOR);
            mockMvc.perform(post("/api/v1/users/request-password-reset")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("email", user.email())))
                    .andExpect(status().isNoContent());

            mockMvc.perform(post("/api/v1/users/reset-password").param("token", resetTokens.issue(user))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("password", "after-reset")))
                    .andExpect(status().isNoContent());

            assertThat(login(user.email(), "after-reset")).isNotBlank();
        }

        @Test
        @DisplayName("a malformed reset token is 401")
        void malformed() throws Exception {
            mockMvc.perform(post("/api/v1/users/reset-password").param("token", "a@b.c:soon:ff")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(json("password", "after-reset")))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Test
    @DisplayName("deleting a user removes its vendor memberships")
    void deleteCascades() throws Exception {
        Identity vendorUser = activeUser(Role.VENDOR);
        member(vendor(5), vendorUser, TenantRole.ANALYST, true);

        mockMvc.perform(bearer(delete("/api/v1/users/" + vendorUser.id()), rootToken()))
                .andExpect(status().isNoContent());

        assertThat(memberships.listByUser(vendorUser.id())).isEmpty();
        mockMvc.perform(bearer(delete("/api/v1/users/" + vendorUser.id()), rootToken()))
                .andExpect(status().isNotFound());
    }
}
