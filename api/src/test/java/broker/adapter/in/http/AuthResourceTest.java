package broker.adapter.in.http;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import broker.mock.MockIdentityProviderClient;

@QuarkusTest
@DisplayName("AuthResource")
class AuthResourceTest {

    private static final String COOKIE = "bionicpro_session";
    private static final Pattern STATE = Pattern.compile("[?&]state=([^&]+)");

    @Inject
    MockIdentityProviderClient identityProvider;

    private String startLogin() {
        String location = given().redirects()
                .follow(false)
                .when()
                .get("/auth/login")
                .then()
                .statusCode(302)
                .extract()
                .header("Location");
        var matcher = STATE.matcher(location);
        assertTrue(matcher.find(), "Authorization URL must carry a state");
        return URLDecoder.decode(matcher.group(1), StandardCharsets.UTF_8);
    }

    private String login() {
        String state = startLogin();
        return given().redirects()
                .follow(false)
                .queryParam("code", MockIdentityProviderClient.VALID_CODE)
                .queryParam("state", state)
                .when()
                .get("/auth/callback")
                .then()
                .statusCode(302)
                .extract()
                .cookie(COOKIE);
    }

    @Nested
    @DisplayName("GET /auth/login")
    class LoginTests {

        @Test
        @DisplayName("should redirect to the provider with an S256 challenge")
        void shouldRedirectToProvider() {
            given().redirects()
                    .follow(false)
                    .when()
                    .get("/auth/login")
                    .then()
                    .statusCode(302)
                    .header("Location", startsWith(MockIdentityProviderClient.AUTHORIZATION_ENDPOINT))
                    .header("Location", containsString("code_challenge_method=S256"));
        }
    }

    @Nested
    @DisplayName("GET /auth/callback")
    class CallbackTests {

        @Test
        @DisplayName("should set the session cookie and redirect to the front end")
        void shouldSetCookieAndRedirect() {
            String state = startLogin();

            given().redirects()
                    .follow(false)
                    .queryParam("code", MockIdentityProviderClient.VALID_CODE)
                    .queryParam("state", state)
                    .when()
                    .get("/auth/callback")
                    .then()
                    .statusCode(302)
                    .header("Location", is("http://localhost:3000"))
                    .cookie(COOKIE, notNullValue())
                    .header("Set-Cookie", containsString("HttpOnly"))
                    .header("Set-Cookie", containsString("Max-Age="));
        }

        @Test
        @DisplayName("should reject a replayed state")
        void shouldRejectReplayedState() {
            String state = startLogin();
            given().redirects()
                    .follow(false)
                    .queryParam("code", MockIdentityProviderClient.VALID_CODE)
                    .queryParam("state", state)
                    .get("/auth/callback")
                    .then()
                    .statusCode(302);

            given().redirects()
                    .follow(false)
                    .queryParam("code", MockIdentityProviderClient.VALID_CODE)
                    .queryParam("state", state)
                    .when()
                    .get("/auth/callback")
                    .then()
                    .statusCode(400)
                    .header("Set-Cookie", is((String) null));
        }

        @Test
        @DisplayName("should reject an unknown state")
        void shouldRejectUnknownState() {
            given().redirects()
                    .follow(false)
                    .queryParam("code", MockIdentityProviderClient.VALID_CODE)
                    .queryParam("state", "forged")
                    .when()
                    .get("/auth/callback")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("should reject a missing code")
        void shouldRejectMissingCode() {
            given().redirects()
                    .follow(false)
                    .queryParam("state", "anything")
                    .when()
                    .get("/auth/callback")
                    .then()
                    .statusCode(400);
        }

        @Test
        @DisplayName("should report a rejected code as bad gateway")
        void shouldReportRejectedCode() {
            String state = startLogin();

            given().redirects()
                    .follow(false)
                    .queryParam("code", MockIdentityProviderClient.REJECTED_CODE)
                    .queryParam("state", state)
                    .when()
                    .get("/auth/callback")
                    .then()
                    .statusCode(502)
                    .contentType(containsString("application/problem+json"));
        }
    }

    @Nested
    @DisplayName("GET /auth/session")
    class SessionTests {

        @Test
        @DisplayName("should report the session and rotate the cookie")
        void shouldRotateCookie() {
            String sessionId = login();

            String rotated = given().cookie(COOKIE, sessionId)
                    .when()
                    .get("/auth/session")
                    .then()
                    .statusCode(200)
                    .body("authenticated", is(true))
                    .body("session_valid_until", notNullValue())
                    .extract()
                    .cookie(COOKIE);

            assertNotNull(rotated);
            assertNotEquals(sessionId, rotated);

            given().cookie(COOKIE, sessionId).when().get("/auth/session").then().statusCode(401);
            given().cookie(COOKIE, rotated).when().get("/auth/session").then().statusCode(200);
        }

        @Test
        @DisplayName("should answer 401 without a cookie")
        void shouldRequireCookie() {
            given().when()
                    .get("/auth/session")
                    .then()
                    .statusCode(401)
                    .contentType(containsString("application/problem+json"));
        }
    }

    @Nested
    @DisplayName("GET /auth/validate")
    class ValidateTests {

        @Test
        @DisplayName("should return the access token without rotating")
        void shouldReturnAccessToken() {
            String sessionId = login();

            given().cookie(COOKIE, sessionId)
                    .when()
                    .get("/auth/validate")
                    .then()
                    .statusCode(200)
                    .body("access_token", startsWith("access-"))
                    .header("Set-Cookie", is((String) null));

            given().cookie(COOKIE, sessionId).when().get("/auth/validate").then().statusCode(200);
        }

        @Test
        @DisplayName("should answer 401 for an unknown session")
        void shouldRejectUnknownSession() {
            given().cookie(COOKIE, "unknown").when().get("/auth/validate").then().statusCode(401);
        }
    }

    @Nested
    @DisplayName("GET /auth/introspect")
    class IntrospectTests {

        @Test
        @DisplayName("should return the provider's claims")
        void shouldReturnClaims() {
            String sessionId = login();

            given().cookie(COOKIE, sessionId)
                    .when()
                    .get("/auth/introspect")
                    .then()
                    .statusCode(200)
                    .body("active", is(true))
                    .body("sub", is("test-user"));
        }
    }

    @Nested
    @DisplayName("GET /auth/logout")
    class LogoutTests {

        @Test
        @DisplayName("should revoke, clear the cookie and redirect to the front end")
        void shouldLogout() {
            String sessionId = login();
            int revokedBefore = identityProvider.revokedTokens().size();

            given().redirects()
                    .follow(false)
                    .cookie(COOKIE, sessionId)
                    .when()
                    .get("/auth/logout")
                    .then()
                    .statusCode(302)
                    .header("Location", is("http://localhost:3000"))
                    .header("Set-Cookie", containsString("Max-Age=0"));

            assertTrue(identityProvider.revokedTokens().size() > revokedBefore);
            given().cookie(COOKIE, sessionId).when().get("/auth/validate").then().statusCode(401);
        }

        @Test
        @DisplayName("should clear the cookie without a session")
        void shouldLogoutWithoutSession() {
            given().redirects()
                    .follow(false)
                    .when()
                    .get("/auth/logout")
                    .then()
                    .statusCode(302)
                    .header("Set-Cookie", containsString(COOKIE + "="));
        }
    }

    @Nested
    @DisplayName("Health")
    class HealthTests {

        @Test
        @DisplayName("GET /health should report healthy")
        void shouldReportHealthy() {
            given().when().get("/health").then().statusCode(200).body("status", is("healthy"));
        }

        @Test
        @DisplayName("GET /q/health/ready should include the storage check")
        void shouldReportStorageReadiness() {
            given().when()
                    .get("/q/health/ready")
                    .then()
                    .statusCode(200)
                    .body("status", is("UP"))
                    .body("checks.name", org.hamcrest.Matchers.hasItem("session-storage-memory"));
        }
    }
}
