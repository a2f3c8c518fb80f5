package broker.core.service.session;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.config.IdentityProviderConfig;
import broker.core.config.SessionConfig;
import broker.core.model.auth.Introspection;
import broker.core.model.auth.TokenSet;
import broker.core.model.session.Session;
import broker.core.port.in.SessionManagement;
import broker.core.port.out.BrokerMetrics;
import broker.core.port.out.IdentityProviderClient;
import broker.core.port.out.IdentityProviderClient.UpstreamRejectedException;
import broker.core.service.auth.PkceService;
import broker.core.service.auth.TokenVault;
import broker.core.service.auth.TokenVault.InvalidCiphertextException;

/**
 * Service for managing the session lifecycle.
 *
 * <p>Drives login and callback through the PKCE binding, keeps tokens fresh through
 * {@link SessionRefreshService}, rotates session identifiers on session-info and ends sessions
 * on logout.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final PkceService pkceService;
    private final TokenVault tokenVault;
    private final IdentityProviderClient identityProvider;
    private final SessionStore sessionStore;
    private final SessionRefreshService refreshService;
    private final SessionConfig sessionConfig;
    private final IdentityProviderConfig idpConfig;
    private final BrokerMetrics metrics;
    private final Clock clock;

    @Inject
    public SessionService(
            PkceService pkceService,
            TokenVault tokenVault,
            IdentityProviderClient identityProvider,
            SessionStore sessionStore,
            SessionRefreshService refreshService,
            SessionConfig sessionConfig,
            IdentityProviderConfig idpConfig,
            BrokerMetrics metrics,
            Clock clock) {
        this.pkceService = pkceService;
        this.tokenVault = tokenVault;
        this.identityProvider = identityProvider;
        this.sessionStore = sessionStore;
        this.refreshService = refreshService;
        this.sessionConfig = sessionConfig;
        this.idpConfig = idpConfig;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Uni<URI> login() {
        final var pkce = pkceService.generate();
        return pkceService
                .bind(pkce.state(), pkce.verifier())
                .map(v -> URI.create(identityProvider.authorizationUrl(pkce.challenge(), pkce.state())));
    }

    @Override
    public Uni<Session> callback(String code, String state) {
        if (code == null || code.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Missing authorization code"));
        }
        if (state == null || state.isBlank()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Missing state"));
        }

        return pkceService
                .consume(state)
                .flatMap(verifier -> identityProvider.exchangeCode(code, verifier, idpConfig.redirectUri()))
                .flatMap(tokens -> sessionStore.insertWithNewId(newSession(tokens)))
                .invoke(session -> LOG.infof("Session created, valid until %s", session.expiresAt()));
    }

    private Session newSession(TokenSet tokens) {
        final var refreshToken = tokens.refreshToken()
                .orElseThrow(() -> new UpstreamRejectedException("Token response has no refresh_token", 0));
        final Instant now = clock.instant();
        final var lifetime = tokens.expiresIn().orElse(sessionConfig.defaultAccessTokenTtl());
        return new Session(
                null,
                tokenVault.encrypt(tokens.accessToken()),
                tokenVault.encrypt(refreshToken),
                now.plus(lifetime),
                now,
                now.plus(sessionConfig.ttl()),
                Map.of());
    }

    @Override
    public Uni<Session> sessionInfo(String sessionId) {
        return refreshService.ensureFresh(sessionId).flatMap(current -> sessionStore
                .insertWithNewId(current)
                .call(rotated -> sessionStore.delete(current.id()))
                .invoke(rotated -> {
                    metrics.recordRotation();
                    LOG.debugf("Rotated session %s to %s", current.id(), rotated.id());
                }));
    }

    @Override
    public Uni<String> validate(String sessionId) {
        return refreshService.ensureFresh(sessionId).flatMap(this::decryptAccessToken);
    }

    @Override
    public Uni<Introspection> introspect(String sessionId) {
        return validate(sessionId).flatMap(identityProvider::introspect);
    }

    private Uni<String> decryptAccessToken(Session session) {
        try {
            return Uni.createFrom().item(tokenVault.decrypt(session.accessToken()));
        } catch (InvalidCiphertextException e) {
            LOG.warnf("Access token of session %s cannot be decrypted: %s", session.id(), e.getMessage());
            return sessionStore.discard(session.id(), SessionExpiredException.Reason.CORRUPTED);
        }
    }

    @Override
    public Uni<Void> logout(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().voidItem();
        }
        return sessionStore
                .find(sessionId)
                .flatMap(sessionOpt -> {
                    if (sessionOpt.isEmpty()) {
                        return Uni.createFrom().voidItem();
                    }
                    return revokeQuietly(sessionOpt.get());
                })
                .flatMap(v -> sessionStore.delete(sessionId))
                .invoke(() -> LOG.debugf("Session %s logged out", sessionId));
    }

    private Uni<Void> revokeQuietly(Session session) {
        final String refreshToken;
        try {
            refreshToken = tokenVault.decrypt(session.refreshToken());
        } catch (InvalidCiphertextException e) {
            LOG.warnf("Skipping provider logout for session %s: %s", session.id(), e.getMessage());
            metrics.recordLogout(false);
            return Uni.createFrom().voidItem();
        }
        return identityProvider
                .revoke(refreshToken)
                .invoke(outcome -> {
                    metrics.recordLogout(outcome.revoked());
                    if (!outcome.revoked()) {
                        LOG.warnf("Provider logout failed for session %s, deleting locally: %s",
                                session.id(), outcome.detail());
                    }
                })
                .replaceWithVoid();
    }
}
