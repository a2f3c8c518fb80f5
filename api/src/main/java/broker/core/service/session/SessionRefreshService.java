package broker.core.service.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.config.IdentityProviderConfig;
import broker.core.config.SessionConfig;
import broker.core.model.auth.TokenSet;
import broker.core.model.session.Session;
import broker.core.port.in.SessionManagement.SessionExpiredException;
import broker.core.port.in.SessionManagement.SessionExpiredException.Reason;
import broker.core.port.out.BrokerMetrics;
import broker.core.port.out.IdentityProviderClient;
import broker.core.port.out.IdentityProviderClient.UpstreamRejectedException;
import broker.core.port.out.IdentityProviderClient.UpstreamUnavailableException;
import broker.core.service.auth.TokenVault;
import broker.core.service.auth.TokenVault.InvalidCiphertextException;

/**
 * Keeps a session's access token usable: the refresh-check shared by session-info and validate.
 *
 * <p>While {@code now < accessTokenExpiresAt} the stored session is returned untouched and the
 * provider is not contacted. From the deadline on, tokens are refreshed reactively; there is no
 * early-refresh margin.
 *
 * <p>The provider accepts each refresh token once, so refreshes are serialized per session with
 * a lease in the key-value store. The lease holder re-reads the session, refreshes and writes the
 * result under the same ID. Requests that find the lease taken poll the session until the holder's
 * result is visible, the session disappears, or the lease frees up.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>Provider rejects the refresh token: the session is deleted, {@link SessionExpiredException}</li>
 *   <li>Provider unreachable: retried within the configured budget, then
 *       {@link UpstreamUnavailableException}; the session is left intact</li>
 *   <li>Stored refresh token cannot be decrypted: the session is deleted, {@link SessionExpiredException}</li>
 * </ul>
 */
@ApplicationScoped
public class SessionRefreshService {

    private static final Logger LOG = Logger.getLogger(SessionRefreshService.class);

    private final SessionStore sessionStore;
    private final TokenVault tokenVault;
    private final IdentityProviderClient identityProvider;
    private final SessionConfig config;
    private final IdentityProviderConfig idpConfig;
    private final BrokerMetrics metrics;
    private final Clock clock;

    @Inject
    public SessionRefreshService(
            SessionStore sessionStore,
            TokenVault tokenVault,
            IdentityProviderClient identityProvider,
            SessionConfig config,
            IdentityProviderConfig idpConfig,
            BrokerMetrics metrics,
            Clock clock) {
        this.sessionStore = sessionStore;
        this.tokenVault = tokenVault;
        this.identityProvider = identityProvider;
        this.config = config;
        this.idpConfig = idpConfig;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Return the session with a usable access token, refreshing it if its deadline has passed.
     *
     * @param sessionId the session ID
     * @return the current or refreshed session
     */
    public Uni<Session> ensureFresh(String sessionId) {
        return sessionStore.find(sessionId).flatMap(sessionOpt -> {
            if (sessionOpt.isEmpty()) {
                return Uni.createFrom().failure(new SessionExpiredException(Reason.NO_SESSION));
            }
            final var session = sessionOpt.get();
            if (!session.needsRefresh(clock.instant())) {
                return Uni.createFrom().item(session);
            }
            LOG.debugf("Access token of session %s reached its deadline, refreshing", sessionId);
            final long waitDeadline = System.nanoTime() + waitTimeout().toNanos();
            return refreshUnderLease(sessionId, waitDeadline);
        });
    }

    private Uni<Session> refreshUnderLease(String sessionId, long waitDeadline) {
        return sessionStore.tryAcquireLease(sessionId).flatMap(lease -> {
            if (lease.isEmpty()) {
                return awaitConcurrentRefresh(sessionId, waitDeadline);
            }
            return refreshHoldingLease(sessionId).eventually(() -> sessionStore.releaseLease(sessionId, lease.get()));
        });
    }

    private Uni<Session> awaitConcurrentRefresh(String sessionId, long waitDeadline) {
        if (System.nanoTime() - waitDeadline > 0) {
            LOG.warnf("Gave up waiting for concurrent refresh of session %s", sessionId);
            metrics.recordRefresh("unavailable");
            return Uni.createFrom()
                    .failure(new UpstreamUnavailableException("Timed out waiting for a concurrent token refresh"));
        }
        return Uni.createFrom()
                .voidItem()
                .onItem()
                .delayIt()
                .by(config.refresh().pollInterval())
                .flatMap(v -> sessionStore.find(sessionId))
                .flatMap(sessionOpt -> {
                    if (sessionOpt.isEmpty()) {
                        // The lease holder's refresh was rejected and the session deleted
                        return Uni.createFrom().failure(new SessionExpiredException(Reason.NO_SESSION));
                    }
                    if (!sessionOpt.get().needsRefresh(clock.instant())) {
                        metrics.recordRefresh("observed");
                        return Uni.createFrom().item(sessionOpt.get());
                    }
                    return refreshUnderLease(sessionId, waitDeadline);
                });
    }

    private Uni<Session> refreshHoldingLease(String sessionId) {
        return sessionStore.find(sessionId).flatMap(sessionOpt -> {
            if (sessionOpt.isEmpty()) {
                return Uni.createFrom().failure(new SessionExpiredException(Reason.NO_SESSION));
            }
            final var session = sessionOpt.get();
            if (!session.needsRefresh(clock.instant())) {
                // Refreshed by the previous lease holder between our read and our acquisition
                metrics.recordRefresh("observed");
                return Uni.createFrom().item(session);
            }

            final String refreshToken;
            try {
                refreshToken = tokenVault.decrypt(session.refreshToken());
            } catch (InvalidCiphertextException e) {
                LOG.warnf("Refresh token of session %s cannot be decrypted: %s", sessionId, e.getMessage());
                metrics.recordRefresh("corrupted");
                return sessionStore.discard(sessionId, Reason.CORRUPTED);
            }

            return callProvider(refreshToken)
                    .flatMap(tokens -> sessionStore.update(applyTokens(session, tokens)))
                    .invoke(refreshed -> {
                        metrics.recordRefresh("refreshed");
                        LOG.debugf("Session %s refreshed, access token valid until %s",
                                sessionId, refreshed.accessTokenExpiresAt());
                    })
                    .onFailure(UpstreamRejectedException.class)
                    .recoverWithUni(error -> {
                        LOG.infof("Provider rejected refresh for session %s: %s", sessionId, error.getMessage());
                        metrics.recordRefresh("rejected");
                        return sessionStore.discard(sessionId, Reason.REFRESH_REJECTED);
                    })
                    .onFailure(UpstreamUnavailableException.class)
                    .invoke(error -> {
                        LOG.warnf("Provider unavailable while refreshing session %s: %s", sessionId, error.getMessage());
                        metrics.recordRefresh("unavailable");
                    });
        });
    }

    /**
     * How long a waiter follows another request's refresh.
     *
     * <p>Never shorter than the holder's worst case (every provider attempt timing out) plus one
     * poll, so that waiters do not give up on a refresh that is still within its budget.
     */
    Duration waitTimeout() {
        final var configured = config.refresh().waitTimeout();
        final var holderWorstCase = idpConfig.timeout()
                .multipliedBy(1L + Math.max(0, config.refresh().retryBudget()))
                .plus(config.refresh().pollInterval());
        if (configured.compareTo(holderWorstCase) >= 0) {
            return configured;
        }
        LOG.debugf("Refresh wait timeout %s is below the provider budget, waiting %s", configured, holderWorstCase);
        return holderWorstCase;
    }

    private Uni<TokenSet> callProvider(String refreshToken) {
        final int retryBudget = config.refresh().retryBudget();
        final var call = identityProvider.refresh(refreshToken);
        if (retryBudget <= 0) {
            return call;
        }
        return call.onFailure(UpstreamUnavailableException.class).retry().atMost(retryBudget);
    }

    private Session applyTokens(Session session, TokenSet tokens) {
        final Instant now = clock.instant();
        final var lifetime = tokens.expiresIn().orElse(config.defaultAccessTokenTtl());
        final var encryptedRefresh = tokens.refreshToken().map(tokenVault::encrypt).orElse(session.refreshToken());
        return session.withTokens(tokenVault.encrypt(tokens.accessToken()), encryptedRefresh, now.plus(lifetime));
    }
}
