package broker.core.service.session;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import broker.core.config.SessionConfig;
import broker.core.model.session.Session;
import broker.core.port.in.SessionManagement.SessionExpiredException;
import broker.core.port.in.SessionManagement.SessionExpiredException.Reason;
import broker.core.port.out.KeyValueStore;

/**
 * Typed session persistence on top of the {@link KeyValueStore}.
 *
 * <p>Sessions are stored as JSON under {@code sessionKeyPrefix + id}. Every write uses the time
 * left until the session's absolute {@code expiresAt} as TTL, so refreshes and rotations never
 * extend a session beyond its original lifetime.
 *
 * <p>Refresh leases live under {@code leaseKeyPrefix + id} and hold a random owner token.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final SecureTokenGenerator tokenGenerator;
    private final SessionConfig config;
    private final Clock clock;

    @Inject
    public SessionStore(
            KeyValueStore store,
            ObjectMapper objectMapper,
            SecureTokenGenerator tokenGenerator,
            SessionConfig config,
            Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.tokenGenerator = tokenGenerator;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Store a session under a freshly generated identifier.
     *
     * <p>Uses insert-if-absent and retries with a new ID on collision, up to the configured
     * maximum. Used both for new sessions and for rotation; the ID of {@code draft} is ignored.
     *
     * @param draft the session contents
     * @return the stored session carrying its new ID
     */
    public Uni<Session> insertWithNewId(Session draft) {
        return insertWithRetry(draft, 0);
    }

    private Uni<Session> insertWithRetry(Session draft, int attempt) {
        int maxRetries = config.idGeneration().maxRetries();
        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new IllegalStateException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        final var ttl = draft.remainingLifetime(clock.instant());
        if (ttl.isZero() || ttl.isNegative()) {
            return Uni.createFrom().failure(new SessionExpiredException(Reason.NO_SESSION));
        }

        final var session = draft.withId(tokenGenerator.sessionId());
        return store.putIfAbsent(sessionKey(session.id()), serialize(session), ttl)
                .flatMap(saved -> {
                    if (saved) {
                        LOG.debugf("Session stored: %s", session.id());
                        return Uni.createFrom().item(session);
                    }
                    LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
                    return insertWithRetry(draft, attempt + 1);
                });
    }

    /**
     * Retrieve a session.
     *
     * <p>A record that cannot be parsed is deleted and reported as absent.
     *
     * @param sessionId the session ID
     * @return the session, or empty if not found
     */
    public Uni<Optional<Session>> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return store.get(sessionKey(sessionId)).flatMap(value -> {
            if (value.isEmpty()) {
                return Uni.createFrom().item(Optional.<Session>empty());
            }
            try {
                return Uni.createFrom().item(Optional.of(objectMapper.readValue(value.get(), Session.class)));
            } catch (JsonProcessingException e) {
                LOG.warnf("Discarding unreadable session record %s: %s", sessionId, e.getOriginalMessage());
                return delete(sessionId).replaceWith(Optional.<Session>empty());
            }
        });
    }

    /**
     * Replace a session under its current ID, keeping its absolute deadline.
     *
     * <p>Only an existing record is replaced; a session deleted in the meantime stays deleted.
     *
     * @param session the updated session
     * @return the stored session
     * @throws SessionExpiredException if the session's lifetime has already ended or the record is gone
     */
    public Uni<Session> update(Session session) {
        final var ttl = session.remainingLifetime(clock.instant());
        if (ttl.isZero() || ttl.isNegative()) {
            return discard(session.id(), Reason.NO_SESSION);
        }
        return store.replaceIfPresent(sessionKey(session.id()), serialize(session), ttl)
                .flatMap(replaced -> {
                    if (replaced) {
                        return Uni.createFrom().item(session);
                    }
                    // Logged out or rotated away while the caller held the old record
                    LOG.debugf("Session %s disappeared before update, not recreating it", session.id());
                    return Uni.createFrom().<Session>failure(new SessionExpiredException(Reason.NO_SESSION));
                });
    }

    /**
     * Delete a session. Deleting an absent session is not an error.
     *
     * @param sessionId the session ID
     * @return Uni completing when deleted
     */
    public Uni<Void> delete(String sessionId) {
        return store.delete(sessionKey(sessionId));
    }

    /**
     * Delete a session and fail with {@link SessionExpiredException}.
     *
     * @param sessionId the session ID
     * @param reason why the session is being discarded
     * @return a Uni that always fails
     */
    public <T> Uni<T> discard(String sessionId, Reason reason) {
        LOG.infof("Discarding session %s: %s", sessionId, reason);
        return delete(sessionId)
                .onItem()
                .transformToUni(v -> Uni.createFrom().<T>failure(new SessionExpiredException(reason)));
    }

    /**
     * Try to become the only refresher of a session.
     *
     * @param sessionId the session ID
     * @return the lease owner token if acquired, empty if another request holds the lease
     */
    public Uni<Optional<String>> tryAcquireLease(String sessionId) {
        final var owner = tokenGenerator.leaseOwner();
        return store.putIfAbsent(leaseKey(sessionId), owner, config.refresh().leaseTtl())
                .map(acquired -> acquired ? Optional.of(owner) : Optional.<String>empty());
    }

    /**
     * Release a refresh lease if it is still owned by {@code owner}.
     *
     * <p>A failed release is logged and not propagated: the lease lapses on its own after its
     * TTL, and the refresh it guarded has already been committed.
     *
     * @param sessionId the session ID
     * @param owner the owner token returned by {@link #tryAcquireLease}
     * @return Uni completing when released
     */
    public Uni<Void> releaseLease(String sessionId, String owner) {
        return store.deleteIfEquals(leaseKey(sessionId), owner)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to release refresh lease for %s, it expires in %s: %s",
                            sessionId, config.refresh().leaseTtl(), error.getMessage());
                    return false;
                })
                .replaceWithVoid();
    }

    private String serialize(Session session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session", e);
        }
    }

    private String sessionKey(String sessionId) {
        return config.storage().sessionKeyPrefix() + sessionId;
    }

    private String leaseKey(String sessionId) {
        return config.storage().leaseKeyPrefix() + sessionId;
    }
}
