package broker.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import broker.core.port.in.SessionManagement.SessionExpiredException;
import broker.core.port.out.IdentityProviderClient.UpstreamRejectedException;
import broker.core.port.out.IdentityProviderClient.UpstreamUnavailableException;
import broker.core.port.out.KeyValueStore.StoreUnavailableException;
import broker.core.service.auth.PkceService.InvalidStateException;

/**
 * Global exception mappers for converting broker exceptions to RFC 7807 Problem Details.
 *
 * <p>Details never carry token material or upstream response bodies.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapInvalidStateException(InvalidStateException e) {
        LOG.debugv("Callback with invalid state: {0}", e.getMessage());
        return toResponse(BrokerProblem.invalidState(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapSessionExpiredException(SessionExpiredException e) {
        LOG.debugv("No usable session: {0}", e.getReason());
        return toResponse(BrokerProblem.unauthorized(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapUpstreamRejectedException(UpstreamRejectedException e) {
        LOG.warnv("Identity provider rejected request: {0}", e.getMessage());
        return toResponse(BrokerProblem.badGateway("Identity provider rejected the request"));
    }

    @ServerExceptionMapper
    public Response mapUpstreamUnavailableException(UpstreamUnavailableException e) {
        LOG.warnv("Identity provider unavailable: {0}", e.getMessage());
        return toResponse(BrokerProblem.serviceUnavailable("Identity provider unavailable"));
    }

    @ServerExceptionMapper
    public Response mapStoreUnavailableException(StoreUnavailableException e) {
        LOG.warnv("Session store unavailable during {0}", e.getOperation());
        return toResponse(BrokerProblem.serviceUnavailable("Session store unavailable"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(BrokerProblem.badRequest(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
