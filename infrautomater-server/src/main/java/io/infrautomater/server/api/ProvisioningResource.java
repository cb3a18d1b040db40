package io.infrautomater.server.api;

import io.infrautomater.core.orchestration.ProvisioningAction;
import io.infrautomater.core.orchestration.ProvisioningWorkerPool;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.RequestStore;
import io.infrautomater.core.request.ResourceRequest;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/// REST trigger surface for provisioning jobs.
///
/// Submission only: requests are created and approved elsewhere. Jobs run
/// asynchronously on the {@link ProvisioningWorkerPool}; clients poll
/// `GET /api/v1/provisioning/{requestId}` for the result.
///
/// | Method | Path | Precondition | Response |
/// |--------|------|--------------|----------|
/// | POST | `/{requestId}` | status `approved`, or `provisioning` with a job in flight | 202 |
/// | POST | `/{requestId}/destroy` | status `provisioned` or `failed` | 202 |
/// | GET | `/{requestId}` | request exists | 200 |
///
/// Unknown ids return 404; a status that does not allow the action returns 409.
@Path("/api/v1/provisioning")
@Produces(MediaType.APPLICATION_JSON)
public class ProvisioningResource {

    private static final Logger LOG = Logger.getLogger(ProvisioningResource.class);

    private final RequestStore requestStore;
    private final ProvisioningWorkerPool workerPool;

    @Inject
    public ProvisioningResource(RequestStore requestStore, ProvisioningWorkerPool workerPool) {
        this.requestStore = requestStore;
        this.workerPool = workerPool;
    }

    /// Queues provisioning of an approved request.
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"requestId": 42, "action": "provision"}
    /// ```
    @POST
    @Path("/{requestId}")
    public Response provision(@PathParam("requestId") long requestId) {
        ResourceRequest request = load(requestId);
        boolean running =
                request.status() == RequestStatus.PROVISIONING && workerPool.isInFlight(requestId);
        if (request.status() != RequestStatus.APPROVED && !running) {
            throw conflict(request, "approved");
        }

        workerPool.submitProvision(requestId);
        LOG.infov("Provisioning queued: request={0}", requestId);
        return accepted(requestId, ProvisioningAction.PROVISION);
    }

    /// Queues destruction of a provisioned or failed request.
    ///
    /// ### Response (202 Accepted)
    /// ```json
    /// {"requestId": 42, "action": "destroy"}
    /// ```
    @POST
    @Path("/{requestId}/destroy")
    public Response destroy(@PathParam("requestId") long requestId) {
        ResourceRequest request = load(requestId);
        if (!request.status().canTransitionTo(RequestStatus.DESTROYED)) {
            throw conflict(request, "provisioned or failed");
        }

        workerPool.submitDestroy(requestId);
        LOG.infov("Destroy queued: request={0}", requestId);
        return accepted(requestId, ProvisioningAction.DESTROY);
    }

    /// Returns the provisioning view of a request.
    ///
    /// ### Response (200 OK)
    /// ```json
    /// {"requestId": 42, "status": "provisioned", "notes": "Provisioned successfully: ...", "inFlight": false}
    /// ```
    @GET
    @Path("/{requestId}")
    public Response status(@PathParam("requestId") long requestId) {
        ResourceRequest request = load(requestId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requestId", request.id());
        body.put("resourceType", request.resourceType());
        body.put("status", request.status().value());
        body.put("notes", request.notes());
        body.put("inFlight", workerPool.isInFlight(requestId));
        return Response.ok(body).build();
    }

    private ResourceRequest load(long requestId) {
        return requestStore
                .get(requestId)
                .orElseThrow(() -> new NotFoundException("Request not found: " + requestId));
    }

    private static WebApplicationException conflict(ResourceRequest request, String expected) {
        return new WebApplicationException(
                "Request " + request.id() + " is " + request.status().value() + ", expected " + expected,
                Response.Status.CONFLICT);
    }

    private static Response accepted(long requestId, ProvisioningAction action) {
        return Response.accepted(Map.of("requestId", requestId, "action", action.value())).build();
    }
}
