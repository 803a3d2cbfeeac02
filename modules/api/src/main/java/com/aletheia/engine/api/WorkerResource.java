package com.aletheia.engine.api;

import com.aletheia.engine.core.error.NotFoundException;
import com.aletheia.engine.core.error.ValidationException;
import com.aletheia.engine.core.matching.WorkerCandidate;
import com.aletheia.engine.core.matching.WorkerDirectory;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.resteasy.reactive.ResponseStatus;

import java.util.List;

/**
 * Registry of worker profiles offered to the matcher.
 */
@Path("/api/workers")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WorkerResource {

    @Inject
    WorkerDirectory directory;

    @POST
    @ResponseStatus(201)
    public WorkerCandidate register(WorkerCandidate candidate) {
        if (candidate == null || candidate.workerId() == null || candidate.workerId().isBlank()) {
            throw new ValidationException("Missing required field: workerId");
        }
        directory.register(candidate);
        return candidate;
    }

    @GET
    public List<WorkerCandidate> list() {
        return directory.all();
    }

    @GET
    @Path("/{id}")
    public WorkerCandidate get(@PathParam("id") String id) {
        return directory.find(id).orElseThrow(() -> NotFoundException.worker(id));
    }

    @DELETE
    @Path("/{id}")
    @ResponseStatus(204)
    public void remove(@PathParam("id") String id) {
        if (!directory.remove(id)) {
            throw NotFoundException.worker(id);
        }
    }
}
