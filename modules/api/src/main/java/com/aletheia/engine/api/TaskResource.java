package com.aletheia.engine.api;

import com.aletheia.engine.core.error.ValidationException;
import com.aletheia.engine.core.matching.AcceptanceTracker;
import com.aletheia.engine.core.task.NewTask;
import com.aletheia.engine.core.task.Task;
import com.aletheia.engine.core.task.TaskService;
import com.aletheia.engine.core.verification.ProgressReport;
import com.aletheia.engine.core.verification.VerificationCollector;
import com.aletheia.engine.core.verification.VerificationMonitor;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.ResponseStatus;

/**
 * Task intake and inspection, worker submissions and acceptances.
 */
@Path("/api/tasks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TaskResource {

    @Inject
    TaskService taskService;

    @Inject
    VerificationCollector collector;

    @Inject
    VerificationMonitor monitor;

    @Inject
    AcceptanceTracker acceptances;

    @POST
    @ResponseStatus(201)
    public Task create(NewTask request) {
        return taskService.create(request);
    }

    @GET
    @Path("/{id}")
    public Task get(@PathParam("id") String id) {
        return taskService.get(id);
    }

    @GET
    @Path("/{id}/progress")
    public ProgressReport progress(@PathParam("id") String id) {
        return monitor.checkProgress(id);
    }

    @POST
    @Path("/{id}/submissions")
    @ResponseStatus(202)
    public SubmissionAck submit(@PathParam("id") String id, SubmissionRequest request) {
        if (request == null) {
            throw new ValidationException("Missing request body");
        }
        Task task = collector.submitVerification(id, request.workerId(), request.toSubmission());
        return new SubmissionAck(task.id(), request.workerId(), task.submissions().size(),
                task.verificationThreshold(), task.status());
    }

    @POST
    @Path("/{id}/acceptances")
    public Response accept(@PathParam("id") String id, AcceptanceRequest request) {
        if (request == null || request.workerId() == null || request.workerId().isBlank()) {
            throw new ValidationException("Missing required field: workerId");
        }
        if (!acceptances.respond(id, request.workerId(), request.isAccepted())) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(new ErrorResponse("conflict", "No open notification round for task " + id))
                    .build();
        }
        return Response.accepted().build();
    }
}
