package villagecompute.autopost.api.rest;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.autopost.api.types.CreateScheduledPostRequestType;
import villagecompute.autopost.api.types.RequeueRequestType;
import villagecompute.autopost.api.types.ScheduledPostType;
import villagecompute.autopost.data.models.ScheduledPost.PostStatus;
import villagecompute.autopost.exceptions.ResourceNotFoundException;
import villagecompute.autopost.exceptions.SchedulingException;
import villagecompute.autopost.exceptions.ValidationException;
import villagecompute.autopost.services.ScheduledPostService;

/**
 * REST endpoints for scheduled posts.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code POST /api/scheduled-posts} – create a batch of posts and their timers</li>
 * <li>{@code GET /api/scheduled-posts} – list, optionally by status and account</li>
 * <li>{@code GET /api/scheduled-posts/{id}} – get one post</li>
 * <li>{@code POST /api/scheduled-posts/{id}/run} – run now (PENDING or FAILED only)</li>
 * <li>{@code POST /api/scheduled-posts/{id}/requeue} – move a DONE or FAILED post back to PENDING</li>
 * <li>{@code POST /api/scheduled-posts/{id}/cancel} – cancel timer and remove the post</li>
 * <li>{@code DELETE /api/scheduled-posts/{id}} – remove the post</li>
 * </ul>
 *
 * <p>
 * Run-now answers 202 as soon as the run is handed to the pipeline pool; poll the post for the outcome.
 */
@Path("/api/scheduled-posts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(
        name = "Scheduled Posts",
        description = "Scheduled note publishing")
public class ScheduledPostResource {

    private static final Logger LOG = Logger.getLogger(ScheduledPostResource.class);

    @Inject
    ScheduledPostService scheduledPostService;

    @POST
    @Operation(
            summary = "Schedule posts",
            description = "Create a batch of scheduled posts; nothing is created if any entry is invalid")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "201",
                    description = "Posts created and scheduled",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ScheduleResponse.class))),
                    @APIResponse(
                            responseCode = "400",
                            description = "Invalid account, image count or aspect ratio",
                            content = @Content(
                                    mediaType = MediaType.APPLICATION_JSON))})
    public Response schedule(@Valid @NotEmpty List<@Valid CreateScheduledPostRequestType> requests) {
        try {
            List<Long> ids = scheduledPostService.schedulePosts(requests);
            return Response.status(Response.Status.CREATED).entity(new ScheduleResponse(ids)).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @GET
    @Operation(
            summary = "List scheduled posts")
    public Response list(@QueryParam("status") String status, @QueryParam("account_id") String accountId) {
        PostStatus parsed = null;
        if (status != null && !status.isBlank()) {
            try {
                parsed = PostStatus.valueOf(status.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ErrorResponse("Unknown status: " + status)).build();
            }
        }
        List<ScheduledPostType> posts = scheduledPostService.list(parsed, accountId).stream()
                .map(ScheduledPostType::fromEntity).toList();
        return Response.ok(posts).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get a scheduled post")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Post found",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON,
                            schema = @Schema(
                                    implementation = ScheduledPostType.class))),
                    @APIResponse(
                            responseCode = "404",
                            description = "Post not found")})
    public Response get(@PathParam("id") long id) {
        try {
            return Response.ok(ScheduledPostType.fromEntity(scheduledPostService.get(id))).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Path("/{id}/run")
    @Operation(
            summary = "Run a post now",
            description = "Allowed for PENDING and FAILED posts. FAILED posts are re-queued first.")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "202",
                    description = "Run started"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Post is RUNNING or DONE"),
                    @APIResponse(
                            responseCode = "404",
                            description = "Post not found"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Worker pool refused the run; the post stays scheduled")})
    public Response runNow(@PathParam("id") long id) {
        try {
            scheduledPostService.runNow(id);
            LOG.infof("Run-now accepted for post %d", id);
            return Response.status(Response.Status.ACCEPTED).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (SchedulingException e) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE).entity(new ErrorResponse(e.getMessage()))
                    .build();
        }
    }

    @POST
    @Path("/{id}/requeue")
    @Operation(
            summary = "Re-queue a finished post")
    public Response requeue(@PathParam("id") long id, RequeueRequestType request) {
        try {
            scheduledPostService.requeue(id, request == null ? null : request.runAt());
            return Response.ok(ScheduledPostType.fromEntity(scheduledPostService.get(id))).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @POST
    @Path("/{id}/cancel")
    @Operation(
            summary = "Cancel a post")
    public Response cancel(@PathParam("id") long id) {
        try {
            scheduledPostService.cancel(id);
            return Response.noContent().build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete a post")
    public Response delete(@PathParam("id") long id) {
        try {
            scheduledPostService.delete(id);
            return Response.noContent().build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
    }

    /**
     * Ids of created posts, in request order.
     */
    public record ScheduleResponse(List<Long> ids) {
    }

    public record ErrorResponse(String error) {
    }
}
