package villagecompute.autopost.api.rest;

import java.util.List;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.autopost.api.types.AccountProfileType;
import villagecompute.autopost.api.types.PlatformNoteType;
import villagecompute.autopost.exceptions.PlatformRejectedException;
import villagecompute.autopost.exceptions.ResourceNotFoundException;
import villagecompute.autopost.exceptions.SigningException;
import villagecompute.autopost.exceptions.VerificationChallengeException;
import villagecompute.autopost.services.AccountService;

/**
 * Account session checks against the platform.
 *
 * <ul>
 * <li>{@code POST /api/accounts/{id}/profile} – refresh user id and nickname from the session</li>
 * <li>{@code GET /api/accounts/{id}/notes} – list every note the account has posted</li>
 * </ul>
 */
@Path("/api/accounts")
@Produces(MediaType.APPLICATION_JSON)
@Tag(
        name = "Accounts",
        description = "Publishing account sessions")
public class PublishAccountResource {

    private static final Logger LOG = Logger.getLogger(PublishAccountResource.class);

    @Inject
    AccountService accountService;

    @POST
    @Path("/{id}/profile")
    @Operation(
            summary = "Refresh account profile")
    public Response refreshProfile(@PathParam("id") String accountId) {
        try {
            AccountProfileType profile = accountService.refreshProfile(accountId);
            return Response.ok(profile).build();
        } catch (RuntimeException e) {
            return platformError(accountId, e);
        }
    }

    @GET
    @Path("/{id}/notes")
    @Operation(
            summary = "List posted notes")
    public Response listNotes(@PathParam("id") String accountId) {
        try {
            List<PlatformNoteType> notes = accountService.listNotes(accountId);
            return Response.ok(notes).build();
        } catch (RuntimeException e) {
            return platformError(accountId, e);
        }
    }

    private Response platformError(String accountId, RuntimeException e) {
        if (e instanceof ResourceNotFoundException) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        }
        if (e instanceof VerificationChallengeException || e instanceof PlatformRejectedException
                || e instanceof SigningException) {
            LOG.warnf("Platform call for account %s failed: %s", accountId, e.getMessage());
            return Response.status(Response.Status.BAD_GATEWAY).entity(new ErrorResponse(e.getMessage())).build();
        }
        throw e;
    }

    public record ErrorResponse(String error) {
    }
}
