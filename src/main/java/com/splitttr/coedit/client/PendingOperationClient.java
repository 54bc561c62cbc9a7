package com.splitttr.coedit.client;

import com.splitttr.coedit.message.CollaborationOperation;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/**
 * Pending-operation queue kept by the document service next to each
 * document, so a reload does not lose unacknowledged edits.
 */
@RegisterRestClient(configKey = "document-service")
@Path("/api/documents")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface PendingOperationClient {

    @GET
    @Path("/{type}/{id}/pending-operations")
    List<CollaborationOperation> list(@PathParam("type") String resourceType, @PathParam("id") String resourceId);

    @POST
    @Path("/{type}/{id}/pending-operations")
    void append(@PathParam("type") String resourceType, @PathParam("id") String resourceId,
                CollaborationOperation operation);

    @PUT
    @Path("/{type}/{id}/pending-operations")
    void replace(@PathParam("type") String resourceType, @PathParam("id") String resourceId,
                 List<CollaborationOperation> operations);
}
