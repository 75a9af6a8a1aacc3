package com.agentic.customergraph.api;

import com.agentic.customergraph.core.ExtractionRequest;
import com.agentic.customergraph.core.GraphExtractionService;
import com.agentic.customergraph.core.GraphSnapshot;
import com.agentic.customergraph.storage.ExtractionStore;
import com.agentic.customergraph.storage.GraphDatabase;
import com.agentic.customergraph.storage.GraphDatabase.RecordKind;
import com.agentic.customergraph.storage.UploadRecordStore;
import com.agentic.customergraph.upload.BulkUploadCoordinator;
import com.agentic.customergraph.upload.BulkUploadRequest;
import com.agentic.customergraph.upload.BulkUploadResult;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

@Path("/customer-graphs")
public class CustomerGraphResources {

    @Inject
    GraphExtractionService extractionService;

    @Inject
    ExtractionStore extractionStore;

    @Inject
    BulkUploadCoordinator uploadCoordinator;

    @Inject
    UploadRecordStore uploadRecordStore;

    @Inject
    GraphDatabase graphDatabase;

    @POST
    @Path("/extractions")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response extract(@Valid final ExtractionRequest request) {
        final GraphSnapshot snapshot = extractionService.extract(request);

        return Response.created(URI.create("/customer-graphs/" + snapshot.customerId()
                        + "/extractions/" + snapshot.extractionId()))
                .entity(ExtractionSummaryResponse.of(snapshot))
                .build();
    }

    @GET
    @Path("/{customerId}/extractions")
    @Produces(MediaType.APPLICATION_JSON)
    public List<String> listExtractions(@PathParam("customerId") final String customerId) {
        return join(extractionStore.listExtractions(customerId));
    }

    @GET
    @Path("/{customerId}/extractions/{extractionId}")
    @Produces(MediaType.APPLICATION_JSON)
    public GraphSnapshot getExtraction(
            @PathParam("customerId") final String customerId,
            @PathParam("extractionId") final String extractionId) {
        return join(extractionStore.read(customerId, extractionId));
    }

    @POST
    @Path("/uploads")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public BulkUploadResult upload(@Valid final BulkUploadRequest request) {
        return uploadCoordinator.upload(request);
    }

    @GET
    @Path("/{customerId}/uploads")
    @Produces(MediaType.APPLICATION_JSON)
    public List<UploadRecordResponse> uploads(@PathParam("customerId") final String customerId) {
        return join(uploadRecordStore.latestByCustomer(customerId)).stream()
                .map(UploadRecordResponse::of)
                .toList();
    }

    @GET
    @Path("/{customerId}/graph")
    @Produces(MediaType.APPLICATION_JSON)
    public List<GraphRecordResponse> graph(
            @PathParam("customerId") final String customerId,
            @QueryParam("kind") @DefaultValue("VERTEX") final String kind,
            @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(10000) final int limit) {
        final RecordKind recordKind = parseKind(kind);
        return join(graphDatabase.queryByCustomer(customerId, recordKind, limit)).stream()
                .map(GraphRecordResponse::of)
                .toList();
    }

    private static RecordKind parseKind(final String kind) {
        try {
            return RecordKind.valueOf(kind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("kind must be VERTEX or EDGE, got: " + kind, e);
        }
    }

    private static <T> T join(final CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
