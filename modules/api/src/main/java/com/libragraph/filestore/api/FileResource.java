package com.libragraph.filestore.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.libragraph.filestore.api.dto.DeleteReportResponse;
import com.libragraph.filestore.api.dto.FileDetailsResponse;
import com.libragraph.filestore.api.dto.FileListResponse;
import com.libragraph.filestore.core.access.CallerIdentity;
import com.libragraph.filestore.core.access.FileRetriever;
import com.libragraph.filestore.core.catalog.CatalogException;
import com.libragraph.filestore.core.catalog.MetadataCatalog;
import com.libragraph.filestore.core.delete.DeletionCoordinator;
import com.libragraph.filestore.core.upload.UploadCoordinator;
import com.libragraph.filestore.core.upload.UploadOptions;
import com.libragraph.filestore.core.upload.UploadOptionsDecoder;
import com.libragraph.filestore.core.upload.UploadedPayload;
import com.libragraph.filestore.types.SortOrder;
import com.libragraph.filestore.util.Numbers;
import com.libragraph.filestore.util.ParseResult;
import com.libragraph.filestore.util.StorageNames;
import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.ResponseStatus;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class FileResource {

    private static final Logger log = Logger.getLogger(FileResource.class);

    @Inject
    CallerResolver callers;

    @Inject
    MetadataCatalog catalog;

    @Inject
    UploadCoordinator uploads;

    @Inject
    DeletionCoordinator deletions;

    @Inject
    FileRetriever retriever;

    @Inject
    UploadOptionsDecoder optionsDecoder;

    @ConfigProperty(name = "filestore.list.default-page-size", defaultValue = "20")
    int defaultPageSize;

    @ConfigProperty(name = "filestore.list.max-page-size", defaultValue = "500")
    int maxPageSize;

    @ConfigProperty(name = "filestore.io.timeout", defaultValue = "30S")
    Duration timeout;

    @GET
    @Path("/list")
    public Uni<FileListResponse> list(@Context HttpHeaders headers,
                                      @RestQuery String page,
                                      @RestQuery String pagination,
                                      @RestQuery String sortBy) {
        callers.require(headers);
        int pageNumber = Numbers.parsePositiveInt(page).orElse(1);
        int pageSize = Math.min(Numbers.parsePositiveInt(pagination).orElse(defaultPageSize), maxPageSize);
        SortOrder order = SortOrder.fromLabel(sortBy).orElse(SortOrder.ORIGINAL_NAME);

        return catalog.list(pageNumber, pageSize, order)
                .ifNoItem().after(timeout)
                .failWith(() -> new CatalogException("Timed out listing file records"))
                .onFailure().invoke(e -> log.errorf("Error Getting File List: %s", e.getMessage()))
                .onItem().transform(FileListResponse::from);
    }

    @POST
    @Path("/upload")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    @ResponseStatus(201)
    public Uni<List<FileDetailsResponse>> upload(@Context HttpHeaders headers,
                                                 @RestForm("file") List<FileUpload> files,
                                                 @RestForm("ops") String ops) {
        CallerIdentity caller = callers.require(headers);
        ParseResult<UploadOptions> options = optionsDecoder.decode(ops);
        if (!options.isOk()) {
            throw new InvalidRequestException(options.error());
        }
        if (files == null || files.isEmpty()) {
            throw new InvalidRequestException("No files were uploaded");
        }

        List<UploadedPayload> payloads = new ArrayList<>(files.size());
        for (FileUpload f : files) {
            payloads.add(new UploadedPayload(f.uploadedFile(), f.fileName(), f.contentType(), f.size()));
        }
        log.debugf("Upload of %d file(s) by %s", payloads.size(), caller.ownerId());

        return uploads.upload(caller.ownerId(), payloads, options.value().isPrivate())
                .onItem().transform(records -> records.stream().map(FileDetailsResponse::from).toList());
    }

    @GET
    @Path("/{name}")
    @Produces(MediaType.WILDCARD)
    @Blocking
    public Uni<Response> retrieve(@Context HttpHeaders headers, @RestPath String name) {
        CallerIdentity caller = callers.resolve(headers);
        return retriever.retrieve(name, caller)
                .onItem().transform(file -> {
                    String mimeType = file.record().mimeType() == null
                            ? MediaType.APPLICATION_OCTET_STREAM
                            : file.record().mimeType();
                    String downloadName = StorageNames.sanitize(file.record().originalFilename());
                    return Response.ok(file.content())
                            .type(mimeType)
                            .header("Content-Disposition", "inline; filename=\"" + downloadName + "\"")
                            .build();
                });
    }

    @POST
    @Path("/delete")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<List<DeleteReportResponse>> delete(@Context HttpHeaders headers, JsonNode body) {
        callers.require(headers);
        List<String> names = storageNames(body);

        return deletions.delete(names)
                .onItem().transform(reports -> reports.stream().map(DeleteReportResponse::from).toList());
    }

    /**
     * @throws InvalidRequestException unless {@code body} is a JSON array of strings
     */
    static List<String> storageNames(JsonNode body) {
        if (body == null || !body.isArray()) {
            throw new InvalidRequestException("Invalid Input");
        }
        List<String> names = new ArrayList<>(body.size());
        for (JsonNode element : body) {
            if (!element.isTextual()) {
                throw new InvalidRequestException("Invalid Input");
            }
            names.add(element.textValue());
        }
        return names;
    }
}
