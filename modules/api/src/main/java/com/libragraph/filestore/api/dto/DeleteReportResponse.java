package com.libragraph.filestore.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.libragraph.filestore.core.delete.DeleteReport;

import java.util.List;

/**
 * One entry of a delete response. {@code fileDetails} is omitted when no record was removed.
 */
public record DeleteReportResponse(
        String filename,
        @JsonInclude(JsonInclude.Include.NON_NULL) FileDetailsResponse fileDetails,
        List<String> errors
) {

    public static DeleteReportResponse from(DeleteReport report) {
        return new DeleteReportResponse(
                report.filename(),
                report.fileDetails() == null ? null : FileDetailsResponse.from(report.fileDetails()),
                report.errors());
    }
}
