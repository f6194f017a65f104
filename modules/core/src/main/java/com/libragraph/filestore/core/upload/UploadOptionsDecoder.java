package com.libragraph.filestore.core.upload;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.filestore.util.ParseResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Decodes the JSON {@code ops} field of an upload request.
 *
 * <p>A missing or blank field yields the defaults. {@code isPrivate} is true
 * unless the document contains the JSON literal {@code false} for it.
 */
@ApplicationScoped
public class UploadOptionsDecoder {

    @Inject
    ObjectMapper objectMapper;

    public ParseResult<UploadOptions> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.ok(UploadOptions.defaults());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return ParseResult.err("Upload options are not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return ParseResult.err("Upload options must be a JSON object");
        }
        JsonNode isPrivate = root.get("isPrivate");
        boolean explicitlyPublic = isPrivate != null && isPrivate.isBoolean() && !isPrivate.booleanValue();
        return ParseResult.ok(new UploadOptions(!explicitlyPublic));
    }
}
