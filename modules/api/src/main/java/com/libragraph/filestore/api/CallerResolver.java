package com.libragraph.filestore.api;

import com.libragraph.filestore.core.access.CallerIdentity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.HttpHeaders;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Establishes the caller from a header set by the authenticating gateway in front
 * of this service. Credentials are never seen here; the header is trusted as-is.
 */
@ApplicationScoped
public class CallerResolver {

    @ConfigProperty(name = "filestore.auth.owner-header", defaultValue = "X-User-Id")
    String ownerHeader;

    public CallerIdentity resolve(HttpHeaders headers) {
        return resolve(headers.getHeaderString(ownerHeader));
    }

    CallerIdentity resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return CallerIdentity.anonymous();
        }
        return CallerIdentity.of(headerValue.trim());
    }

    /**
     * @throws NotAuthenticatedException if the caller is anonymous
     */
    public CallerIdentity require(HttpHeaders headers) {
        CallerIdentity caller = resolve(headers);
        if (!caller.authenticated()) {
            throw new NotAuthenticatedException();
        }
        return caller;
    }
}
