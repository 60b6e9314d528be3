package com.ocilogs.api;

import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Liveness of the service itself; datasource health is {@code GET /v1/datasources/{uid}/health}.
 */
@Path("/healthz")
@Produces(MediaType.TEXT_PLAIN)
public class HealthResource {

    @GET
    public String ok() {
        return "ok";
    }
}
