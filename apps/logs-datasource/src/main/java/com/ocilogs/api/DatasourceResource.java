package com.ocilogs.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.ocilogs.DatasourceException;
import com.ocilogs.datasource.DatasourceInstances;
import com.ocilogs.datasource.FieldValuesRequest;
import com.ocilogs.datasource.LogsDatasource;
import com.ocilogs.datasource.QueryResult;
import com.ocilogs.datasource.UnknownDatasourceException;
import com.ocilogs.model.OciResource;
import com.ocilogs.oci.ClientConstructionException;
import com.ocilogs.oci.InvalidCredentialException;
import com.ocilogs.oci.RemoteServiceException;
import com.ocilogs.oci.UnknownEnvironmentException;
import com.ocilogs.oci.UnknownTenancyException;
import com.ocilogs.query.ConnectivityException;
import com.ocilogs.query.HealthResult;
import com.ocilogs.query.QueryContext;
import com.ocilogs.query.QueryRequest;
import com.ocilogs.query.RemoteCallException;
import com.ocilogs.query.RequestCancelledException;
import com.ocilogs.settings.ConfigException;
import com.ocilogs.settings.DatasourceSettings;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.jboss.logging.Logger;

@Path("/v1/datasources/{uid}")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class DatasourceResource {

    private static final Logger LOGGER = Logger.getLogger("API.DatasourceResource");

    public static record ConfigureResponse(String uid, String environment, List<String> tenancies) {
    }

    public static record QueryBatch(List<QueryRequest> queries) {
    }

    public static record QueryResponse(Map<String, QueryResult> results) {
    }

    public static record HealthResponse(String status, String message) {
    }

    public static record RegionsRequest(String tenancy) {
    }

    @Inject
    DatasourceInstances instances;

    @Inject
    HttpServerRequest httpRequest;

    @PostConstruct
    void init() {
        LOGGER.infov("[INIT] DatasourceResource listo. instances={0}",
                instances != null ? instances.getClass().getSimpleName() : "<null>");
    }

    @PUT
    public ConfigureResponse configure(@PathParam("uid") String uid, JsonNode body) {
        return call(uid, "configure", context -> {
            DatasourceSettings settings = DatasourceSettings.fromJson(body);
            LogsDatasource datasource = instances.configure(uid, settings);
            return new ConfigureResponse(uid, settings.environment(),
                    datasource.tenancies().stream().map(OciResource::name).toList());
        });
    }

    @DELETE
    public Response remove(@PathParam("uid") String uid) {
        return call(uid, "remove", context -> {
            instances.remove(uid);
            return Response.noContent().build();
        });
    }

    @POST
    @Path("/query")
    public QueryResponse query(@PathParam("uid") String uid, QueryBatch batch) {
        return call(uid, "query", context -> {
            List<QueryRequest> queries = Optional.ofNullable(batch).map(QueryBatch::queries).orElse(List.of());
            Map<String, QueryResult> results = new LinkedHashMap<>();
            instances.get(uid).query(queries, context).forEach(result -> results.put(result.refId(), result));
            return new QueryResponse(results);
        });
    }

    @GET
    @Path("/health")
    public HealthResponse health(@PathParam("uid") String uid) {
        return call(uid, "health", context -> {
            HealthResult result = instances.get(uid).checkHealth(context);
            return new HealthResponse(result.healthy() ? "OK" : "ERROR", result.message());
        });
    }

    @GET
    @Path("/tenancies")
    public List<OciResource> tenancies(@PathParam("uid") String uid) {
        return call(uid, "tenancies", context -> instances.get(uid).tenancies());
    }

    @POST
    @Path("/regions")
    public List<String> regions(@PathParam("uid") String uid, RegionsRequest request) {
        return call(uid, "regions", context -> instances.get(uid)
                .subscribedRegions(request == null ? null : request.tenancy(), context));
    }

    @POST
    @Path("/getquery")
    public List<String> fieldValues(@PathParam("uid") String uid, FieldValuesRequest request) {
        return call(uid, "getquery", context -> {
            if (request == null) {
                throw new WebApplicationException(failure(Response.Status.BAD_REQUEST,
                        "getquery requires a request body", context.requestId()));
            }
            return instances.get(uid).fieldValues(request, context);
        });
    }

    private <T> T call(String uid, String operation, Function<QueryContext, T> action) {
        QueryContext context = QueryContext.create();
        if (httpRequest != null) {
            cancelOnClose(context, httpRequest.response());
        }
        Instant start = Instant.now();
        LOGGER.infov("[COMM-START] requestId={0} target=Datasource uid={1} op={2}", context.requestId(), uid, operation);
        try {
            T result = action.apply(context);
            LOGGER.infov("[COMM-END] requestId={0} target=Datasource uid={1} op={2} durationMs={3}",
                    context.requestId(), uid, operation, Duration.between(start, Instant.now()).toMillis());
            return result;
        } catch (WebApplicationException e) {
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s uid=%s op=%s", context.requestId(), uid, operation);
            throw e;
        } catch (RuntimeException e) {
            Response.Status status = statusOf(e);
            LOGGER.errorf(e, "[COMM-ERROR] requestId=%s uid=%s op=%s status=%s",
                    context.requestId(), uid, operation, status.getStatusCode());
            String message = status == Response.Status.INTERNAL_SERVER_ERROR && !(e instanceof DatasourceException)
                    ? "No se pudo completar la operación."
                    : e.getMessage();
            throw new WebApplicationException(e, failure(status, message, context.requestId()));
        }
    }

    /**
     * Cancels the context when the client goes away before the response is written.
     */
    static QueryContext cancelOnClose(QueryContext context, HttpServerResponse response) {
        response.closeHandler(ignored -> {
            LOGGER.warnv("[COMM-CANCEL] requestId={0} conexión cerrada por el cliente", context.requestId());
            context.cancel();
        });
        return context;
    }

    static Response.Status statusOf(RuntimeException e) {
        if (e instanceof ConfigException
                || e instanceof InvalidCredentialException
                || e instanceof UnknownEnvironmentException
                || e instanceof ClientConstructionException) {
            return Response.Status.BAD_REQUEST;
        }
        if (e instanceof UnknownDatasourceException || e instanceof UnknownTenancyException) {
            return Response.Status.NOT_FOUND;
        }
        if (e instanceof RemoteCallException || e instanceof ConnectivityException || e instanceof RemoteServiceException) {
            return Response.Status.BAD_GATEWAY;
        }
        if (e instanceof RequestCancelledException) {
            return Response.Status.SERVICE_UNAVAILABLE;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    private static Response failure(Response.Status status, String message, String requestId) {
        return Response.status(status)
                .entity(Map.of(
                        "mensaje", message == null ? status.getReasonPhrase() : message,
                        "requestId", requestId))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }
}
