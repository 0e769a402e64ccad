package io.github.chirino.tracker.api;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.bson.Document;
import org.jboss.logging.Logger;

@Path("/v1/health")
public class HealthResource {

    private static final Logger LOG = Logger.getLogger(HealthResource.class);

    @Inject MongoClient mongoClient;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Response health() {
        try {
            mongoClient.getDatabase("admin").runCommand(new Document("ping", 1));
            return Response.ok(Map.of("status", "ok", "datastore", "up")).build();
        } catch (MongoException e) {
            LOG.warnf(e, "Tracker datastore ping failed");
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(Map.of("status", "degraded", "datastore", "down"))
                    .build();
        }
    }
}
