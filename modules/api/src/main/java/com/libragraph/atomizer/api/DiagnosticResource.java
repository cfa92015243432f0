package com.libragraph.atomizer.api;

import com.libragraph.atomizer.formats.registry.AtomizerRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    AtomizerRegistry registry;

    public record AtomizerInfo(String name, int priority) {}

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Atomizer is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile
        );
    }

    /**
     * Registered atomizers in selection order.
     */
    @GET
    @Path("/atomizers")
    public List<AtomizerInfo> atomizers() {
        return registry.atomizers().stream()
                .map(a -> new AtomizerInfo(a.name(), a.priority()))
                .toList();
    }
}
