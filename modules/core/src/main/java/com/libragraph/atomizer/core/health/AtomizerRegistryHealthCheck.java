package com.libragraph.atomizer.core.health;

import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.registry.AtomizerRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class AtomizerRegistryHealthCheck implements HealthCheck {

    @Inject
    AtomizerRegistry registry;

    @Override
    public HealthCheckResponse call() {
        var atomizers = registry.atomizers();
        if (atomizers.isEmpty()) {
            return HealthCheckResponse.named("atomizers")
                    .down()
                    .withData("error", "no atomizers registered")
                    .build();
        }
        return HealthCheckResponse.named("atomizers")
                .up()
                .withData("count", atomizers.size())
                .withData("names", String.join(",", atomizers.stream().map(Atomizer::name).toList()))
                .build();
    }
}
