package com.libragraph.checkpoint.core.health;

import com.libragraph.checkpoint.core.repository.RepositoryManager;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Ready when the store root exists (or can be created) and is writable.
 */
@Readiness
@ApplicationScoped
public class StoreRootHealthCheck implements HealthCheck {

    @Inject
    RepositoryManager repositoryManager;

    @Override
    public HealthCheckResponse call() {
        Path root = repositoryManager.storeRoot();
        try {
            Files.createDirectories(root);
            if (!Files.isWritable(root)) {
                return HealthCheckResponse.named("checkpoint-store")
                        .down()
                        .withData("root", root.toString())
                        .withData("error", "not writable")
                        .build();
            }
            return HealthCheckResponse.named("checkpoint-store")
                    .up()
                    .withData("root", root.toString())
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("checkpoint-store")
                    .down()
                    .withData("root", root.toString())
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
