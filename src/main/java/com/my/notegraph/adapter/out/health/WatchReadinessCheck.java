package com.my.notegraph.adapter.out.health;

import com.my.notegraph.domain.model.VaultLayout;
import com.my.notegraph.domain.service.GraphState;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Readiness
@ApplicationScoped
public class WatchReadinessCheck implements HealthCheck {

    private final GraphState graphState;

    public WatchReadinessCheck(GraphState graphState) {
        this.graphState = graphState;
    }

    @Override
    public HealthCheckResponse call() {
        Optional<VaultLayout> layout = graphState.layout();
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("graph-sync-readiness")
                .withData("nodeCount", graphState.current().size());
        if (layout.isEmpty()) {
            // 폴더를 아직 로드하지 않은 상태도 정상이다.
            return builder.withData("watchedFolder", "").up().build();
        }
        String folder = layout.get().watchedFolder().orElse(layout.get().writePath());
        boolean folderOk = Files.isDirectory(Path.of(folder));
        return builder
                .withData("watchedFolder", folder)
                .withData("watchedFolderExists", folderOk)
                .status(folderOk)
                .build();
    }
}
