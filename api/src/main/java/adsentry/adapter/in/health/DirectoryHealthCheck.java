package adsentry.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.health.api.AsyncHealthCheck;
import io.smallrye.mutiny.Uni;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import adsentry.core.config.DirectoryConfig;
import adsentry.core.port.out.DirectoryClient;

/**
 * Readiness check for the directory server.
 *
 * <p>Probes the server on a throwaway connection, so an exhausted or flushed pool
 * does not affect the result. A server that answers, even by rejecting the
 * service credentials, is reported UP; pool statistics are attached as data.
 *
 * <p>Reports UP without probing when the directory client is disabled or not
 * configured, the same condition under which no LDAP client is built.
 */
@Readiness
@ApplicationScoped
public class DirectoryHealthCheck implements AsyncHealthCheck {

    static final String NAME = "directory";

    private final DirectoryClient directory;
    private final DirectoryConfig config;

    @Inject
    public DirectoryHealthCheck(DirectoryClient directory, DirectoryConfig config) {
        this.directory = directory;
        this.config = config;
    }

    @Override
    public Uni<HealthCheckResponse> call() {
        if (!config.isConfigured()) {
            return Uni.createFrom()
                    .item(HealthCheckResponse.builder()
                            .name(NAME)
                            .withData("enabled", false)
                            .up()
                            .build());
        }

        return directory.testConnection()
                .onFailure()
                .recoverWithItem(false)
                .map(reachable -> {
                    final var stats = directory.poolStats();
                    return HealthCheckResponse.builder()
                            .name(NAME)
                            .withData("enabled", true)
                            .withData("reachable", reachable)
                            .withData("pool.idle", stats.idleConnections())
                            .withData("pool.max", stats.maxConnections())
                            .status(reachable)
                            .build();
                });
    }
}
