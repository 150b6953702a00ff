package adsentry.adapter.out.directory;

import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import adsentry.core.model.directory.ConnectionPoolStats;
import adsentry.core.model.directory.DirectoryEntry;
import adsentry.core.model.directory.DirectoryError;
import adsentry.core.model.directory.DirectoryException;
import adsentry.core.model.directory.DirectorySearchRequest;
import adsentry.core.port.out.DirectoryClient;

/**
 * {@link DirectoryClient} used when no directory is configured. Every login fails.
 */
final class DisabledDirectoryClient implements DirectoryClient {

    @Override
    public Uni<Boolean> authenticate(String username, String password) {
        return Uni.createFrom().item(false);
    }

    @Override
    public Uni<Optional<DirectoryEntry>> getUser(String username) {
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<List<String>> getUserGroups(String username) {
        return Uni.createFrom().item(List.of());
    }

    @Override
    public Uni<List<DirectoryEntry>> search(DirectorySearchRequest request) {
        return Uni.createFrom()
                .failure(new DirectoryException(DirectoryError.OTHER, -1, "Directory client is disabled", null));
    }

    @Override
    public Uni<Boolean> testConnection() {
        return Uni.createFrom().item(false);
    }

    @Override
    public ConnectionPoolStats poolStats() {
        return ConnectionPoolStats.none();
    }
}
