package io.amp.kernel.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

public record PlanTarget(Optional<Path> localPath, Optional<URI> remoteUri) {
    public PlanTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() && remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Either localPath or remoteUri must be present.");
        }
    }

    public static PlanTarget forLocal(Path path) {
        return new PlanTarget(Optional.of(path), Optional.empty());
    }

    public static PlanTarget forRemote(URI uri) {
        return new PlanTarget(Optional.empty(), Optional.of(uri));
    }

    public static PlanTarget parse(String value) {
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return forRemote(URI.create(value));
        }
        return forLocal(Path.of(value).toAbsolutePath().normalize());
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
