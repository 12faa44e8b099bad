package io.backup4j.core;

import io.backup4j.BackupDestination;
import io.backup4j.BackupSource;
import io.backup4j.Credentials;
import io.backup4j.core.exception.UnsupportedAdapterTypeException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Maps a stored type tag to an adapter constructor taking only {@link Credentials}; destination
 * constructors also receive the record's optional JSON config (may be {@code null}).
 *
 * <p>The single polymorphism point: everything downstream depends on {@link BackupSource} and
 * {@link BackupDestination} only.
 */
public class AdapterRegistry {

    private final Map<SourceType, Function<Credentials, BackupSource>> sources;
    private final Map<DestinationType, BiFunction<Credentials, String, BackupDestination>> destinations;

    private AdapterRegistry(Builder b) {
        this.sources = Collections.unmodifiableMap(new EnumMap<>(b.sources));
        this.destinations = Collections.unmodifiableMap(new EnumMap<>(b.destinations));
    }

    public BackupSource source(String tag, Credentials credentials) {
        Objects.requireNonNull(credentials, "credentials must not be null");
        SourceType type = SourceType.fromTag(tag);
        Function<Credentials, BackupSource> ctor = sources.get(type);
        if (ctor == null) {
            throw new UnsupportedAdapterTypeException("source", tag);
        }
        return ctor.apply(credentials);
    }

    public BackupDestination destination(String tag, Credentials credentials) {
        return destination(tag, credentials, null);
    }

    public BackupDestination destination(String tag, Credentials credentials, String config) {
        Objects.requireNonNull(credentials, "credentials must not be null");
        DestinationType type = DestinationType.fromTag(tag);
        BiFunction<Credentials, String, BackupDestination> ctor = destinations.get(type);
        if (ctor == null) {
            throw new UnsupportedAdapterTypeException("destination", tag);
        }
        return ctor.apply(credentials, config);
    }

    public boolean supportsSource(SourceType type) {
        return sources.containsKey(type);
    }

    public boolean supportsDestination(DestinationType type) {
        return destinations.containsKey(type);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<SourceType, Function<Credentials, BackupSource>> sources = new EnumMap<>(SourceType.class);
        private final Map<DestinationType, BiFunction<Credentials, String, BackupDestination>> destinations = new EnumMap<>(DestinationType.class);

        private Builder() {
        }

        public Builder source(SourceType type, Function<Credentials, BackupSource> ctor) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(ctor, "ctor must not be null");
            if (sources.putIfAbsent(type, ctor) != null) {
                throw new IllegalStateException("Duplicate source adapter: " + type.tag());
            }
            return this;
        }

        public Builder destination(DestinationType type, Function<Credentials, BackupDestination> ctor) {
            Objects.requireNonNull(ctor, "ctor must not be null");
            return destination(type, (credentials, config) -> ctor.apply(credentials));
        }

        public Builder destination(DestinationType type, BiFunction<Credentials, String, BackupDestination> ctor) {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(ctor, "ctor must not be null");
            if (destinations.putIfAbsent(type, ctor) != null) {
                throw new IllegalStateException("Duplicate destination adapter: " + type.tag());
            }
            return this;
        }

        public AdapterRegistry build() {
            return new AdapterRegistry(this);
        }
    }
}
