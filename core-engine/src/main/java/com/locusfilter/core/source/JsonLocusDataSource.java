package com.locusfilter.core.source;

import com.locusfilter.core.exception.LocusNotFoundException;
import com.locusfilter.core.model.LocusData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link LocusDataSource} reading one JSON document per locus, named
 * {@code <locusId>.json}, from a directory or a classpath prefix.
 *
 * <p>
 * Intended for trying filters out against sample data. Documents are parsed
 * with {@link LocusDataReader} on every call; nothing is cached.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonLocusDataSource implements LocusDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLocusDataSource.class);

    private final Path directory;
    private final String classpathPrefix;
    private final LocusDataReader reader = new LocusDataReader();

    private JsonLocusDataSource(Path directory, String classpathPrefix) {
        this.directory = directory;
        this.classpathPrefix = classpathPrefix;
    }

    /**
     * @param directory directory holding {@code <locusId>.json} files
     * @return new source
     */
    public static JsonLocusDataSource fromDirectory(Path directory) {
        Objects.requireNonNull(directory, "Directory must not be null");
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Locus data directory not found: " + directory);
        }
        return new JsonLocusDataSource(directory, null);
    }

    /**
     * @param prefix classpath prefix, e.g. {@code "loci"}
     * @return new source
     */
    public static JsonLocusDataSource fromClasspath(String prefix) {
        Objects.requireNonNull(prefix, "Classpath prefix must not be null");
        String normalised = prefix.endsWith("/") || prefix.isEmpty() ? prefix : prefix + "/";
        return new JsonLocusDataSource(null, normalised);
    }

    @Override
    public LocusData load(long locusId) {
        String fileName = locusId + ".json";
        try (InputStream in = open(fileName)) {
            if (in == null) {
                throw new LocusNotFoundException(locusId);
            }
            LocusData locus = reader.read(in);
            if (locus.getLocusId() != locusId) {
                throw new LocusNotFoundException(locusId,
                        fileName + " holds locus " + locus.getLocusId(), null);
            }
            LOG.debug("Loaded locus {} with {} measurement(s)", locusId, locus.getMeasurements().size());
            return locus;
        } catch (IOException | IllegalArgumentException e) {
            throw new LocusNotFoundException(locusId,
                    "Failed to read " + fileName + ": " + e.getMessage(), e);
        }
    }

    private InputStream open(String fileName) throws IOException {
        if (directory != null) {
            try {
                return Files.newInputStream(directory.resolve(fileName));
            } catch (NoSuchFileException e) {
                return null;
            }
        }
        return JsonLocusDataSource.class.getClassLoader().getResourceAsStream(classpathPrefix + fileName);
    }
}
