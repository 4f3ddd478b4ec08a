package com.eidos.collab.sync.access;

import com.eidos.collab.graph.permission.OntologyAccessPolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads ontology access policies from a JSON array, looked up first as a file and then on the
 * classpath. A missing source yields no policies, which denies everything.
 */
public class AccessPolicyLoader {

    private static final TypeReference<List<OntologyAccessPolicy>> POLICY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AccessPolicyLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<OntologyAccessPolicy> load(String location) {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            try (InputStream in = Files.newInputStream(path)) {
                return read(in, location);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read access policies from " + location, e);
            }
        }
        String resource = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                Log.warnf("No access policies found at %s; every request will be denied", location);
                return List.of();
            }
            return read(in, location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read access policies from " + location, e);
        }
    }

    List<OntologyAccessPolicy> read(InputStream in, String location) throws IOException {
        List<OntologyAccessPolicy> policies = objectMapper.readValue(in, POLICY_LIST);
        Log.infof("Loaded %d access policies from %s", policies.size(), location);
        return policies;
    }
}
