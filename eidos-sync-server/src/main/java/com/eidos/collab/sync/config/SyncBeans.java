package com.eidos.collab.sync.config;

import com.eidos.collab.graph.grouping.GroupingEngine;
import com.eidos.collab.graph.hub.SyncSettings;
import com.eidos.collab.graph.hub.SynchronizationHub;
import com.eidos.collab.graph.mongo.MorphiaGraphStateRepository;
import com.eidos.collab.graph.permission.InMemoryPermissionGate;
import com.eidos.collab.graph.permission.PermissionGate;
import com.eidos.collab.graph.persistence.GraphPersistenceWriter;
import com.eidos.collab.graph.persistence.GraphStateRepository;
import com.eidos.collab.graph.persistence.InMemoryGraphStateRepository;
import com.eidos.collab.graph.presence.SessionRegistry;
import com.eidos.collab.graph.store.GraphStoreRegistry;
import com.eidos.collab.sync.access.AccessPolicyLoader;
import com.eidos.collab.sync.stream.HubEventStream;
import com.eidos.collab.util.ExceptionLoggingUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the graph core into CDI.
 */
@ApplicationScoped
public class SyncBeans {
    private static final Logger LOG = Logger.getLogger(SyncBeans.class);

    @Inject
    SyncConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Instance<MongoClient> mongoClient;

    @Produces
    @Singleton
    public SyncSettings syncSettings() {
        return config.toSettings();
    }

    @Produces
    @DefaultBean
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @DefaultBean
    @Singleton
    public PermissionGate permissionGate() {
        return new InMemoryPermissionGate(new AccessPolicyLoader(objectMapper).load(config.accessPolicies()));
    }

    @Produces
    @DefaultBean
    @Singleton
    public GraphStateRepository graphStateRepository() {
        String mode = config.persistence().mode();
        if ("mongo".equalsIgnoreCase(mode)) {
            if (!mongoClient.isResolvable()) {
                throw new IllegalStateException("eidos.sync.persistence.mode=mongo but no MongoClient is available");
            }
            LOG.infof("Persisting ontology graphs to MongoDB database %s", config.persistence().database());
            return new MorphiaGraphStateRepository(mongoClient.get(), config.persistence().database());
        }
        if (!"memory".equalsIgnoreCase(mode)) {
            throw new IllegalStateException("Unknown eidos.sync.persistence.mode: " + mode);
        }
        LOG.warn("Ontology graphs are kept in memory only and are lost on restart");
        return new InMemoryGraphStateRepository();
    }

    @Produces
    @Singleton
    @Named("graph-writer")
    public ExecutorService graphWriterExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(config.persistence().writerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "graph-writer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    void closeGraphWriterExecutor(@Disposes @Named("graph-writer") ExecutorService executor) {
        executor.shutdown();
    }

    @Produces
    @Singleton
    public GraphPersistenceWriter graphPersistenceWriter(GraphStateRepository repository,
                                                         @Named("graph-writer") ExecutorService executor) {
        return new GraphPersistenceWriter(repository, executor);
    }

    void flushGraphPersistenceWriter(@Disposes GraphPersistenceWriter writer) {
        try {
            writer.flushAll().get(config.persistence().flushTimeout().toMillis(), TimeUnit.MILLISECONDS);
            LOG.infof("Flushed %d graph writes on shutdown (%d failed)", writer.getWrittenCount(),
                    writer.getFailureCount());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ExceptionLoggingUtils.logWarn(LOG, e, "Interrupted while flushing graph writes");
        } catch (ExecutionException | TimeoutException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Graph writes not flushed within %s",
                    config.persistence().flushTimeout());
        }
    }

    @Produces
    @Singleton
    public GraphStoreRegistry graphStoreRegistry(GraphPersistenceWriter writer, SyncSettings settings) {
        return new GraphStoreRegistry(writer, new GroupingEngine(settings.grouping()), settings.lockWait());
    }

    @Produces
    @Singleton
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Produces
    @Singleton
    public SynchronizationHub synchronizationHub(GraphStoreRegistry stores, PermissionGate permissions,
                                                 SessionRegistry sessions, SyncSettings settings, Clock clock) {
        return new SynchronizationHub(stores, permissions, sessions, settings, clock);
    }

    @Produces
    @Singleton
    @Named("event-stream")
    public ExecutorService eventStreamExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "event-stream-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    void closeEventStreamExecutor(@Disposes @Named("event-stream") ExecutorService executor) {
        executor.shutdownNow();
    }

    @Produces
    @Singleton
    public HubEventStream hubEventStream(@Named("event-stream") ExecutorService executor) {
        return new HubEventStream(executor, config.eventPollInterval());
    }
}
