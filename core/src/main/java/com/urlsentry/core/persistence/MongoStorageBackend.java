package com.urlsentry.core.persistence;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.client.model.Updates;
import com.urlsentry.core.exception.PersistenceException;
import com.urlsentry.core.model.EngineConfig;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 몽고 저장소. 컬렉션 = StoreCollection, _id = 키.
 * 단일 키 쓰기는 replaceOne(upsert) / $inc / $setOnInsert 로 원자적.
 * 드라이버 예외는 모두 PersistenceException으로 감싼다.
 */
public final class MongoStorageBackend extends AbstractStorageBackend {
    private static final Logger LOG = LoggerFactory.getLogger(MongoStorageBackend.class);

    private final MongoClient client;
    private final Map<StoreCollection, MongoCollection<Document>> collections = new EnumMap<>(StoreCollection.class);

    MongoStorageBackend(MongoClient client, String database) {
        this.client = Objects.requireNonNull(client, "client");
        MongoDatabase db = client.getDatabase(database);
        for (StoreCollection c : StoreCollection.values()) {
            collections.put(c, db.getCollection(c.collectionName()));
        }
    }

    /**
     * 접속 + ping. storage.timeout 안에 응답이 없으면 PersistenceException (클라이언트는 닫는다).
     */
    public static MongoStorageBackend connect(EngineConfig.Storage cfg) {
        Objects.requireNonNull(cfg, "cfg");
        long ms = cfg.getTimeout().toMillis();
        MongoClient client;
        try {
            MongoClientSettings settings = MongoClientSettings.builder()
                    .applyConnectionString(new ConnectionString(cfg.getMongoUri()))
                    .applyToClusterSettings(b -> b.serverSelectionTimeout(ms, TimeUnit.MILLISECONDS))
                    .applyToSocketSettings(b -> b
                            .connectTimeout((int) ms, TimeUnit.MILLISECONDS)
                            .readTimeout((int) ms, TimeUnit.MILLISECONDS))
                    .build();
            client = MongoClients.create(settings);
        } catch (IllegalArgumentException | MongoException e) {
            throw new PersistenceException("invalid mongo configuration: " + e.getMessage(), e);
        }
        MongoStorageBackend backend = new MongoStorageBackend(client, cfg.getDatabase());
        try {
            backend.ping();
        } catch (PersistenceException e) {
            client.close();
            throw e;
        }
        LOG.info("Connected to MongoDB database '{}'", cfg.getDatabase());
        return backend;
    }

    public void ping() {
        call("ping", () -> client.getDatabase("admin").runCommand(new Document("ping", 1)));
    }

    @Override
    public String name() { return "mongo"; }

    private MongoCollection<Document> col(StoreCollection c) {
        return collections.get(c);
    }

    // ---- raw ----
    @Override
    public Set<String> keys(StoreCollection c) {
        return call("keys " + c, () -> {
            Set<String> out = new TreeSet<>();
            for (Document d : col(c).find().projection(Projections.include("_id"))) {
                out.add(String.valueOf(d.get("_id")));
            }
            return out;
        });
    }

    @Override
    public Optional<Map<String, Object>> readRaw(StoreCollection c, String key) {
        if (key == null) return Optional.empty();
        Document d = call("read " + c, () -> col(c).find(Filters.eq("_id", key)).first());
        if (d == null) return Optional.empty();
        Map<String, Object> m = new LinkedHashMap<>(d);
        m.remove("_id");
        return Optional.of(m);
    }

    @Override
    protected void writeRaw(StoreCollection c, String key, Map<String, Object> record) {
        Document doc = new Document(record).append("_id", key);
        call("write " + c, () -> col(c).replaceOne(Filters.eq("_id", key), doc, new ReplaceOptions().upsert(true)));
    }

    @Override
    public boolean insertRawIfAbsent(StoreCollection c, String key, Map<String, Object> record) {
        Map<String, Object> body = new LinkedHashMap<>(record);
        body.remove("_id");
        return call("insert " + c, () -> col(c).updateOne(
                Filters.eq("_id", key),
                new Document("$setOnInsert", new Document(body)),
                new UpdateOptions().upsert(true)).getUpsertedId() != null);
    }

    @Override
    protected boolean deleteRaw(StoreCollection c, String key) {
        if (key == null) return false;
        return call("delete " + c, () -> col(c).deleteOne(Filters.eq("_id", key)).getDeletedCount() > 0);
    }

    @Override
    protected long count(StoreCollection c) {
        return call("count " + c, () -> col(c).countDocuments());
    }

    @Override
    protected void increment(StoreCollection c, String key, String field, long delta) {
        call("increment " + c, () -> col(c).updateOne(
                Filters.eq("_id", key), Updates.inc(field, delta), new UpdateOptions().upsert(true)));
    }

    @Override
    protected long deleteExpired(StoreCollection c, long nowMillis) {
        return call("expire " + c, () ->
                col(c).deleteMany(Filters.lte(RecordCodec.EXPIRES_FIELD, nowMillis)).getDeletedCount());
    }

    private static <T> T call(String op, Supplier<T> body) {
        try {
            return body.get();
        } catch (MongoException e) {
            throw new PersistenceException("mongo " + op + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
