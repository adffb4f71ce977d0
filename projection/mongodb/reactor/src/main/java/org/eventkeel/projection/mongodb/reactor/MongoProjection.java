/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventkeel.projection.mongodb.reactor;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.client.model.UpdateOptions;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;
import org.bson.Document;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.codecs.pojo.PojoCodecProvider;
import org.bson.conversions.Bson;
import org.eventkeel.projection.EventHandler;
import org.eventkeel.projection.EventHandlingStatus;
import org.eventkeel.projection.ReceivedEvent;
import org.eventkeel.projection.mongodb.reactor.Operation.CollectionOperation;
import org.eventkeel.projection.mongodb.reactor.Operation.OtherOperation;
import org.eventkeel.projection.mongodb.reactor.Operation.Update;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.BiFunction;
import java.util.function.Supplier;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.exists;
import static com.mongodb.client.model.Filters.lt;
import static com.mongodb.client.model.Filters.or;
import static com.mongodb.client.model.Projections.include;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.set;
import static java.util.Objects.requireNonNull;
import static org.bson.codecs.configuration.CodecRegistries.fromProviders;
import static org.bson.codecs.configuration.CodecRegistries.fromRegistries;
import static org.eventkeel.projection.EventHandlingStatus.HANDLED;
import static org.eventkeel.projection.EventHandlingStatus.IGNORED;
import static org.eventkeel.projection.mongodb.reactor.ProjectedDocument.ID;
import static org.eventkeel.projection.mongodb.reactor.ProjectedDocument.POSITION;

/**
 * An {@link EventHandler} that maintains a MongoDB read model. Subclasses decide what to do with each event by
 * implementing {@link #getUpdate(Object, long)}, the projection executes the resulting {@link Operation}.
 * <p>
 * {@link Update} operations are upserts that also set {@link ProjectedDocument#POSITION} to the stream position of the
 * event. Unless disabled, the upsert only matches a document whose stored position is lower than the event's, so an
 * event that is redelivered or arrives after a newer one leaves the document untouched and is reported as
 * {@link EventHandlingStatus#IGNORED}. The guard relies on the filter identifying the document by a unique key
 * (typically {@code _id}), since a skipped upsert surfaces as a duplicate key error. When that happens the document
 * is read back: the event is ignored only if the stored position is at or past the event's, an update that lost a
 * race with a concurrent insert of the same document is retried, and any other duplicate key error is propagated.
 * <p>
 * Positions are stored as signed 64-bit integers, so events with a stream position above {@link Long#MAX_VALUE}
 * can't be applied with an {@link Update} and fail with an {@link IllegalArgumentException}.
 *
 * @param <T> The read-model document type
 */
public abstract class MongoProjection<T extends ProjectedDocument> implements EventHandler {
    private static final Logger log = LoggerFactory.getLogger(MongoProjection.class);
    private static final int MAX_UPDATE_ATTEMPTS = 3;

    private final MongoCollection<T> collection;
    private final boolean staleEventGuard;

    /**
     * Create a projection that stores documents in a collection named after the simple name of {@code documentType}
     * and skips stale events.
     */
    protected MongoProjection(MongoDatabase database, Class<T> documentType) {
        this(database, documentType, documentType.getSimpleName(), true);
    }

    /**
     * @param database        The database holding the read model
     * @param documentType    The read-model document type, mapped with the POJO codec
     * @param collectionName  The name of the read-model collection
     * @param staleEventGuard {@code true} to only apply events with a position higher than the one stored in the document
     */
    protected MongoProjection(MongoDatabase database, Class<T> documentType, String collectionName, boolean staleEventGuard) {
        requireNonNull(database, MongoDatabase.class.getSimpleName() + " cannot be null");
        requireNonNull(documentType, "Document type cannot be null");
        requireNonNull(collectionName, "Collection name cannot be null");
        CodecRegistry codecRegistry = fromRegistries(database.getCodecRegistry(), fromProviders(PojoCodecProvider.builder().automatic(true).build()));
        this.collection = database.getCollection(collectionName, documentType).withCodecRegistry(codecRegistry);
        this.staleEventGuard = staleEventGuard;
    }

    @Override
    public Mono<EventHandlingStatus> handleEvent(ReceivedEvent event) {
        requireNonNull(event, ReceivedEvent.class.getSimpleName() + " cannot be null");
        if (!event.hasPayload()) {
            log.debug("{} ignores event {} of type {} since it has no payload", handlerType(), event.eventId(), event.eventType());
            return Mono.just(IGNORED);
        }

        return Mono.defer(() -> getUpdate(event))
                .defaultIfEmpty(Operation.noOp())
                .flatMap(operation -> execute(event, operation));
    }

    /**
     * Resolve the operation for an event. Return an empty {@link Mono} or {@link #noOp()} for events the projection
     * doesn't care about.
     *
     * @param event    The deserialized event payload
     * @param position The stream position of the event
     */
    protected abstract Mono<Operation<T>> getUpdate(Object event, long position);

    /**
     * Override to resolve the operation from the full {@link ReceivedEvent}, e.g. when metadata is needed.
     */
    protected Mono<Operation<T>> getUpdate(ReceivedEvent event) {
        return getUpdate(requireNonNull(event.payload()), event.streamPosition());
    }

    protected MongoCollection<T> collection() {
        return collection;
    }

    protected Operation<T> updateOperation(String id, Bson update) {
        requireNonNull(id, "Id cannot be null");
        return updateOperation(eq(ID, id), update);
    }

    protected Operation<T> updateOperation(Bson filter, Bson update) {
        return new Update<>(filter, update);
    }

    protected Operation<T> collectionOperation(BiFunction<MongoCollection<T>, ReceivedEvent, Publisher<?>> operation) {
        return new CollectionOperation<>(operation);
    }

    protected Operation<T> otherOperation(Supplier<Publisher<?>> operation) {
        return new OtherOperation<>(operation);
    }

    protected Operation<T> noOp() {
        return Operation.noOp();
    }

    private Mono<EventHandlingStatus> execute(ReceivedEvent event, Operation<T> operation) {
        if (operation instanceof Operation.NoOp) {
            log.debug("{} has no operation for {}", handlerType(), event.eventType());
            return Mono.just(IGNORED);
        }

        log.debug("{} projecting {} at position {}", handlerType(), event.eventType(), event.streamPosition());
        if (operation instanceof Update<T> update) {
            return executeUpdate(event, update, 1);
        } else if (operation instanceof CollectionOperation<T> collectionOperation) {
            return Flux.from(collectionOperation.execute().apply(collection, event)).then(Mono.just(HANDLED));
        } else if (operation instanceof OtherOperation<T> otherOperation) {
            return Flux.from(otherOperation.execute().get()).then(Mono.just(HANDLED));
        }
        return Mono.error(new IllegalStateException("Unsupported operation " + operation.getClass().getName()));
    }

    private Mono<EventHandlingStatus> executeUpdate(ReceivedEvent event, Update<T> update, int attempt) {
        long position = event.streamPosition();
        if (position < 0) {
            return Mono.error(new IllegalArgumentException("Stream position " + Long.toUnsignedString(position) + " of event " + event.eventId()
                    + " can't be stored in the read model, positions above " + Long.MAX_VALUE + " are not supported"));
        }
        Bson filter = staleEventGuard ? and(update.filter(), or(exists(POSITION, false), lt(POSITION, position))) : update.filter();
        Bson changes = combine(update.update(), set(POSITION, position));
        return Mono.from(collection.updateOne(filter, changes, new UpdateOptions().upsert(true)))
                .map(__ -> HANDLED)
                .onErrorResume(e -> staleEventGuard && isDuplicateKey(e), e -> resolveDuplicateKey(event, update, attempt, e));
    }

    // A skipped guarded upsert tries to insert the document again, which fails with a duplicate key error. The same error
    // is raised by other unique indexes and by a concurrent insert of the same document, so the stored position decides.
    private Mono<EventHandlingStatus> resolveDuplicateKey(ReceivedEvent event, Update<T> update, int attempt, Throwable error) {
        long position = event.streamPosition();
        return Mono.from(collection.withDocumentClass(Document.class).find(update.filter()).projection(include(POSITION)).first())
                .flatMap(document -> {
                    Object storedPosition = document.get(POSITION);
                    if (storedPosition instanceof Number && ((Number) storedPosition).longValue() >= position) {
                        log.debug("{} skipped {} at position {}, the document is already at position {}", handlerType(), event.eventType(), position, storedPosition);
                        return Mono.just(IGNORED);
                    } else if (attempt >= MAX_UPDATE_ATTEMPTS) {
                        return Mono.<EventHandlingStatus>error(error);
                    }
                    log.debug("{} retrying {} at position {} after a concurrent write to the document", handlerType(), event.eventType(), position);
                    return executeUpdate(event, update, attempt + 1);
                })
                .switchIfEmpty(Mono.error(error));
    }

    private static boolean isDuplicateKey(Throwable e) {
        return e instanceof MongoException && ErrorCategory.fromErrorCode(((MongoException) e).getCode()) == ErrorCategory.DUPLICATE_KEY;
    }
}
