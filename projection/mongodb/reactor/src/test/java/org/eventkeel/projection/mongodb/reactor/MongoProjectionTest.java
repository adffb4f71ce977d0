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

import com.mongodb.ConnectionString;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import com.mongodb.reactivestreams.client.MongoCollection;
import com.mongodb.reactivestreams.client.MongoDatabase;
import org.bson.Document;
import org.eventkeel.domain.OrderItemAdded;
import org.eventkeel.domain.OrderPlaced;
import org.eventkeel.domain.OrderShipped;
import org.eventkeel.eventstore.api.StreamName;
import org.eventkeel.projection.EventHandlingStatus;
import org.eventkeel.projection.ReceivedEvent;
import org.eventkeel.serialization.Metadata;
import org.eventkeel.testsupport.mongodb.FlushMongoDBExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.inc;
import static com.mongodb.client.model.Updates.set;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventkeel.projection.EventHandlingStatus.HANDLED;
import static org.eventkeel.projection.EventHandlingStatus.IGNORED;

@Testcontainers(disabledWithoutDocker = true)
@DisplayNameGeneration(ReplaceUnderscores.class)
class MongoProjectionTest {

    @Container
    private static final MongoDBContainer mongoDBContainer = new MongoDBContainer("mongo:6.0.11");

    @RegisterExtension
    FlushMongoDBExtension flushMongoDBExtension = new FlushMongoDBExtension(new ConnectionString(mongoDBContainer.getReplicaSetUrl("projections")));

    private MongoClient mongoClient;
    private MongoDatabase database;
    private MongoCollection<Document> orderSummaries;
    private OrderSummaryProjection projection;

    @BeforeEach
    void create_projection() {
        ConnectionString connectionString = new ConnectionString(mongoDBContainer.getReplicaSetUrl("projections"));
        mongoClient = MongoClients.create(connectionString);
        database = mongoClient.getDatabase(requireNonNull(connectionString.getDatabase()));
        orderSummaries = database.getCollection("OrderSummary");
        projection = new OrderSummaryProjection(database);
    }

    @AfterEach
    void close_client() {
        mongoClient.close();
    }

    @Nested
    @DisplayName("update operation")
    class UpdateOperation {

        @Test
        void upserts_the_document_and_stamps_the_event_position() {
            // When
            EventHandlingStatus status = projection.handleEvent(received(new OrderPlaced("1", "customer-1", Instant.now()), 10)).block();

            // Then
            assertThat(status).isEqualTo(HANDLED);
            Document document = findDocument("1");
            assertThat(document.getString("customerId")).isEqualTo("customer-1");
            assertThat(document.getString("status")).isEqualTo("PLACED");
            assertThat(document.getLong("position")).isEqualTo(10L);
        }

        @Test
        void documents_are_mapped_to_the_projected_document_type() {
            // Given
            projection.handleEvent(received(new OrderPlaced("1", "customer-1", Instant.now()), 10)).block();
            projection.handleEvent(received(new OrderItemAdded("1", "sku-1", 3), 11)).block();

            // When
            OrderSummary summary = projection.find("1").block();

            // Then
            assertThat(summary.getId()).isEqualTo("1");
            assertThat(summary.getCustomerId()).isEqualTo("customer-1");
            assertThat(summary.getItemCount()).isEqualTo(3);
            assertThat(summary.getPosition()).isEqualTo(11L);
        }

        @Test
        void applying_the_same_event_twice_leaves_the_document_at_the_event_position() {
            // Given
            ReceivedEvent itemAdded = received(new OrderItemAdded("1", "sku-1", 2), 20);

            // When
            EventHandlingStatus first = projection.handleEvent(itemAdded).block();
            EventHandlingStatus second = projection.handleEvent(itemAdded).block();

            // Then
            assertThat(first).isEqualTo(HANDLED);
            assertThat(second).isEqualTo(IGNORED);
            Document document = findDocument("1");
            assertThat(document.getInteger("itemCount")).isEqualTo(2);
            assertThat(document.getLong("position")).isEqualTo(20L);
        }

        @Test
        void an_event_older_than_the_document_is_skipped() {
            // Given
            projection.handleEvent(received(new OrderItemAdded("1", "sku-1", 1), 30)).block();

            // When
            EventHandlingStatus status = projection.handleEvent(received(new OrderItemAdded("1", "sku-2", 5), 25)).block();

            // Then
            assertThat(status).isEqualTo(IGNORED);
            Document document = findDocument("1");
            assertThat(document.getInteger("itemCount")).isEqualTo(1);
            assertThat(document.getLong("position")).isEqualTo(30L);
        }

        @Test
        void a_newer_event_is_applied_after_an_older_one() {
            // Given
            projection.handleEvent(received(new OrderItemAdded("1", "sku-1", 1), 30)).block();

            // When
            EventHandlingStatus status = projection.handleEvent(received(new OrderItemAdded("1", "sku-2", 5), 31)).block();

            // Then
            assertThat(status).isEqualTo(HANDLED);
            assertThat(findDocument("1").getInteger("itemCount")).isEqualTo(6);
            assertThat(findDocument("1").getLong("position")).isEqualTo(31L);
        }

        @Test
        void stale_events_are_applied_when_the_guard_is_disabled() {
            // Given
            OrderSummaryProjection unguarded = new OrderSummaryProjection(database, false);
            unguarded.handleEvent(received(new OrderItemAdded("1", "sku-1", 1), 30)).block();

            // When
            EventHandlingStatus status = unguarded.handleEvent(received(new OrderItemAdded("1", "sku-2", 5), 25)).block();

            // Then
            assertThat(status).isEqualTo(HANDLED);
            assertThat(findDocument("1").getInteger("itemCount")).isEqualTo(6);
            assertThat(findDocument("1").getLong("position")).isEqualTo(25L);
        }

        @Test
        void write_errors_other_than_stale_events_are_propagated() {
            // Given
            MongoProjection<OrderSummary> failing = new MongoProjection<>(database, OrderSummary.class) {
                @Override
                protected Mono<Operation<OrderSummary>> getUpdate(Object event, long position) {
                    return Mono.just(updateOperation("1", combine(set("itemCount", 1), inc("itemCount", 1))));
                }
            };

            // When
            Throwable throwable = catchThrowable(() -> failing.handleEvent(received(new OrderItemAdded("1", "sku-1", 1), 1)).block());

            // Then
            assertThat(throwable).isInstanceOf(MongoWriteException.class);
            assertThat(count()).isZero();
        }

        @Test
        void duplicate_key_errors_from_other_unique_indexes_are_propagated() {
            // Given
            Mono.from(orderSummaries.createIndex(Indexes.ascending("customerId"), new IndexOptions().unique(true))).block();
            projection.handleEvent(received(new OrderPlaced("1", "customer-1", Instant.now()), 1)).block();

            // When
            Throwable throwable = catchThrowable(() -> projection.handleEvent(received(new OrderPlaced("2", "customer-1", Instant.now()), 2)).block());

            // Then
            assertThat(throwable).isInstanceOf(MongoWriteException.class);
            assertThat(((MongoWriteException) throwable).getError().getCategory()).isEqualTo(ErrorCategory.DUPLICATE_KEY);
            assertThat(count()).isEqualTo(1);
            assertThat(findDocument("2")).isNull();
        }

        @Test
        void concurrent_first_writes_to_the_same_document_end_at_the_highest_position() {
            for (int i = 0; i < 20; i++) {
                // Given
                String orderId = "order-" + i;
                Mono<EventHandlingStatus> older = projection.handleEvent(received(new OrderItemAdded(orderId, "sku-1", 1), 5)).subscribeOn(Schedulers.parallel());
                Mono<EventHandlingStatus> newer = projection.handleEvent(received(new OrderItemAdded(orderId, "sku-2", 2), 6)).subscribeOn(Schedulers.parallel());

                // When
                List<EventHandlingStatus> statuses = Flux.merge(older, newer).collectList().block();

                // Then
                assertThat(statuses).hasSize(2).contains(HANDLED);
                assertThat(findDocument(orderId).getLong("position")).isEqualTo(6L);
            }
        }

        @Test
        void positions_that_do_not_fit_in_a_signed_long_are_rejected() {
            // Given
            long position = Long.parseUnsignedLong("9223372036854775808");

            // When
            Throwable throwable = catchThrowable(() -> projection.handleEvent(received(new OrderItemAdded("1", "sku-1", 1), position)).block());

            // Then
            assertThat(throwable).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("9223372036854775808");
            assertThat(count()).isZero();
        }
    }

    @Test
    void events_without_an_operation_are_ignored_without_touching_the_read_model() {
        // When
        EventHandlingStatus status = projection.handleEvent(received("an unrelated event", 1)).block();

        // Then
        assertThat(status).isEqualTo(IGNORED);
        assertThat(count()).isZero();
    }

    @Test
    void explicit_no_op_is_ignored() {
        // Given
        MongoProjection<OrderSummary> noOpProjection = new MongoProjection<>(database, OrderSummary.class) {
            @Override
            protected Mono<Operation<OrderSummary>> getUpdate(Object event, long position) {
                return Mono.just(noOp());
            }
        };

        // When
        EventHandlingStatus status = noOpProjection.handleEvent(received(new OrderPlaced("1", "customer-1", Instant.now()), 1)).block();

        // Then
        assertThat(status).isEqualTo(IGNORED);
        assertThat(count()).isZero();
    }

    @Test
    void events_that_could_not_be_deserialized_are_ignored() {
        // Given
        ReceivedEvent event = new ReceivedEvent(UUID.randomUUID().toString(), "OrderCancelled", "application/json", StreamName.of("order-1"), null, Metadata.empty(), 1, 1);

        // When
        EventHandlingStatus status = projection.handleEvent(event).block();

        // Then
        assertThat(status).isEqualTo(IGNORED);
        assertThat(count()).isZero();
    }

    @Test
    void collection_operations_are_executed_against_the_projection_collection() {
        // Given
        projection.handleEvent(received(new OrderPlaced("1", "customer-1", Instant.now()), 1)).block();

        // When
        EventHandlingStatus status = projection.handleEvent(received(new OrderShipped("1", "track-1"), 2)).block();

        // Then
        assertThat(status).isEqualTo(HANDLED);
        assertThat(findDocument("1").getString("status")).isEqualTo("SHIPPED");
    }

    @Test
    void other_operations_are_executed_when_subscribed() {
        // Given
        AtomicInteger notifications = new AtomicInteger();
        MongoProjection<OrderSummary> notifyingProjection = new MongoProjection<>(database, OrderSummary.class) {
            @Override
            protected Mono<Operation<OrderSummary>> getUpdate(ReceivedEvent event) {
                if (event.metadata().get("notify") != null) {
                    return Mono.just(otherOperation(() -> Mono.fromRunnable(notifications::incrementAndGet)));
                }
                return super.getUpdate(event);
            }

            @Override
            protected Mono<Operation<OrderSummary>> getUpdate(Object event, long position) {
                return Mono.empty();
            }
        };
        ReceivedEvent event = new ReceivedEvent(UUID.randomUUID().toString(), "OrderShipped", "application/json", StreamName.of("order-1"),
                new OrderShipped("1", "track-1"), Metadata.empty().with("notify", true), 3, 3);

        // When
        Mono<EventHandlingStatus> handling = notifyingProjection.handleEvent(event);
        int notificationsBeforeSubscribe = notifications.get();
        EventHandlingStatus status = handling.block();

        // Then
        assertThat(notificationsBeforeSubscribe).isZero();
        assertThat(status).isEqualTo(HANDLED);
        assertThat(notifications).hasValue(1);
        assertThat(count()).isZero();
    }

    private Document findDocument(String id) {
        return Mono.from(orderSummaries.find(eq("_id", id)).first()).block();
    }

    private long count() {
        return Mono.from(orderSummaries.countDocuments()).block();
    }

    private static ReceivedEvent received(Object payload, long position) {
        return new ReceivedEvent(UUID.randomUUID().toString(), payload.getClass().getSimpleName(), "application/json", StreamName.of("order-1"),
                payload, Metadata.empty(), position, position);
    }
}
