/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.modeling.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.modeling.error.ArgumentInvalidException;
import io.github.suppierk.modeling.json.DeepJson;
import io.github.suppierk.modeling.validation.ValidationPipeline;
import io.github.suppierk.modeling.validation.ValidationResult;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable fact which happened to an {@link Aggregate}.
 *
 * <p>Events are identified by their {@link #id()}: two events are equal when they are of the same
 * class and have the same identifier.
 *
 * <p>Construction contract:
 *
 * <ol>
 *   <li>Missing identifier, type and timestamp are defaulted.
 *   <li>Aggregate identifier must be a non-empty string.
 *   <li>Timestamp must not be negative.
 *   <li>{@link #validatePayload(Object)} is funneled through {@link ValidationPipeline}.
 * </ol>
 *
 * @param <P> is the type of the payload, {@link Void} for events without one
 */
public abstract non-sealed class DomainEvent<P> extends DomainObject {
  private final String id;
  private final String aggregateId;
  private final String type;
  private final long timestamp;
  private final String correlationId;
  private final String causationId;
  private final P payload;

  /**
   * @param aggregateId of the aggregate which produced the event
   * @throws ArgumentInvalidException if the event did not pass validation
   */
  protected DomainEvent(final String aggregateId) {
    this(DomainEventProps.of(aggregateId));
  }

  /**
   * @param props of the event
   * @throws IllegalArgumentException if props are {@code null}
   * @throws ArgumentInvalidException if the event did not pass validation
   */
  protected DomainEvent(final DomainEventProps<P> props) {
    throwIllegalArgumentIfNull(props, "Domain event props");

    this.id = props.id() == null ? UUID.randomUUID().toString() : props.id();
    this.aggregateId = props.aggregateId();
    this.type = props.type() == null ? defaultType() : props.type();
    this.timestamp = props.timestamp() == null ? System.currentTimeMillis() : props.timestamp();
    this.correlationId = props.correlationId();
    this.causationId = props.causationId();
    this.payload = props.payload();

    if (aggregateId == null || aggregateId.isEmpty()) {
      throw new ArgumentInvalidException("DomainEvent must have an aggregateId");
    }

    if (timestamp < 0) {
      throw new ArgumentInvalidException("DomainEvent must have a valid timestamp");
    }

    ValidationPipeline.validate(() -> validatePayload(payload));
  }

  /**
   * @return simple name of the event class, or its full name for anonymous classes
   */
  private String defaultType() {
    final String simpleName = getClass().getSimpleName();
    return simpleName.isEmpty() ? getClass().getName() : simpleName;
  }

  /**
   * Checks the payload once the rest of the event is known to be valid.
   *
   * @param payload to check, can be {@code null} for events without payload
   * @return validation outcome, {@code null} is treated as {@link ValidationResult#valid()}
   */
  protected abstract ValidationResult validatePayload(final P payload);

  public final String id() {
    return id;
  }

  public final String aggregateId() {
    return aggregateId;
  }

  public final String type() {
    return type;
  }

  /**
   * @return epoch milliseconds when the event happened
   */
  public final long timestamp() {
    return timestamp;
  }

  public final Optional<String> correlationId() {
    return Optional.ofNullable(correlationId);
  }

  public final Optional<String> causationId() {
    return Optional.ofNullable(causationId);
  }

  public final Optional<P> payload() {
    return Optional.ofNullable(payload);
  }

  /**
   * Absent correlation, causation and payload are omitted from the result.
   *
   * @return JSON representation of the event
   */
  @Override
  public JsonNode toJson() {
    final ObjectNode json = JsonNodeFactory.instance.objectNode();
    json.put("id", id);
    json.put("aggregateId", aggregateId);
    json.put("type", type);
    json.put("timestamp", timestamp);
    correlationId().ifPresent(value -> json.put("correlationId", value));
    causationId().ifPresent(value -> json.put("causationId", value));
    payload().ifPresent(value -> json.set("payload", DeepJson.toJson(value)));
    return json;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final DomainEvent<?> that = (DomainEvent<?>) o;
    return Objects.equals(id, that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id);
  }

  @Override
  public String toString() {
    return "%s{id=%s, aggregateId=%s, timestamp=%d}"
        .formatted(type, id, aggregateId, timestamp);
  }
}
