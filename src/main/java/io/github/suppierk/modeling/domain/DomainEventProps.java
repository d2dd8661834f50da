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

/**
 * Full set of properties a {@link DomainEvent} can be created from.
 *
 * <p>Only {@link #aggregateId()} is mandatory, every other {@code null} component is either
 * defaulted by the event or left absent.
 *
 * @param id of the event, defaults to a random UUID
 * @param aggregateId of the aggregate which produced the event
 * @param type of the event, defaults to the simple name of the event class
 * @param timestamp of the event in epoch milliseconds, defaults to the current time
 * @param correlationId linking the event to a wider flow
 * @param causationId of the message which caused the event
 * @param payload of the event
 * @param <P> is the type of the payload
 */
public record DomainEventProps<P>(
    String id,
    String aggregateId,
    String type,
    Long timestamp,
    String correlationId,
    String causationId,
    P payload) {

  /**
   * @param aggregateId of the aggregate which produced the event
   * @return props with every other component absent
   * @param <P> is the type of the payload
   */
  public static <P> DomainEventProps<P> of(final String aggregateId) {
    return new DomainEventProps<>(null, aggregateId, null, null, null, null, null);
  }

  public DomainEventProps<P> withId(final String newId) {
    return new DomainEventProps<>(
        newId, aggregateId, type, timestamp, correlationId, causationId, payload);
  }

  public DomainEventProps<P> withType(final String newType) {
    return new DomainEventProps<>(
        id, aggregateId, newType, timestamp, correlationId, causationId, payload);
  }

  public DomainEventProps<P> withTimestamp(final Long newTimestamp) {
    return new DomainEventProps<>(
        id, aggregateId, type, newTimestamp, correlationId, causationId, payload);
  }

  public DomainEventProps<P> withCorrelationId(final String newCorrelationId) {
    return new DomainEventProps<>(
        id, aggregateId, type, timestamp, newCorrelationId, causationId, payload);
  }

  public DomainEventProps<P> withCausationId(final String newCausationId) {
    return new DomainEventProps<>(
        id, aggregateId, type, timestamp, correlationId, newCausationId, payload);
  }

  /**
   * @param newPayload of the event
   * @return props with the payload replaced
   * @param <N> is the type of the new payload
   */
  public <N> DomainEventProps<N> withPayload(final N newPayload) {
    return new DomainEventProps<>(
        id, aggregateId, type, timestamp, correlationId, causationId, newPayload);
  }
}
