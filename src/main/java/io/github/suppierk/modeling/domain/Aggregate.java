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

import io.github.suppierk.modeling.error.ArgumentInvalidException;
import io.vavr.collection.Vector;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Entity} which buffers {@link DomainEvent}s produced by its state transitions until they
 * are published.
 *
 * <p>The buffer is FIFO and append-only until it is flushed by {@link
 * #publishEvents(DomainEventEmitter)} or discarded by {@link #clearEvents()}. Every props change
 * carries the buffer over to the new instance.
 *
 * <p>Like every other domain object an aggregate is immutable - each operation returns a new
 * instance and leaves the original one, including its buffer, untouched.
 *
 * @param <SELF> is the concrete aggregate type
 * @param <ID> is the type of the aggregate identifier
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class Aggregate<SELF extends Aggregate<SELF, ID>, ID extends EntityId<?, ?>>
    extends Entity<SELF, ID> {
  private static final Logger LOG = LoggerFactory.getLogger(Aggregate.class);

  private final Vector<DomainEvent<?>> events;

  /**
   * @param props of the aggregate
   * @throws ArgumentInvalidException if props did not pass validation
   */
  protected Aggregate(final Map<String, ?> props) {
    this(props, null);
  }

  /**
   * @param props of the aggregate
   * @param events pending delivery, {@code null} is treated as no events
   * @throws ArgumentInvalidException if props did not pass validation
   * @throws IllegalArgumentException if any of the events is {@code null}
   */
  protected Aggregate(final Map<String, ?> props, final Iterable<DomainEvent<?>> events) {
    super(props);

    if (events == null) {
      this.events = Vector.empty();
    } else if (events instanceof Vector<DomainEvent<?>> pending) {
      this.events = pending;
    } else {
      this.events = Vector.ofAll(events);
    }

    if (this.events.contains(null)) {
      throw new IllegalArgumentException("Domain event cannot be null");
    }
  }

  /**
   * Late-bound constructor of the concrete class.
   *
   * @param props for the new instance
   * @param events pending delivery for the new instance
   * @return new instance of the concrete class
   */
  protected abstract SELF newInstance(final Props props, final Iterable<DomainEvent<?>> events);

  /** {@inheritDoc} */
  @Override
  protected final SELF newInstance(final Props props) {
    return newInstance(props, Vector.empty());
  }

  /**
   * @return read-only view of the pending events in the order they were added
   */
  public final List<DomainEvent<?>> events() {
    return events.asJava();
  }

  /**
   * @param event to append to the tail of the pending events
   * @return new instance with the same props and one more pending event
   * @throws IllegalArgumentException if event is {@code null}
   */
  public final SELF addEvent(final DomainEvent<?> event) {
    throwIllegalArgumentIfNull(event, "Domain event");

    return sameClassAs(newInstance(props(), events.append(event)));
  }

  /**
   * Delivers every pending event to the emitter, one call per event, in the order they were added.
   *
   * <p>If the emitter throws, the exception propagates and no new instance is produced - this
   * instance keeps all of its pending events.
   *
   * @param emitter to deliver events to
   * @return new instance with the same props and no pending events
   * @throws IllegalArgumentException if emitter is {@code null}
   */
  public final SELF publishEvents(final DomainEventEmitter emitter) {
    throwIllegalArgumentIfNull(emitter, "Domain event emitter");

    LOG.debug("Publishing {} event(s) of {}", events.size(), getClass().getSimpleName());
    for (DomainEvent<?> event : events) {
      emitter.emit(event);
    }

    return clearEvents();
  }

  /**
   * Discards pending events without delivering them.
   *
   * @return new instance with the same props and no pending events
   */
  public final SELF clearEvents() {
    return sameClassAs(newInstance(props(), Vector.empty()));
  }

  @Override
  final SELF evolveTo(final Props newProps) {
    return sameClassAs(newInstance(newProps, events));
  }
}
