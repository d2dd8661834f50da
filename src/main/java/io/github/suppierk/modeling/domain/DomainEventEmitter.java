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
 * Sink receiving {@link DomainEvent}s flushed by {@link
 * Aggregate#publishEvents(DomainEventEmitter)}.
 *
 * <p>Implementations are expected to hand events over to durable storage or a message broker;
 * delivery guarantees are up to the implementation.
 */
@FunctionalInterface
public interface DomainEventEmitter {
  /**
   * @return an instance of emitter which does not perform any operations
   */
  static DomainEventEmitter empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param event to deliver
   */
  void emit(final DomainEvent<?> event);

  /** Default implementation of the fake emitter */
  final class NoOp implements DomainEventEmitter {
    private static final DomainEventEmitter INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void emit(final DomainEvent<?> event) {
      // Do nothing
    }
  }
}
