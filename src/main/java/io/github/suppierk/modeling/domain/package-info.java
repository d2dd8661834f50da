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

/**
 * Building blocks of a domain model.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are running an online shop:
 *
 * <ul>
 *   <li>An amount of money is a {@link io.github.suppierk.modeling.domain.ValueObject} - two
 *       amounts of 10 EUR are interchangeable, we only care about the currency and the amount.
 *   <li>An order number is an {@link io.github.suppierk.modeling.domain.EntityId} - a value object
 *       which tells one order apart from another.
 *   <li>A customer is an {@link io.github.suppierk.modeling.domain.Entity}:
 *       <ul>
 *         <li>Customer can change their name and address, but it is still the same customer as
 *             long as the identifier stays the same.
 *       </ul>
 *   <li>An order with its lines is an {@link io.github.suppierk.modeling.domain.Aggregate}:
 *       <ul>
 *         <li>Adding a line to the order produces a new order with the line added and an {@code
 *             OrderLineAdded} {@link io.github.suppierk.modeling.domain.DomainEvent} waiting for
 *             delivery.
 *         <li>Once the order is persisted, pending events are handed over to a {@link
 *             io.github.suppierk.modeling.domain.DomainEventEmitter}, which can notify the
 *             warehouse about the change.
 *       </ul>
 * </ul>
 *
 * <p>Every domain object is immutable: each change produces a new, validated instance of the same
 * concrete class, while the original instance stays as it was. Structured values are stored as
 * {@link io.github.suppierk.modeling.domain.Props} and {@link
 * io.github.suppierk.modeling.domain.PropsList} which cannot be modified.
 */
package io.github.suppierk.modeling.domain;
