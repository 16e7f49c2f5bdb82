/**
 * Domain building blocks: identifiers, entities, value objects and change-tracking lists.
 *
 * <ul>
 *   <li>{@link com.ryuqq.olympus.core.model.Guid} - unique identifier</li>
 *   <li>{@link com.ryuqq.olympus.core.model.Entity} - identity-based equality</li>
 *   <li>{@link com.ryuqq.olympus.core.model.ValueObject} - value-based equality</li>
 *   <li>{@link com.ryuqq.olympus.core.model.WatchedList} - added/removed item tracking</li>
 *   <li>{@link com.ryuqq.olympus.core.model.DomainException} - domain rule violations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Olympus Team
 */
package com.ryuqq.olympus.core.model;
