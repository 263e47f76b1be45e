/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the contracts the replication core consumes from the outside world.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.policyreplica.core.spi.PolicyStore} - Durable CRUD and change stream</li>
 *   <li>{@link com.ryuqq.policyreplica.core.spi.ChangeSubscription} - One live change stream subscription</li>
 *   <li>{@link com.ryuqq.policyreplica.core.spi.SubjectMatcher} - Opaque pattern matching predicate</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., replica-adapter-inmemory, a database-backed adapter)
 * provide concrete implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on any store engine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Policy Replica Team
 */
package com.ryuqq.policyreplica.core.spi;
