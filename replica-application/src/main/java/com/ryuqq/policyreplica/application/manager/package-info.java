/**
 * Manager facade package.
 *
 * <p>This package contains the public facade of the replicated policy cache.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (ReplicatedPolicyManager, ChangeFeedConsumer)
 *   ↓ implements
 * application (PolicyManager, ReplicaSynchronizer, WatchHandle)
 *   ↓ depends on
 * core (Policy, PolicyCodec, ReplicaCache, PolicyStore SPI)
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
package com.ryuqq.policyreplica.application.manager;
