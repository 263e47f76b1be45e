/**
 * In-memory {@link com.ryuqq.policyreplica.core.spi.PolicyStore} with a fan-out change feed
 * and fault injection hooks.
 */
package com.ryuqq.policyreplica.adapter.inmemory.store;
