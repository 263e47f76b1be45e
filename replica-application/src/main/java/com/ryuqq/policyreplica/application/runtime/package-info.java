/**
 * Runtime contracts for background replica synchronization.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
package com.ryuqq.policyreplica.application.runtime;
