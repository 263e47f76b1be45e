/**
 * Shared test support: policy fixtures, {@link com.ryuqq.policyreplica.testkit.Await}
 * and the store contract test base.
 */
package com.ryuqq.policyreplica.testkit;
